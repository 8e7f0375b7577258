package org.operaton.activslot.controller;

import lombok.RequiredArgsConstructor;
import org.operaton.activslot.model.domain.UserPreferences;
import org.operaton.activslot.service.PreferencesService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the user's routine and planning preferences.
 */
@RestController
@RequestMapping("/api/preferences")
@RequiredArgsConstructor
public class PreferencesController {

    private final PreferencesService preferencesService;

    @GetMapping
    public UserPreferences getPreferences() {
        return preferencesService.current();
    }

    @PutMapping
    public UserPreferences updatePreferences(@RequestBody UserPreferences preferences) {
        return preferencesService.update(preferences);
    }
}
