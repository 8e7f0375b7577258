package org.operaton.activslot.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.operaton.activslot.exception.PlanningException;
import org.operaton.activslot.model.domain.TrustLevel;
import org.operaton.activslot.model.domain.UserPreferences;
import org.operaton.activslot.store.InMemoryKeyValueStore;
import org.operaton.activslot.store.StoreKeys;

import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for PreferencesService.
 */
@ExtendWith(MockitoExtension.class)
class PreferencesServiceTest {

    @Mock
    private PlanGenerationGuard generationGuard;

    private InMemoryKeyValueStore store;
    private PreferencesService preferencesService;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        preferencesService = new PreferencesService(store, generationGuard);
    }

    @Test
    @DisplayName("Defaults are returned while nothing is stored")
    void testCurrent_Defaults() {
        UserPreferences preferences = preferencesService.current();

        assertEquals(10000, preferences.getDailyStepGoal());
        assertEquals(LocalTime.of(7, 0), preferences.getWakeTime());
        assertEquals(TrustLevel.CONFIRM_FIRST, preferences.getTrustLevel());
        assertFalse(store.contains(StoreKeys.PREFERENCES));
    }

    @Test
    @DisplayName("Saving preferences invalidates running plan generations")
    void testUpdate_Valid() {
        UserPreferences updated = UserPreferences.builder().dailyStepGoal(8000).gymFrequency(4).workoutDuration(60).build();

        preferencesService.update(updated);

        assertEquals(8000, preferencesService.current().getDailyStepGoal());
        assertEquals(4, preferencesService.current().getGymFrequency());
        verify(generationGuard).invalidateInFlight();
    }

    @Test
    @DisplayName("Out-of-range values are rejected and nothing is stored")
    void testUpdate_Invalid() {
        assertThrows(PlanningException.class,
            () -> preferencesService.update(UserPreferences.builder().workoutDuration(50).build()));
        assertThrows(PlanningException.class,
            () -> preferencesService.update(UserPreferences.builder().gymFrequency(2).build()));
        assertThrows(PlanningException.class,
            () -> preferencesService.update(UserPreferences.builder().dailyStepGoal(0).build()));
        assertThrows(PlanningException.class,
            () -> preferencesService.update(UserPreferences.builder().minWalkDuration(40).maxWalkDuration(30).build()));

        assertFalse(store.contains(StoreKeys.PREFERENCES));
        verify(generationGuard, never()).invalidateInFlight();
    }

    @Test
    @DisplayName("Missing times and levels are rejected so stored preferences stay plannable")
    void testUpdate_MissingValues() {
        PlanningException lunch = assertThrows(PlanningException.class,
            () -> preferencesService.update(UserPreferences.builder().lunchTime(null).build()));
        assertEquals("Lunch time is required", lunch.getMessage());
        assertThrows(PlanningException.class,
            () -> preferencesService.update(UserPreferences.builder().wakeTime(null).build()));
        assertThrows(PlanningException.class,
            () -> preferencesService.update(UserPreferences.builder().sleepTime(null).build()));
        assertThrows(PlanningException.class,
            () -> preferencesService.update(UserPreferences.builder().trustLevel(null).build()));
        assertThrows(PlanningException.class,
            () -> preferencesService.update(UserPreferences.builder().preferredWalkTime(null).build()));

        assertFalse(store.contains(StoreKeys.PREFERENCES));
        assertEquals(LocalTime.of(12, 30), preferencesService.current().getLunchTime());
        verify(generationGuard, never()).invalidateInFlight();
    }
}
