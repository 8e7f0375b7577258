package org.operaton.activslot.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.operaton.activslot.config.TestcontainersConfiguration;
import org.operaton.activslot.model.domain.Streak;
import org.operaton.activslot.store.KeyValueStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for the planning flow.
 * Tests the full stack from HTTP request to database.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestcontainersConfiguration.class)
@Testcontainers(disabledWithoutDocker = true)
class PlanningFlowIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private KeyValueStore store;

    @Test
    @DisplayName("Values survive the round trip through the database")
    void testKeyValueStore_RoundTrip() {
        store.put("it.streak", new Streak(2, 4, LocalDate.of(2025, 3, 12)));

        assertEquals(Optional.of(new Streak(2, 4, LocalDate.of(2025, 3, 12))), store.get("it.streak", Streak.class));

        store.delete("it.streak");
        assertTrue(store.get("it.streak", Streak.class).isEmpty());
    }

    @Test
    @DisplayName("Import a meeting, generate a plan and complete its first walk")
    void testPlanningFlow() throws Exception {
        // Given: a date in the future, so the whole active window is available
        LocalDate date = LocalDate.now().plusDays(3);
        mockMvc.perform(post("/api/calendar/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Design review\",\"attendeeCount\":6,"
                    + "\"start\":\"" + date.atTime(8, 0) + "\",\"end\":\"" + date.atTime(9, 0) + "\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").exists())
            .andExpect(jsonPath("$.managed").value(false));

        // When
        MvcResult generation = mockMvc.perform(post("/api/plans/" + date + "/generate"))
            .andExpect(request().asyncStarted())
            .andReturn();
        MvcResult planResult = mockMvc.perform(asyncDispatch(generation))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.date").value(date.toString()))
            .andExpect(jsonPath("$.stepsNeeded").value(10000))
            .andExpect(jsonPath("$.activities", not(empty())))
            .andReturn();

        // Then
        JsonNode plan = objectMapper.readTree(planResult.getResponse().getContentAsString());
        String activityId = plan.path("activities").get(0).path("id").asText();

        mockMvc.perform(post("/api/plans/" + date + "/activities/" + activityId + "/complete"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED"));

        mockMvc.perform(get("/api/plans/" + date))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.activities[0].status").value("COMPLETED"));
    }

    @Test
    @DisplayName("Unknown plans give 404")
    void testGetPlan_NotFound() throws Exception {
        mockMvc.perform(get("/api/plans/1999-01-01"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Preferences with an invalid workout duration are rejected")
    void testUpdatePreferences_Invalid() throws Exception {
        mockMvc.perform(put("/api/preferences")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"dailyStepGoal\":8000,\"workoutDuration\":50}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error", containsString("Workout duration")));
    }

    @Test
    @DisplayName("Disabled autopilot runs are skipped")
    void testAutopilotRun_Disabled() throws Exception {
        mockMvc.perform(post("/api/autopilot/run"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.skipped").value(true));
    }
}
