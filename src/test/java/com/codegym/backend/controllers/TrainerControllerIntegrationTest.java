package com.codegym.backend.controllers;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;

import com.codegym.backend.entities.Exercise;
import com.codegym.backend.entities.Member;
import com.codegym.backend.entities.SystemConfig;
import com.codegym.backend.enums.Role;

class TrainerControllerIntegrationTest extends IntegrationTestSupport {

    private Member member;
    private Exercise squat;
    private Exercise bench;

    @BeforeEach
    void setUpData() {
        saveUser("trainer1", "trainer123", Role.TRAINER, true);
        member = saveMember("Bui Thi Giang", "giang@example.com", TODAY.plusMonths(1));
        squat = saveExercise("Squat", "Legs");
        bench = saveExercise("Bench Press", "Chest");
    }

    private void storeMaxTrainingDays(String value) {
        SystemConfig config = new SystemConfig();
        config.setKey(SystemConfig.MAX_TRAINING_DAYS);
        config.setValue(value);
        systemConfigRepository.save(config);
    }

    private static Map<String, Object> row(Exercise exercise, int sets, String days) {
        return Map.of(
                "exerciseId", exercise.getId().toString(),
                "sets", sets,
                "reps", "8-12",
                "scheduleDay", days
        );
    }

    private String plan(List<Map<String, Object>> rows) throws Exception {
        return objectMapper.writeValueAsString(Map.of("notes", "Week 1", "rows", rows));
    }

    @Test
    @WithMockUser(roles = "CASHIER")
    void plans_requireTrainerRole() throws Exception {
        mockMvc.perform(get("/api/trainer/members"))
                .andExpect(status().isForbidden());
    }

    @Test
    @WithMockUser(username = "trainer1", roles = "TRAINER")
    void createPlan_sevenDaysWithCapOfSix_isRejectedAndNothingIsSaved() throws Exception {
        storeMaxTrainingDays("6");

        mockMvc.perform(post("/api/trainer/members/{memberId}/plans", member.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(plan(List.of(
                                row(squat, 4, "mon,tue,wed,thu"),
                                row(bench, 3, "fri,sat,sun")))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errors", hasSize(1)))
                .andExpect(jsonPath("$.errors[0]", containsString("maximum of 6")))
                .andExpect(jsonPath("$.errors[0]", containsString("7 distinct days")));

        assertEquals(0, workoutPlanRepository.count());
        assertEquals(0, workoutDetailRepository.count());
    }

    @Test
    @WithMockUser(username = "trainer1", roles = "TRAINER")
    void createPlan_withinCap_savesPlanAndDetails() throws Exception {
        storeMaxTrainingDays("3");

        mockMvc.perform(post("/api/trainer/members/{memberId}/plans", member.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(plan(List.of(
                                row(squat, 4, "Mon, Wed"),
                                row(bench, 3, "wed,fri")))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.trainerUsername").value("trainer1"))
                .andExpect(jsonPath("$.data.details", hasSize(2)))
                .andExpect(jsonPath("$.data.details[0].exerciseName").value("Squat"));

        assertEquals(1, workoutPlanRepository.count());
        assertEquals(2, workoutDetailRepository.count());

        mockMvc.perform(get("/api/trainer/members/{memberId}/plans", member.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].details[1].scheduleDay").value("wed,fri"));

        mockMvc.perform(get("/api/trainer/members"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].hasPlan").value(true))
                .andExpect(jsonPath("$.data[0].planCount").value(1));
    }

    @Test
    @WithMockUser(username = "trainer1", roles = "TRAINER")
    void createPlan_invalidRows_areAllReported() throws Exception {
        Map<String, Object> unknownExercise = Map.of(
                "exerciseId", "00000000-0000-0000-0000-000000000000",
                "sets", 3,
                "reps", "10",
                "scheduleDay", "mon");

        mockMvc.perform(post("/api/trainer/members/{memberId}/plans", member.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(plan(List.of(unknownExercise, row(squat, 0, "tue")))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors", hasSize(3)))
                .andExpect(jsonPath("$.errors[0]", containsString("Row 1")))
                .andExpect(jsonPath("$.errors[1]", containsString("Row 2")))
                .andExpect(jsonPath("$.errors[2]").value("Please add at least one exercise."));
    }

    @Test
    @WithMockUser(username = "trainer1", roles = "TRAINER")
    void createPlan_fractionalSets_isRejectedNotTruncated() throws Exception {
        Map<String, Object> fractional = Map.of(
                "exerciseId", squat.getId().toString(),
                "sets", 2.5,
                "reps", "10",
                "scheduleDay", "mon");

        mockMvc.perform(post("/api/trainer/members/{memberId}/plans", member.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(plan(List.of(fractional, row(bench, 3, "tue")))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors", hasSize(1)))
                .andExpect(jsonPath("$.errors[0]", containsString("Row 1")))
                .andExpect(jsonPath("$.errors[0]", containsString("whole number")));

        assertEquals(0, workoutPlanRepository.count());
    }

    @Test
    @WithMockUser(username = "trainer1", roles = "TRAINER")
    void createPlan_nonNumericSets_isReportedWithOtherRowErrors() throws Exception {
        Map<String, Object> textSets = Map.of(
                "exerciseId", squat.getId().toString(),
                "sets", "abc",
                "reps", "10",
                "scheduleDay", "mon");
        Map<String, Object> badExercise = Map.of(
                "exerciseId", "not-a-uuid",
                "sets", 3,
                "reps", "10",
                "scheduleDay", "tue");

        mockMvc.perform(post("/api/trainer/members/{memberId}/plans", member.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(plan(List.of(textSets, badExercise))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors", hasSize(3)))
                .andExpect(jsonPath("$.errors[0]", containsString("Row 1")))
                .andExpect(jsonPath("$.errors[0]", containsString("whole number")))
                .andExpect(jsonPath("$.errors[1]", containsString("Row 2")))
                .andExpect(jsonPath("$.errors[1]", containsString("Exercise not found")))
                .andExpect(jsonPath("$.errors[2]").value("Please add at least one exercise."));

        assertEquals(0, workoutPlanRepository.count());
    }

    @Test
    @WithMockUser(username = "trainer1", roles = "TRAINER")
    void createPlan_unknownMember_isNotFound() throws Exception {
        mockMvc.perform(post("/api/trainer/members/{memberId}/plans", "not-a-member")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(plan(List.of(row(squat, 3, "mon")))))
                .andExpect(status().isNotFound());
    }

    @Test
    @WithMockUser(username = "trainer1", roles = "TRAINER")
    void maxTrainingDays_invalidStoredValue_fallsBackToSix() throws Exception {
        storeMaxTrainingDays("lots");

        mockMvc.perform(get("/api/trainer/settings/max-training-days"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(6));
    }
}
