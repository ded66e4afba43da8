package com.codegym.backend.controllers;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;

import com.codegym.backend.entities.MembershipPackage;

class ReceptionControllerIntegrationTest extends IntegrationTestSupport {

    private Map<String, String> form(MembershipPackage pkg, String email) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("fullName", "Hoang Minh Chau");
        body.put("gender", "Female");
        body.put("birthDate", "2000-02-29");
        body.put("phone", "0987654321");
        body.put("email", email);
        body.put("packageId", pkg.getId().toString());
        return body;
    }

    @Test
    void members_requiresAuthentication() throws Exception {
        mockMvc.perform(get("/api/reception/members"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @WithMockUser(roles = "TRAINER")
    void members_requiresReceptionRole() throws Exception {
        mockMvc.perform(get("/api/reception/members"))
                .andExpect(status().isForbidden());
    }

    @Test
    @WithMockUser(username = "reception1", roles = "RECEPTIONIST")
    void register_validForm_createsMemberAndSingleInvoice() throws Exception {
        MembershipPackage threeMonths = savePackage("3 Months", 3, "1200000");

        mockMvc.perform(post("/api/reception/members")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(form(threeMonths, "chau@example.com"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.member.activeUntil").value(TODAY.plusMonths(3).toString()))
                .andExpect(jsonPath("$.data.member.active").value(true))
                .andExpect(jsonPath("$.data.invoice.formattedAmount").value("1,200,000 VND"));

        assertEquals(1, memberRepository.count());
        assertEquals(1, invoiceRepository.count());
    }

    @Test
    @WithMockUser(username = "reception1", roles = "RECEPTIONIST")
    void register_duplicateEmail_returnsBadRequestAndWritesNothing() throws Exception {
        MembershipPackage oneMonth = savePackage("1 Month", 1, "500000");
        saveMember("Existing Member", "taken@example.com", TODAY);

        mockMvc.perform(post("/api/reception/members")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(form(oneMonth, "Taken@Example.com"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errors", hasItem("Email is already registered")));

        assertEquals(1, memberRepository.count());
        assertEquals(0, invoiceRepository.count());
    }

    @Test
    @WithMockUser(username = "reception1", roles = "RECEPTIONIST")
    void register_emptyForm_reportsEveryMissingField() throws Exception {
        mockMvc.perform(post("/api/reception/members")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors", hasSize(6)));
    }

    @Test
    @WithMockUser(username = "reception1", roles = "RECEPTIONIST")
    void members_listsNewestFirstWithActiveFlag() throws Exception {
        saveMember("Lapsed Member", "lapsed@example.com", TODAY.minusDays(1));

        mockMvc.perform(get("/api/reception/members"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].active").value(false));
    }
}
