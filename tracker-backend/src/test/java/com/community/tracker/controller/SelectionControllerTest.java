package com.community.tracker.controller;

import com.community.tracker.challenge.ChallengeMetric;
import com.community.tracker.challenge.ChallengeTier;
import com.community.tracker.dto.SelectionDTO;
import com.community.tracker.exception.TrackerException;
import com.community.tracker.scope.GuildScopeResolver;
import com.community.tracker.scope.ScopeToken;
import com.community.tracker.scope.ScopeTokens;
import com.community.tracker.service.ChallengeCatalogService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SelectionController.class)
class SelectionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ChallengeCatalogService catalogService;

    @MockBean
    private GuildScopeResolver scopeResolver;

    @Test
    void listSelectionsOfCommunity() throws Exception {
        ScopeToken token = ScopeTokens.member(1L, 10L);
        when(scopeResolver.scope(1L, 10L)).thenReturn(token);
        when(catalogService.listSelections(token)).thenReturn(List.of(selection()));

        mockMvc.perform(get("/api/communities/10/selections").header("X-Person-Id", 1L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data[0].definitionKey").value("read-50-manga"))
                .andExpect(jsonPath("$.data[0].target").value(50));
    }

    @Test
    void unknownCommunityIsReportedAsNotConfigured() throws Exception {
        when(scopeResolver.scope(1L, 99L)).thenThrow(TrackerException.unknownCommunity(99L));

        mockMvc.perform(get("/api/communities/99/selections").header("X-Person-Id", 1L))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("UNKNOWN_COMMUNITY"))
                .andExpect(jsonPath("$.message").value("not configured"));
    }

    @Test
    void selectWithoutAdministratorRightsIsForbidden() throws Exception {
        when(scopeResolver.adminScope(1L, 10L, false))
                .thenThrow(TrackerException.permissionDenied("Person 1 is not an administrator of community 10"));

        mockMvc.perform(post("/api/communities/10/selections/read-50-manga").header("X-Person-Id", 1L))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.kind").value("PERMISSION_DENIED"));
        verifyNoInteractions(catalogService);
    }

    @Test
    void selectTwiceIsConflict() throws Exception {
        ScopeToken token = ScopeTokens.admin(1L, 10L);
        when(scopeResolver.adminScope(1L, 10L, true)).thenReturn(token);
        when(catalogService.selectChallenge(eq(token), eq("read-50-manga"), any()))
                .thenThrow(TrackerException.alreadySelected("read-50-manga"));

        mockMvc.perform(post("/api/communities/10/selections/read-50-manga")
                        .header("X-Person-Id", 1L)
                        .header("X-Platform-Admin", true)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetOverride\": 30}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("ALREADY_SELECTED"));
    }

    @Test
    void invalidOverrideIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/communities/10/selections/read-50-manga")
                        .header("X-Person-Id", 1L)
                        .header("X-Platform-Admin", true)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetOverride\": -5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_ARGUMENT"));
        verifyNoInteractions(catalogService);
    }

    @Test
    void removeSelectionReturnsRemovedRecordCount() throws Exception {
        ScopeToken token = ScopeTokens.admin(1L, 10L);
        when(scopeResolver.adminScope(1L, 10L, true)).thenReturn(token);
        when(catalogService.removeSelection(token, "read-50-manga")).thenReturn(3);

        mockMvc.perform(delete("/api/communities/10/selections/read-50-manga")
                        .header("X-Person-Id", 1L)
                        .header("X-Platform-Admin", true))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(3));
    }

    @Test
    void missingPersonHeaderIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/communities/10/selections"))
                .andExpect(status().isBadRequest());
    }

    private SelectionDTO selection() {
        SelectionDTO dto = new SelectionDTO();
        dto.setSelectionId(1L);
        dto.setCommunityId(10L);
        dto.setDefinitionKey("read-50-manga");
        dto.setName("Read 50 manga");
        dto.setMetric(ChallengeMetric.COMPLETED_TITLES);
        dto.setTier(ChallengeTier.SILVER);
        dto.setTarget(50L);
        return dto;
    }
}
