package com.community.tracker.controller;

import com.community.tracker.dto.LeaderboardEntryDTO;
import com.community.tracker.scope.GuildScopeResolver;
import com.community.tracker.scope.ScopeToken;
import com.community.tracker.scope.ScopeTokens;
import com.community.tracker.service.LeaderboardMetric;
import com.community.tracker.service.LeaderboardService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LeaderboardController.class)
class LeaderboardControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LeaderboardService leaderboardService;

    @MockBean
    private GuildScopeResolver scopeResolver;

    @Test
    void communityLeaderboardForChallenge() throws Exception {
        ScopeToken token = ScopeTokens.member(1L, 10L);
        when(scopeResolver.scope(1L, 10L)).thenReturn(token);
        when(leaderboardService.rank(token, LeaderboardMetric.challenge("read-50-manga"), 5))
                .thenReturn(List.of(entry(1, 1L, "kstorm", 50L)));

        mockMvc.perform(get("/api/communities/10/leaderboard")
                        .header("X-Person-Id", 1L)
                        .param("metric", "read-50-manga")
                        .param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].rank").value(1))
                .andExpect(jsonPath("$.data[0].displayName").value("kstorm"))
                .andExpect(jsonPath("$.data[0].value").value(50));
    }

    @Test
    void completionsIsTheDefaultMetric() throws Exception {
        ScopeToken token = ScopeTokens.member(1L, 10L);
        when(scopeResolver.scope(1L, 10L)).thenReturn(token);
        when(leaderboardService.rank(token, LeaderboardMetric.completions(), LeaderboardService.DEFAULT_LIMIT))
                .thenReturn(List.of());

        mockMvc.perform(get("/api/communities/10/leaderboard").header("X-Person-Id", 1L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());
    }

    @Test
    void globalLeaderboardUsesRequester() throws Exception {
        when(leaderboardService.rankCrossCommunity(1L, LeaderboardMetric.challenge("read-50-manga"), 10))
                .thenReturn(List.of(entry(1, 2L, "mika", 60L), entry(2, 1L, "kstorm", 50L)));

        mockMvc.perform(get("/api/leaderboard/global")
                        .header("X-Person-Id", 1L)
                        .param("metric", "read-50-manga"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].personId").value(2));
    }

    private LeaderboardEntryDTO entry(int rank, Long personId, String name, Long value) {
        LeaderboardEntryDTO entry = new LeaderboardEntryDTO();
        entry.setRank(rank);
        entry.setPersonId(personId);
        entry.setDisplayName(name);
        entry.setValue(value);
        return entry;
    }
}
