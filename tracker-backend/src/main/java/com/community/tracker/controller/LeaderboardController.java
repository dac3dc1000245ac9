package com.community.tracker.controller;

import com.community.tracker.dto.CommonResponse;
import com.community.tracker.dto.LeaderboardEntryDTO;
import com.community.tracker.scope.GuildScopeResolver;
import com.community.tracker.scope.ScopeToken;
import com.community.tracker.service.LeaderboardMetric;
import com.community.tracker.service.LeaderboardService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class LeaderboardController {

    private final LeaderboardService leaderboardService;
    private final GuildScopeResolver scopeResolver;

    public LeaderboardController(LeaderboardService leaderboardService, GuildScopeResolver scopeResolver) {
        this.leaderboardService = leaderboardService;
        this.scopeResolver = scopeResolver;
    }

    /**
     * @param metric 挑战键，或 COMPLETIONS（默认）
     */
    @GetMapping("/communities/{communityId}/leaderboard")
    public ResponseEntity<CommonResponse<List<LeaderboardEntryDTO>>> rank(@PathVariable("communityId") Long communityId,
                                                                          @RequestHeader(ApiHeaders.PERSON_ID) Long personId,
                                                                          @RequestParam(required = false) String metric,
                                                                          @RequestParam(required = false) Integer limit) {
        ScopeToken token = scopeResolver.scope(personId, communityId);
        List<LeaderboardEntryDTO> entries = leaderboardService.rank(token, LeaderboardMetric.parse(metric), limitOf(limit));
        return ResponseEntity.ok(CommonResponse.success(entries));
    }

    @GetMapping("/leaderboard/global")
    public ResponseEntity<CommonResponse<List<LeaderboardEntryDTO>>> rankCrossCommunity(@RequestHeader(ApiHeaders.PERSON_ID) Long personId,
                                                                                        @RequestParam(required = false) String metric,
                                                                                        @RequestParam(required = false) Integer limit) {
        List<LeaderboardEntryDTO> entries = leaderboardService.rankCrossCommunity(personId, LeaderboardMetric.parse(metric), limitOf(limit));
        return ResponseEntity.ok(CommonResponse.success(entries));
    }

    private int limitOf(Integer limit) {
        return limit == null ? LeaderboardService.DEFAULT_LIMIT : limit;
    }
}
