package com.community.tracker.controller;

import com.community.tracker.client.CatalogSnapshot;
import com.community.tracker.dto.CommonResponse;
import com.community.tracker.dto.ObservationResultDTO;
import com.community.tracker.dto.ProgressRecordDTO;
import com.community.tracker.dto.RefreshSummaryDTO;
import com.community.tracker.exception.TrackerException;
import com.community.tracker.scope.GuildScopeResolver;
import com.community.tracker.scope.ScopeToken;
import com.community.tracker.service.ProgressLedgerService;
import com.community.tracker.service.ProgressRefreshService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ProgressController {

    private final ProgressLedgerService ledgerService;
    private final ProgressRefreshService refreshService;
    private final GuildScopeResolver scopeResolver;

    public ProgressController(ProgressLedgerService ledgerService,
                              ProgressRefreshService refreshService,
                              GuildScopeResolver scopeResolver) {
        this.ledgerService = ledgerService;
        this.refreshService = refreshService;
        this.scopeResolver = scopeResolver;
    }

    @GetMapping("/communities/{communityId}/progress")
    public ResponseEntity<CommonResponse<List<ProgressRecordDTO>>> getProgress(@PathVariable("communityId") Long communityId,
                                                                               @RequestHeader(ApiHeaders.PERSON_ID) Long personId) {
        ScopeToken token = scopeResolver.scope(personId, communityId);
        return ResponseEntity.ok(CommonResponse.success(ledgerService.getProgress(token)));
    }

    /**
     * 用调用方已拉取的快照记录所有已选用挑战的进度
     */
    @PostMapping("/communities/{communityId}/progress/observations")
    public ResponseEntity<CommonResponse<List<ObservationResultDTO>>> recordObservations(@PathVariable("communityId") Long communityId,
                                                                                         @RequestHeader(ApiHeaders.PERSON_ID) Long personId,
                                                                                         @RequestBody CatalogSnapshot snapshot) {
        ScopeToken token = scopeResolver.scope(personId, communityId);
        return ResponseEntity.ok(CommonResponse.success(ledgerService.recordObservations(token, snapshot)));
    }

    @PostMapping("/communities/{communityId}/progress/{key}/observations")
    public ResponseEntity<CommonResponse<ObservationResultDTO>> recordObservation(@PathVariable("communityId") Long communityId,
                                                                                  @PathVariable("key") String key,
                                                                                  @RequestHeader(ApiHeaders.PERSON_ID) Long personId,
                                                                                  @RequestBody CatalogSnapshot snapshot) {
        ScopeToken token = scopeResolver.scope(personId, communityId);
        return ResponseEntity.ok(CommonResponse.success(ledgerService.recordObservation(token, key, snapshot)));
    }

    // 拉取调用者已绑定账号的最新快照并记录
    @PostMapping("/communities/{communityId}/progress/refresh")
    public ResponseEntity<CommonResponse<List<ObservationResultDTO>>> refresh(@PathVariable("communityId") Long communityId,
                                                                              @RequestHeader(ApiHeaders.PERSON_ID) Long personId) {
        ScopeToken token = scopeResolver.scope(personId, communityId);
        return ResponseEntity.ok(CommonResponse.success(refreshService.refreshMember(token)));
    }

    @PostMapping("/communities/{communityId}/progress/{key}/reset")
    public ResponseEntity<CommonResponse<Integer>> resetProgress(@PathVariable("communityId") Long communityId,
                                                                 @PathVariable("key") String key,
                                                                 @RequestHeader(ApiHeaders.PERSON_ID) Long personId,
                                                                 @RequestHeader(value = ApiHeaders.PLATFORM_ADMIN, defaultValue = "false") boolean platformAdmin) {
        ScopeToken token = scopeResolver.adminScope(personId, communityId, platformAdmin);
        return ResponseEntity.ok(CommonResponse.success(ledgerService.resetProgress(token, key)));
    }

    @DeleteMapping("/communities/{communityId}/progress/persons/{targetPersonId}")
    public ResponseEntity<CommonResponse<Integer>> removePersonProgress(@PathVariable("communityId") Long communityId,
                                                                        @PathVariable("targetPersonId") Long targetPersonId,
                                                                        @RequestHeader(ApiHeaders.PERSON_ID) Long personId,
                                                                        @RequestHeader(value = ApiHeaders.PLATFORM_ADMIN, defaultValue = "false") boolean platformAdmin) {
        ScopeToken token = scopeResolver.adminScope(personId, communityId, platformAdmin);
        return ResponseEntity.ok(CommonResponse.success(ledgerService.removePersonProgress(token, targetPersonId)));
    }

    /**
     * 手动触发定时刷新，仅限机器人运营者
     */
    @PostMapping("/refresh")
    public ResponseEntity<CommonResponse<RefreshSummaryDTO>> refreshAll(
            @RequestHeader(value = ApiHeaders.PLATFORM_ADMIN, defaultValue = "false") boolean platformAdmin) {
        if (!platformAdmin) {
            throw TrackerException.permissionDenied("Refresh of all communities requires operator rights");
        }
        return ResponseEntity.ok(CommonResponse.success(refreshService.refreshAll()));
    }
}
