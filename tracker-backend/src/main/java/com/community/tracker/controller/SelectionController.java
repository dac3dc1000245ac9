package com.community.tracker.controller;

import com.community.tracker.dto.CommonResponse;
import com.community.tracker.dto.SelectionDTO;
import com.community.tracker.dto.SelectionOverrides;
import com.community.tracker.scope.GuildScopeResolver;
import com.community.tracker.scope.ScopeToken;
import com.community.tracker.service.ChallengeCatalogService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/communities/{communityId}/selections")
public class SelectionController {

    private final ChallengeCatalogService catalogService;
    private final GuildScopeResolver scopeResolver;

    public SelectionController(ChallengeCatalogService catalogService, GuildScopeResolver scopeResolver) {
        this.catalogService = catalogService;
        this.scopeResolver = scopeResolver;
    }

    @GetMapping
    public ResponseEntity<CommonResponse<List<SelectionDTO>>> listSelections(@PathVariable("communityId") Long communityId,
                                                                             @RequestHeader(ApiHeaders.PERSON_ID) Long personId) {
        ScopeToken token = scopeResolver.scope(personId, communityId);
        return ResponseEntity.ok(CommonResponse.success(catalogService.listSelections(token)));
    }

    @PostMapping("/{key}")
    public ResponseEntity<CommonResponse<SelectionDTO>> selectChallenge(@PathVariable("communityId") Long communityId,
                                                                        @PathVariable("key") String key,
                                                                        @RequestHeader(ApiHeaders.PERSON_ID) Long personId,
                                                                        @RequestHeader(value = ApiHeaders.PLATFORM_ADMIN, defaultValue = "false") boolean platformAdmin,
                                                                        @Valid @RequestBody(required = false) SelectionOverrides overrides) {
        ScopeToken token = scopeResolver.adminScope(personId, communityId, platformAdmin);
        return ResponseEntity.ok(CommonResponse.success(catalogService.selectChallenge(token, key, overrides)));
    }

    @PutMapping("/{key}")
    public ResponseEntity<CommonResponse<SelectionDTO>> updateSelection(@PathVariable("communityId") Long communityId,
                                                                        @PathVariable("key") String key,
                                                                        @RequestHeader(ApiHeaders.PERSON_ID) Long personId,
                                                                        @RequestHeader(value = ApiHeaders.PLATFORM_ADMIN, defaultValue = "false") boolean platformAdmin,
                                                                        @Valid @RequestBody(required = false) SelectionOverrides overrides) {
        ScopeToken token = scopeResolver.adminScope(personId, communityId, platformAdmin);
        return ResponseEntity.ok(CommonResponse.success(catalogService.updateSelection(token, key, overrides)));
    }

    /**
     * 删除选用记录，连同本社区中该挑战的全部进度
     */
    @DeleteMapping("/{key}")
    public ResponseEntity<CommonResponse<Integer>> removeSelection(@PathVariable("communityId") Long communityId,
                                                                   @PathVariable("key") String key,
                                                                   @RequestHeader(ApiHeaders.PERSON_ID) Long personId,
                                                                   @RequestHeader(value = ApiHeaders.PLATFORM_ADMIN, defaultValue = "false") boolean platformAdmin) {
        ScopeToken token = scopeResolver.adminScope(personId, communityId, platformAdmin);
        return ResponseEntity.ok(CommonResponse.success(catalogService.removeSelection(token, key)));
    }
}
