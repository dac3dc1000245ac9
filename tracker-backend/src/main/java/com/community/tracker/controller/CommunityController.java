package com.community.tracker.controller;

import com.community.tracker.dto.CommonResponse;
import com.community.tracker.dto.CommunityDTO;
import com.community.tracker.scope.GuildScopeResolver;
import com.community.tracker.scope.ScopeToken;
import com.community.tracker.service.CommunityService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/communities")
public class CommunityController {

    private final CommunityService communityService;
    private final GuildScopeResolver scopeResolver;

    public CommunityController(CommunityService communityService, GuildScopeResolver scopeResolver) {
        this.communityService = communityService;
        this.scopeResolver = scopeResolver;
    }

    @PostMapping
    public ResponseEntity<CommonResponse<CommunityDTO>> registerCommunity(@RequestBody CommunityDTO request) {
        CommunityDTO community = communityService.registerCommunity(request.getCommunityId(), request.getName());
        return ResponseEntity.ok(CommonResponse.success(community));
    }

    @GetMapping
    public ResponseEntity<CommonResponse<List<CommunityDTO>>> listCommunities() {
        return ResponseEntity.ok(CommonResponse.success(communityService.listCommunities()));
    }

    @GetMapping("/{communityId}")
    public ResponseEntity<CommonResponse<CommunityDTO>> getCommunity(@PathVariable("communityId") Long communityId,
                                                                     @RequestHeader(ApiHeaders.PERSON_ID) Long personId) {
        ScopeToken token = scopeResolver.scope(personId, communityId);
        return ResponseEntity.ok(CommonResponse.success(communityService.getCommunity(token)));
    }

    /**
     * 成员在机器人未见过的社区中首次发言：同时登记社区与成员关系
     */
    @PostMapping("/{communityId}/contact")
    public ResponseEntity<CommonResponse<CommunityDTO>> firstContact(@PathVariable("communityId") Long communityId,
                                                                     @RequestHeader(ApiHeaders.PERSON_ID) Long personId,
                                                                     @RequestParam(required = false) String name) {
        ScopeToken token = scopeResolver.scopeOnFirstContact(personId, communityId, name);
        return ResponseEntity.ok(CommonResponse.success(communityService.getCommunity(token)));
    }

    @PutMapping("/{communityId}/update-channel")
    public ResponseEntity<CommonResponse<CommunityDTO>> setBotUpdateChannel(@PathVariable("communityId") Long communityId,
                                                                            @RequestHeader(ApiHeaders.PERSON_ID) Long personId,
                                                                            @RequestHeader(value = ApiHeaders.PLATFORM_ADMIN, defaultValue = "false") boolean platformAdmin,
                                                                            @RequestParam(required = false) Long channelId) {
        ScopeToken token = scopeResolver.adminScope(personId, communityId, platformAdmin);
        return ResponseEntity.ok(CommonResponse.success(communityService.setBotUpdateChannel(token, channelId)));
    }

    @PutMapping("/{communityId}/moderators/{targetPersonId}")
    public ResponseEntity<CommonResponse<Void>> grantModerator(@PathVariable("communityId") Long communityId,
                                                               @PathVariable("targetPersonId") Long targetPersonId,
                                                               @RequestHeader(ApiHeaders.PERSON_ID) Long personId,
                                                               @RequestHeader(value = ApiHeaders.PLATFORM_ADMIN, defaultValue = "false") boolean platformAdmin) {
        scopeResolver.grantModerator(scopeResolver.adminScope(personId, communityId, platformAdmin), targetPersonId);
        return ResponseEntity.ok(CommonResponse.success());
    }

    @DeleteMapping("/{communityId}/moderators/{targetPersonId}")
    public ResponseEntity<CommonResponse<Void>> revokeModerator(@PathVariable("communityId") Long communityId,
                                                                @PathVariable("targetPersonId") Long targetPersonId,
                                                                @RequestHeader(ApiHeaders.PERSON_ID) Long personId,
                                                                @RequestHeader(value = ApiHeaders.PLATFORM_ADMIN, defaultValue = "false") boolean platformAdmin) {
        scopeResolver.revokeModerator(scopeResolver.adminScope(personId, communityId, platformAdmin), targetPersonId);
        return ResponseEntity.ok(CommonResponse.success());
    }

    @DeleteMapping("/{communityId}")
    public ResponseEntity<CommonResponse<Void>> removeCommunity(@PathVariable("communityId") Long communityId,
                                                                @RequestHeader(ApiHeaders.PERSON_ID) Long personId,
                                                                @RequestHeader(value = ApiHeaders.PLATFORM_ADMIN, defaultValue = "false") boolean platformAdmin) {
        communityService.removeCommunity(scopeResolver.adminScope(personId, communityId, platformAdmin));
        return ResponseEntity.ok(CommonResponse.success());
    }
}
