package com.community.tracker.controller;

import com.community.tracker.dto.CommonResponse;
import com.community.tracker.dto.RoleConfigRequest;
import com.community.tracker.scope.GuildScopeResolver;
import com.community.tracker.scope.ScopeToken;
import com.community.tracker.service.RoleConfigService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/communities/{communityId}/roles")
public class RoleController {

    private final RoleConfigService roleConfigService;
    private final GuildScopeResolver scopeResolver;

    public RoleController(RoleConfigService roleConfigService, GuildScopeResolver scopeResolver) {
        this.roleConfigService = roleConfigService;
        this.scopeResolver = scopeResolver;
    }

    @GetMapping
    public ResponseEntity<CommonResponse<Map<String, Long>>> listRoles(@PathVariable("communityId") Long communityId,
                                                                       @RequestHeader(ApiHeaders.PERSON_ID) Long personId) {
        ScopeToken token = scopeResolver.scope(personId, communityId);
        Map<String, Long> roles = roleConfigService.listRoles(token);
        return ResponseEntity.ok(CommonResponse.success(roles));
    }

    @PutMapping
    public ResponseEntity<CommonResponse<Void>> setRole(@PathVariable("communityId") Long communityId,
                                                        @RequestHeader(ApiHeaders.PERSON_ID) Long personId,
                                                        @RequestHeader(value = ApiHeaders.PLATFORM_ADMIN, defaultValue = "false") boolean platformAdmin,
                                                        @Valid @RequestBody RoleConfigRequest request) {
        ScopeToken token = scopeResolver.adminScope(personId, communityId, platformAdmin);
        roleConfigService.setRole(token, request.getTierKey(), request.getExternalRoleId());
        return ResponseEntity.ok(CommonResponse.success());
    }

    @DeleteMapping("/{tierKey}")
    public ResponseEntity<CommonResponse<Void>> removeRole(@PathVariable("communityId") Long communityId,
                                                           @PathVariable("tierKey") String tierKey,
                                                           @RequestHeader(ApiHeaders.PERSON_ID) Long personId,
                                                           @RequestHeader(value = ApiHeaders.PLATFORM_ADMIN, defaultValue = "false") boolean platformAdmin) {
        ScopeToken token = scopeResolver.adminScope(personId, communityId, platformAdmin);
        roleConfigService.removeRole(token, tierKey);
        return ResponseEntity.ok(CommonResponse.success());
    }
}
