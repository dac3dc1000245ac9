package com.community.tracker.service;

import com.community.tracker.entity.ChallengeDefinition;
import com.community.tracker.entity.CommunityChallengeSelection;
import com.community.tracker.entity.RoleConfig;
import com.community.tracker.exception.TrackerException;
import com.community.tracker.repository.RoleConfigRepository;
import com.community.tracker.scope.ScopeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.SortedMap;
import java.util.TreeMap;

@Service
@Transactional
public class RoleConfigServiceImpl implements RoleConfigService {

    private static final Logger log = LoggerFactory.getLogger(RoleConfigServiceImpl.class);

    private final RoleConfigRepository roleConfigRepository;

    public RoleConfigServiceImpl(RoleConfigRepository roleConfigRepository) {
        this.roleConfigRepository = roleConfigRepository;
    }

    @Override
    public void setRole(ScopeToken token, String tierKey, Long externalRoleId) {
        token.requireAdministrator();
        if (tierKey == null || tierKey.isBlank()) {
            throw TrackerException.invalidArgument("Tier key is required");
        }
        if (externalRoleId == null) {
            throw TrackerException.invalidArgument("Role id is required");
        }
        String key = tierKey.trim();
        RoleConfig config = roleConfigRepository.findByCommunityIdAndTierKey(token.getCommunityId(), key)
                .orElseGet(() -> {
                    RoleConfig created = new RoleConfig();
                    created.setCommunityId(token.getCommunityId());
                    created.setTierKey(key);
                    return created;
                });
        config.setExternalRoleId(externalRoleId);
        roleConfigRepository.save(config);
        log.info("Community {} mapped {} to role {}", token.getCommunityId(), key, externalRoleId);
    }

    @Override
    @Transactional(readOnly = true)
    public SortedMap<String, Long> listRoles(ScopeToken token) {
        SortedMap<String, Long> roles = new TreeMap<>();
        for (RoleConfig config : roleConfigRepository.findByCommunityIdOrderByTierKeyAsc(token.getCommunityId())) {
            roles.put(config.getTierKey(), config.getExternalRoleId());
        }
        return roles;
    }

    @Override
    public void removeRole(ScopeToken token, String tierKey) {
        token.requireAdministrator();
        RoleConfig config = roleConfigRepository.findByCommunityIdAndTierKey(token.getCommunityId(), tierKey)
                .orElseThrow(() -> TrackerException.notFound("Role mapping " + tierKey));
        roleConfigRepository.delete(config);
        log.info("Community {} removed role mapping {}", token.getCommunityId(), tierKey);
    }

    @Override
    @Transactional(readOnly = true)
    public Long resolveRewardRole(Long communityId, CommunityChallengeSelection selection, ChallengeDefinition definition) {
        if (selection.getRewardRoleId() != null) {
            return selection.getRewardRoleId();
        }
        return roleConfigRepository.findByCommunityIdAndTierKey(communityId, definition.getDefinitionKey())
                .or(() -> roleConfigRepository.findByCommunityIdAndTierKey(communityId, definition.getTier().name()))
                .map(RoleConfig::getExternalRoleId)
                .orElse(null);
    }
}
