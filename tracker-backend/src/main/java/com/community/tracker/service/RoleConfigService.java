package com.community.tracker.service;

import com.community.tracker.entity.ChallengeDefinition;
import com.community.tracker.entity.CommunityChallengeSelection;
import com.community.tracker.scope.ScopeToken;

import java.util.SortedMap;

public interface RoleConfigService {

    void setRole(ScopeToken token, String tierKey, Long externalRoleId);

    SortedMap<String, Long> listRoles(ScopeToken token);

    void removeRole(ScopeToken token, String tierKey);

    /**
     * {@code selection} 完成时发放的角色：优先使用选用记录自带的奖励角色，
     * 其次是按挑战键配置的角色，最后是按挑战等级配置的角色。
     *
     * @return 角色 ID，没有可用角色时为 null
     */
    Long resolveRewardRole(Long communityId, CommunityChallengeSelection selection, ChallengeDefinition definition);
}
