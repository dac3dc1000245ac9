package com.community.tracker.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 未部署平台适配器时使用的默认实现，
 * 只记录本应发放的角色。
 */
public class LoggingRoleGrantClient implements RoleGrantClient {

    private static final Logger log = LoggerFactory.getLogger(LoggingRoleGrantClient.class);

    @Override
    public boolean grantRole(Long externalUserId, Long communityId, Long externalRoleId) {
        log.info("Role grant requested: user {} community {} role {} (no platform adapter configured)",
                externalUserId, communityId, externalRoleId);
        return false;
    }
}
