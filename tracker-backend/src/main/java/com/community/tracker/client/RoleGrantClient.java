package com.community.tracker.client;

/**
 * 聊天平台角色发放接口
 */
public interface RoleGrantClient {

    /**
     * 发放角色；对本服务而言只管发出，不关心后续
     *
     * @return 平台接受发放请求时为 true
     */
    boolean grantRole(Long externalUserId, Long communityId, Long externalRoleId);
}
