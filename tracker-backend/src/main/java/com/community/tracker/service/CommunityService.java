package com.community.tracker.service;

import com.community.tracker.dto.CommunityDTO;
import com.community.tracker.scope.ScopeToken;

import java.util.List;

public interface CommunityService {

    /**
     * 注册社区；已注册时更新名称
     */
    CommunityDTO registerCommunity(Long communityId, String name);

    CommunityDTO getCommunity(ScopeToken token);

    List<CommunityDTO> listCommunities();

    /**
     * 设置接收机器人通知的频道；null 表示清除
     */
    CommunityDTO setBotUpdateChannel(ScopeToken token, Long channelId);

    /**
     * 删除社区及其成员、挑战选用、角色配置与进度
     */
    void removeCommunity(ScopeToken token);
}
