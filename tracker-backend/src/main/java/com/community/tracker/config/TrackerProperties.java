package com.community.tracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * tracker.* 配置项
 */
@Data
@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {

    /**
     * 调用方未提供社区 ID 时使用的社区（旧版单服务器模式），
     * 为 null 时不回退。
     */
    private Long primaryCommunityId;

    private AniList anilist = new AniList();

    private Refresh refresh = new Refresh();

    @Data
    public static class AniList {
        private String baseUrl = "https://graphql.anilist.co";
    }

    @Data
    public static class Refresh {
        // 定时刷新所有已绑定成员的快照
        private boolean enabled = true;
        private String cron = "0 0 4 * * *";
    }
}
