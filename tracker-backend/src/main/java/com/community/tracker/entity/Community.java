package com.community.tracker.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * 对应数据库表 community: one isolation boundary (a guild).
 */
@Entity
@Table(name = "community")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Community {

    /**
     * 聊天平台分配的服务器 ID
     */
    @Id
    @Column(name = "community_id")
    private Long communityId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    /**
     * 接收机器人更新通知的频道，未配置时为 null
     */
    @Column(name = "bot_update_channel_id")
    private Long botUpdateChannelId;

    @Column(name = "registered_at", nullable = false)
    private LocalDateTime registeredAt;
}
