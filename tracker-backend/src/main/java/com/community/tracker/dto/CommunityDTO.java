package com.community.tracker.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 社区及其设置，同时用作注册与设置请求的请求体
 */
@Data
public class CommunityDTO {
    private Long communityId;
    private String name;
    private Long botUpdateChannelId;
    private LocalDateTime registeredAt;
}
