package com.community.tracker.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 排行榜条目
 */
@Data
public class LeaderboardEntryDTO {
    private Integer rank;
    private Long personId;
    private String displayName;
    private Long value;
    private LocalDateTime completedAt;
}
