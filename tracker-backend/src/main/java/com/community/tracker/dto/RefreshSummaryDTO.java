package com.community.tracker.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 一次全量刷新的统计结果
 */
@Data
public class RefreshSummaryDTO {
    private LocalDateTime startedAt;
    private Integer communities = 0;
    private Integer members = 0;          // (person, community) pairs visited
    private Integer snapshotsFetched = 0;
    private Integer observations = 0;
    private Integer completions = 0;
    private Integer failures = 0;
    private Long durationMs;
}
