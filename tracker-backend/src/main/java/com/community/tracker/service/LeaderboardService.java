package com.community.tracker.service;

import com.community.tracker.dto.LeaderboardEntryDTO;
import com.community.tracker.scope.ScopeToken;

import java.util.List;

public interface LeaderboardService {

    int DEFAULT_LIMIT = 10;

    List<LeaderboardEntryDTO> rank(ScopeToken token, LeaderboardMetric metric, int limit);

    /**
     * 在 {@code personId} 所属的所有社区范围内排名，每人一行，取各社区中的最好成绩（完成数取总和）
     */
    List<LeaderboardEntryDTO> rankCrossCommunity(Long personId, LeaderboardMetric metric, int limit);
}
