package com.community.tracker.challenge;

/**
 * 挑战定义可使用的进度指标
 */
public enum ChallengeMetric {
    /** 状态为 COMPLETED 的作品数 */
    COMPLETED_TITLES(false),
    /** 加权平均分，以十分之一为单位（8.5 -> 85），完成 10 部作品后才计算 */
    MEAN_SCORE(false),
    /** 至少有一个条目的不同类型数 */
    GENRE_VARIETY(false),
    /** 带有 filter_value 指定类型的条目数 */
    GENRE_ENTRIES(true),
    /** filter_value 指定格式或出品国家的非计划条目数 */
    FORMAT_ENTRIES(true);

    private final boolean filterRequired;

    ChallengeMetric(boolean filterRequired) {
        this.filterRequired = filterRequired;
    }

    public boolean isFilterRequired() {
        return filterRequired;
    }
}
