package com.community.tracker.service;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 排行榜排序依据：某个挑战的进度值，或已完成的挑战数。
 */
@Getter
@ToString
@EqualsAndHashCode
public final class LeaderboardMetric {

    public static final String COMPLETIONS = "COMPLETIONS";

    private final String definitionKey;

    private LeaderboardMetric(String definitionKey) {
        this.definitionKey = definitionKey;
    }

    public static LeaderboardMetric challenge(String definitionKey) {
        if (definitionKey == null || definitionKey.isBlank()) {
            throw new IllegalArgumentException("Definition key is required");
        }
        return new LeaderboardMetric(definitionKey);
    }

    public static LeaderboardMetric completions() {
        return new LeaderboardMetric(null);
    }

    /**
     * "COMPLETIONS"（不区分大小写）或挑战定义键
     */
    public static LeaderboardMetric parse(String value) {
        if (value == null || value.isBlank() || COMPLETIONS.equalsIgnoreCase(value.trim())) {
            return completions();
        }
        return challenge(value.trim());
    }

    public boolean isCompletions() {
        return definitionKey == null;
    }
}
