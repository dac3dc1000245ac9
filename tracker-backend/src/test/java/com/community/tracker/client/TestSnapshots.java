package com.community.tracker.client;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * 快照测试数据
 */
public final class TestSnapshots {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private TestSnapshots() {
    }

    public static CatalogSnapshot empty(String handle) {
        return CatalogSnapshot.of(handle, MediaStatistics.empty(), MediaStatistics.empty(), CLOCK);
    }

    /**
     * 只有已完成的漫画，没有评分与类型
     */
    public static CatalogSnapshot completedManga(String handle, int completed) {
        return CatalogSnapshot.of(handle, MediaStatistics.empty(), completed(completed), CLOCK);
    }

    public static CatalogSnapshot completedAnime(String handle, int completed) {
        return CatalogSnapshot.of(handle, completed(completed), MediaStatistics.empty(), CLOCK);
    }

    public static MediaStatistics completed(int completed) {
        MediaStatistics stats = new MediaStatistics();
        stats.setCount(completed);
        stats.getStatuses().put(MediaStatistics.STATUS_COMPLETED, completed);
        return stats;
    }

    public static MediaStatistics withScores(int completed, Map<Integer, Integer> scores) {
        MediaStatistics stats = completed(completed);
        stats.getScores().putAll(scores);
        return stats;
    }
}
