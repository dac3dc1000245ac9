package com.community.tracker.client;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单一媒体类型（动画或漫画）的目录统计，由外部资料服务提供。
 * <p>
 * 各统计桶永不为 null：setter 把 null 换成空表，桶内的 null 计数按 0 处理。
 */
@Data
@NoArgsConstructor
public class MediaStatistics {

    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_PLANNING = "PLANNING";

    // 全部条目数，包含所有状态
    private int count;

    private Map<String, Integer> statuses = new LinkedHashMap<>();

    // 评分 -> 该评分的条目数
    private Map<Integer, Integer> scores = new LinkedHashMap<>();

    private Map<String, Integer> genres = new LinkedHashMap<>();

    private Map<String, Integer> formats = new LinkedHashMap<>();

    // 出品国家代码（JP、KR、CN...）-> 条目数
    private Map<String, Integer> countries = new LinkedHashMap<>();

    public static MediaStatistics empty() {
        return new MediaStatistics();
    }

    public static int countOf(Integer value) {
        return value == null ? 0 : value;
    }

    public void setStatuses(Map<String, Integer> statuses) {
        this.statuses = orEmpty(statuses);
    }

    public void setScores(Map<Integer, Integer> scores) {
        this.scores = orEmpty(scores);
    }

    public void setGenres(Map<String, Integer> genres) {
        this.genres = orEmpty(genres);
    }

    public void setFormats(Map<String, Integer> formats) {
        this.formats = orEmpty(formats);
    }

    public void setCountries(Map<String, Integer> countries) {
        this.countries = orEmpty(countries);
    }

    public int statusCount(String status) {
        return countOf(statuses.get(status));
    }

    public int completedCount() {
        return statusCount(STATUS_COMPLETED);
    }

    /**
     * PLANNING 条目所占比例。格式与国家统计桶包含计划中的条目，
     * 由它们得出的数量需乘以 (1 - planningRatio)。
     */
    public double planningRatio() {
        return count > 0 ? (double) statusCount(STATUS_PLANNING) / count : 0.0;
    }

    /**
     * 按评分桶加权的平均分，保留两位小数；没有评分时为 0。
     */
    public BigDecimal weightedMeanScore() {
        long total = 0;
        long entries = 0;
        for (Map.Entry<Integer, Integer> bucket : scores.entrySet()) {
            if (bucket.getKey() == null) {
                continue;
            }
            int n = countOf(bucket.getValue());
            total += (long) bucket.getKey() * n;
            entries += n;
        }
        if (entries == 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(total).divide(BigDecimal.valueOf(entries), 2, RoundingMode.HALF_UP);
    }

    private static <K> Map<K, Integer> orEmpty(Map<K, Integer> buckets) {
        return buckets != null ? buckets : new LinkedHashMap<>();
    }
}
