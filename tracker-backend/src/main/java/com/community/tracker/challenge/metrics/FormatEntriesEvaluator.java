package com.community.tracker.challenge.metrics;

import com.community.tracker.challenge.ChallengeMetric;
import com.community.tracker.challenge.ChallengeMetricEvaluator;
import com.community.tracker.client.CatalogSnapshot;
import com.community.tracker.client.MediaStatistics;
import com.community.tracker.entity.ChallengeDefinition;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * FORMAT_ENTRIES: 某一格式（TV、MOVIE、LIGHT_NOVEL...）或某一出品国家的条目数
 * （JP 为漫画，KR 为韩漫，CN 为国漫）。
 * <p>
 * 格式与国家统计桶包含计划中的作品，因此按 (1 - 计划比例) 缩放后向下取整。
 */
@Component
public class FormatEntriesEvaluator implements ChallengeMetricEvaluator {

    @Override
    public ChallengeMetric getMetric() {
        return ChallengeMetric.FORMAT_ENTRIES;
    }

    @Override
    public long evaluate(ChallengeDefinition definition, CatalogSnapshot snapshot) {
        String filter = definition.getFilterValue();
        if (filter == null) {
            return 0L;
        }
        long total = 0;
        for (MediaStatistics stats : snapshot.statisticsFor(definition.getMediaType())) {
            Integer raw = lookup(stats.getFormats(), filter);
            if (raw == null) {
                raw = lookup(stats.getCountries(), filter);
            }
            if (raw != null) {
                total += (long) (raw * (1 - stats.planningRatio()));
            }
        }
        return total;
    }

    private Integer lookup(Map<String, Integer> buckets, String key) {
        for (Map.Entry<String, Integer> entry : buckets.entrySet()) {
            if (key.equalsIgnoreCase(entry.getKey()) && entry.getValue() != null) {
                return entry.getValue();
            }
        }
        return null;
    }
}
