package com.community.tracker.challenge.metrics;

import com.community.tracker.challenge.ChallengeMetric;
import com.community.tracker.challenge.ChallengeMetricEvaluator;
import com.community.tracker.client.CatalogSnapshot;
import com.community.tracker.client.MediaStatistics;
import com.community.tracker.entity.ChallengeDefinition;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * GENRE_ENTRIES: 带有指定类型标签（filter_value）的条目数，不区分大小写。
 */
@Component
public class GenreEntriesEvaluator implements ChallengeMetricEvaluator {

    @Override
    public ChallengeMetric getMetric() {
        return ChallengeMetric.GENRE_ENTRIES;
    }

    @Override
    public long evaluate(ChallengeDefinition definition, CatalogSnapshot snapshot) {
        String genre = definition.getFilterValue();
        if (genre == null) {
            return 0L;
        }
        long total = 0;
        for (MediaStatistics stats : snapshot.statisticsFor(definition.getMediaType())) {
            for (Map.Entry<String, Integer> entry : stats.getGenres().entrySet()) {
                if (genre.equalsIgnoreCase(entry.getKey()) && entry.getValue() != null) {
                    total += entry.getValue();
                }
            }
        }
        return total;
    }
}
