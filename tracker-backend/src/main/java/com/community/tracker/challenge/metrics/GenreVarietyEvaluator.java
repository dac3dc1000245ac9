package com.community.tracker.challenge.metrics;

import com.community.tracker.challenge.ChallengeMetric;
import com.community.tracker.challenge.ChallengeMetricEvaluator;
import com.community.tracker.client.CatalogSnapshot;
import com.community.tracker.client.MediaStatistics;
import com.community.tracker.entity.ChallengeDefinition;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * GENRE_VARIETY: 至少有一个条目的不同类型数。
 */
@Component
public class GenreVarietyEvaluator implements ChallengeMetricEvaluator {

    @Override
    public ChallengeMetric getMetric() {
        return ChallengeMetric.GENRE_VARIETY;
    }

    @Override
    public long evaluate(ChallengeDefinition definition, CatalogSnapshot snapshot) {
        Set<String> genres = new HashSet<>();
        for (MediaStatistics stats : snapshot.statisticsFor(definition.getMediaType())) {
            for (Map.Entry<String, Integer> genre : stats.getGenres().entrySet()) {
                if (genre.getKey() != null && MediaStatistics.countOf(genre.getValue()) > 0) {
                    genres.add(genre.getKey());
                }
            }
        }
        return genres.size();
    }
}
