package com.community.tracker.challenge.metrics;

import com.community.tracker.challenge.ChallengeMetric;
import com.community.tracker.challenge.ChallengeMetricEvaluator;
import com.community.tracker.client.CatalogSnapshot;
import com.community.tracker.client.MediaStatistics;
import com.community.tracker.entity.ChallengeDefinition;
import org.springframework.stereotype.Component;

/**
 * COMPLETED_TITLES: 已完成作品数（如 read-50-manga）
 */
@Component
public class CompletedTitlesEvaluator implements ChallengeMetricEvaluator {

    @Override
    public ChallengeMetric getMetric() {
        return ChallengeMetric.COMPLETED_TITLES;
    }

    @Override
    public long evaluate(ChallengeDefinition definition, CatalogSnapshot snapshot) {
        return snapshot.statisticsFor(definition.getMediaType()).stream()
                .mapToLong(MediaStatistics::completedCount)
                .sum();
    }
}
