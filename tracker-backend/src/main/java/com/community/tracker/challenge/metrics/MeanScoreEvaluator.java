package com.community.tracker.challenge.metrics;

import com.community.tracker.challenge.ChallengeMetric;
import com.community.tracker.challenge.ChallengeMetricEvaluator;
import com.community.tracker.client.CatalogSnapshot;
import com.community.tracker.client.MediaStatistics;
import com.community.tracker.entity.ChallengeDefinition;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

/**
 * MEAN_SCORE: 加权平均分，以十分之一为单位（8.5 -> 85）。
 * 已完成作品少于 {@value #MIN_COMPLETED} 部时取 0。
 */
@Component
public class MeanScoreEvaluator implements ChallengeMetricEvaluator {

    static final int MIN_COMPLETED = 10;

    @Override
    public ChallengeMetric getMetric() {
        return ChallengeMetric.MEAN_SCORE;
    }

    @Override
    public long evaluate(ChallengeDefinition definition, CatalogSnapshot snapshot) {
        List<MediaStatistics> stats = snapshot.statisticsFor(definition.getMediaType());
        long completed = stats.stream().mapToLong(MediaStatistics::completedCount).sum();
        if (completed < MIN_COMPLETED) {
            return 0L;
        }

        // 合并评分桶，ANY 时动画与漫画条目权重相同
        MediaStatistics merged = new MediaStatistics();
        for (MediaStatistics s : stats) {
            for (Map.Entry<Integer, Integer> bucket : s.getScores().entrySet()) {
                if (bucket.getKey() != null) {
                    merged.getScores().merge(bucket.getKey(), MediaStatistics.countOf(bucket.getValue()), Integer::sum);
                }
            }
        }
        BigDecimal mean = merged.weightedMeanScore();
        return mean.multiply(BigDecimal.TEN).setScale(0, RoundingMode.DOWN).longValue();
    }
}
