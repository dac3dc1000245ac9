package com.community.tracker.challenge;

import com.community.tracker.client.CatalogSnapshot;
import com.community.tracker.entity.ChallengeDefinition;
import com.community.tracker.exception.TrackerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 收集所有已注册的 {@link ChallengeMetricEvaluator}。新增指标只需增加枚举常量与对应的计算器 Bean。
 */
@Component
public class ChallengeMetricRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChallengeMetricRegistry.class);

    private final Map<ChallengeMetric, ChallengeMetricEvaluator> evaluators = new EnumMap<>(ChallengeMetric.class);

    public ChallengeMetricRegistry(List<ChallengeMetricEvaluator> evaluators) {
        for (ChallengeMetricEvaluator evaluator : evaluators) {
            ChallengeMetricEvaluator previous = this.evaluators.put(evaluator.getMetric(), evaluator);
            if (previous != null) {
                throw new IllegalStateException("Duplicate evaluator for metric " + evaluator.getMetric());
            }
        }
        log.info("Registered {} challenge metric evaluators: {}", this.evaluators.size(), this.evaluators.keySet());
    }

    public long evaluate(ChallengeDefinition definition, CatalogSnapshot snapshot) {
        ChallengeMetricEvaluator evaluator = evaluators.get(definition.getMetric());
        if (evaluator == null) {
            throw TrackerException.invalidArgument("No evaluator registered for metric " + definition.getMetric());
        }
        return Math.max(0L, evaluator.evaluate(definition, snapshot));
    }

    public boolean supports(ChallengeMetric metric) {
        return evaluators.containsKey(metric);
    }
}
