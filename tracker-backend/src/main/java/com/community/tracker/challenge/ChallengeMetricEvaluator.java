package com.community.tracker.challenge;

import com.community.tracker.client.CatalogSnapshot;
import com.community.tracker.entity.ChallengeDefinition;

/**
 * 挑战指标接口。每个实现类负责一种 ChallengeMetric，把目录快照换算成进度值。
 * 实现类均为 Spring Bean，由 {@link ChallengeMetricRegistry} 统一收集。
 */
public interface ChallengeMetricEvaluator {

    /**
     * 该计算器对应的指标（每个指标一个计算器）
     */
    ChallengeMetric getMetric();

    /**
     * 根据快照计算指定挑战的进度值，结果不为负数
     */
    long evaluate(ChallengeDefinition definition, CatalogSnapshot snapshot);
}
