package com.community.tracker.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 进度日志工具类
 * 长时间批处理的进度条，每隔 {@code reportInterval} 个百分点输出一行日志
 */
public class ProgressBar {

    private static final Logger log = LoggerFactory.getLogger(ProgressBar.class);

    private final String taskName;
    private final int totalSteps;
    private final int reportInterval;
    private final long startMillis;
    private int currentStep;
    private int lastReportedPercentage = -1;

    public ProgressBar(String taskName, int totalSteps) {
        this(taskName, totalSteps, 10);
    }

    /**
     * @param reportInterval 两次日志输出之间的百分点间隔
     */
    public ProgressBar(String taskName, int totalSteps, int reportInterval) {
        this.taskName = taskName;
        this.totalSteps = totalSteps > 0 ? totalSteps : 1;
        this.reportInterval = reportInterval > 0 ? reportInterval : 10;
        this.startMillis = System.currentTimeMillis();
        log.info("[{}] started, {} steps", taskName, totalSteps);
    }

    public void step() {
        currentStep = Math.min(currentStep + 1, totalSteps);
        int percentage = getPercentage();
        if (percentage != lastReportedPercentage && percentage % reportInterval == 0) {
            log.info("[{}] {}/{} ({}%) | remaining: {}", taskName, currentStep, totalSteps, percentage, estimateRemaining(percentage));
            lastReportedPercentage = percentage;
        }
    }

    /**
     * @return 耗时（毫秒）
     */
    public long complete() {
        currentStep = totalSteps;
        long duration = System.currentTimeMillis() - startMillis;
        log.info("[{}] finished in {} ms", taskName, duration);
        return duration;
    }

    public int getCurrentStep() {
        return currentStep;
    }

    public int getPercentage() {
        return Math.min(100, (int) ((currentStep * 100.0) / totalSteps));
    }

    private String estimateRemaining(int percentage) {
        if (percentage == 0) {
            return "unknown";
        }
        long elapsedMs = System.currentTimeMillis() - startMillis;
        long remainingMs = (elapsedMs * 100) / percentage - elapsedMs;
        if (remainingMs < 1000) {
            return "<1s";
        } else if (remainingMs < 60000) {
            return (remainingMs / 1000) + "s";
        }
        return (remainingMs / 60000) + "m " + ((remainingMs % 60000) / 1000) + "s";
    }
}
