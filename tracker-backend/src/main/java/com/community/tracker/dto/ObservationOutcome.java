package com.community.tracker.dto;

public enum ObservationOutcome {
    /** 进度值提高，但本次没有新完成挑战 */
    ADVANCED,
    /** 本次观测首次达到目标 */
    COMPLETED,
    /** 观测值不高于已存值，未写入 */
    STALE_WRITE
}
