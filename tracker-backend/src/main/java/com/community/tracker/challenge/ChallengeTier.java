package com.community.tracker.challenge;

/**
 * 挑战难度等级，等级名同时可作为 role_config 的键
 */
public enum ChallengeTier {
    BRONZE,
    SILVER,
    GOLD,
    PLATINUM,
    DIAMOND
}
