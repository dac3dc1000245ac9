package com.community.tracker.challenge;

public enum MediaType {
    ANIME,
    MANGA,
    /** 动画与漫画统计都计入 */
    ANY
}
