package com.community.tracker.client;

import com.community.tracker.challenge.MediaType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 某一时刻成员在外部目录中的观看/阅读记录，由 {@link ProfileClient} 拉取，账本只读不写。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CatalogSnapshot {

    private String handle;

    private MediaStatistics anime;

    private MediaStatistics manga;

    private LocalDateTime fetchedAt;

    public static CatalogSnapshot of(String handle, MediaStatistics anime, MediaStatistics manga, Clock clock) {
        return new CatalogSnapshot(handle, anime, manga, LocalDateTime.now(clock));
    }

    public MediaStatistics getAnime() {
        return anime != null ? anime : MediaStatistics.empty();
    }

    public MediaStatistics getManga() {
        return manga != null ? manga : MediaStatistics.empty();
    }

    /**
     * 限定媒体类型的挑战所统计的数据
     */
    public List<MediaStatistics> statisticsFor(MediaType mediaType) {
        if (mediaType == null || mediaType == MediaType.ANY) {
            return List.of(getAnime(), getManga());
        }
        return mediaType == MediaType.ANIME ? List.of(getAnime()) : List.of(getManga());
    }
}
