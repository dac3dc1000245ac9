package com.community.tracker.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 成员的概要统计，每次观测快照时刷新。
 * 全局数据：外部目录数据与社区无关。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "person_stats")
public class PersonStats {

    @Id
    @Column(name = "person_id")
    private Long personId;

    @Column(name = "total_anime", nullable = false)
    private Integer totalAnime;

    @Column(name = "total_manga", nullable = false)
    private Integer totalManga;

    @Column(name = "avg_anime_score", nullable = false, precision = 5, scale = 2)
    private BigDecimal avgAnimeScore;

    @Column(name = "avg_manga_score", nullable = false, precision = 5, scale = 2)
    private BigDecimal avgMangaScore;

    @Column(name = "refreshed_at", nullable = false)
    private LocalDateTime refreshedAt;
}
