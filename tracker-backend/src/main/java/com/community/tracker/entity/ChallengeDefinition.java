package com.community.tracker.entity;

import com.community.tracker.challenge.ChallengeMetric;
import com.community.tracker.challenge.ChallengeTier;
import com.community.tracker.challenge.MediaType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * 对应数据库表 challenge_definition.
 * 挑战定义：全局规则模板，所有选用它的社区共享
 */
@Entity
@Table(name = "challenge_definition")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChallengeDefinition {

    /**
     * 唯一键，如 "read-50-manga"（definition_key VARCHAR(50) 主键）
     */
    @Id
    @Column(name = "definition_key", length = 50)
    private String definitionKey;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Lob
    @Column(name = "description")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "metric", nullable = false, length = 30)
    private ChallengeMetric metric;

    @Enumerated(EnumType.STRING)
    @Column(name = "media_type", nullable = false, length = 10)
    private MediaType mediaType;

    @Enumerated(EnumType.STRING)
    @Column(name = "tier", nullable = false, length = 20)
    private ChallengeTier tier;

    /**
     * progress_value >= default_target 时视为达成，社区可覆盖该目标
     */
    @Column(name = "default_target", nullable = false)
    private Long defaultTarget;

    /**
     * 类型、格式或国家代码，取决于指标
     */
    @Column(name = "filter_value", length = 50)
    private String filterValue;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
