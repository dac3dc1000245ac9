package com.community.tracker.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * ProgressRecord 实体类：某成员在某社区中某个已选用挑战的进度
 * 每个 (person_id, community_id, definition_key) 恰好一行
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "progress_record",
       uniqueConstraints = @UniqueConstraint(name = "uk_progress_triple", columnNames = {"person_id", "community_id", "definition_key"}),
       indexes = @Index(name = "idx_progress_community_definition", columnList = "community_id,definition_key"))
public class ProgressRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "record_id")
    private Long recordId;

    @Column(name = "person_id", nullable = false)
    private Long personId;

    @Column(name = "community_id", nullable = false)
    private Long communityId;

    @Column(name = "definition_key", nullable = false, length = 50)
    private String definitionKey;

    /**
     * progress_value: 单调不减，只有管理员重置时归零
     */
    @Column(name = "progress_value", nullable = false)
    private Long progressValue;

    /**
     * completed_at: 进度首次达到目标时设置，只设置一次
     */
    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
