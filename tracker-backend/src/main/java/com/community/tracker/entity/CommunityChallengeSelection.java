package com.community.tracker.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * 社区选用的挑战实例，
 * 每个社区对同一挑战定义最多选用一次。
 */
@Entity
@Table(name = "community_challenge_selection",
       uniqueConstraints = @UniqueConstraint(name = "uk_selection_community_definition", columnNames = {"community_id", "definition_key"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommunityChallengeSelection {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "selection_id")
    private Long selectionId;

    @Column(name = "community_id", nullable = false)
    private Long communityId;

    @Column(name = "definition_key", nullable = false, length = 50)
    private String definitionKey;

    /** target_override: 设置后替代挑战定义的 default_target */
    @Column(name = "target_override")
    private Long targetOverride;

    /** reward_role_id: 完成时发放的角色，优先于 role_config */
    @Column(name = "reward_role_id")
    private Long rewardRoleId;

    @Column(name = "selected_by", nullable = false)
    private Long selectedBy;

    @Column(name = "selected_at", nullable = false)
    private LocalDateTime selectedAt;

    public long effectiveTarget(ChallengeDefinition definition) {
        return targetOverride != null ? targetOverride : definition.getDefaultTarget();
    }
}
