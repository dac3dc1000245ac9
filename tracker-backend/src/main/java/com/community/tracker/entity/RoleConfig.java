package com.community.tracker.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对应数据库表 role_config: tier or challenge key -> external role id, per community.
 */
@Entity
@Table(name = "role_config",
       uniqueConstraints = @UniqueConstraint(name = "uk_role_community_tier", columnNames = {"community_id", "tier_key"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoleConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "role_config_id")
    private Long roleConfigId;

    @Column(name = "community_id", nullable = false)
    private Long communityId;

    /**
     * 等级名（如 GOLD）或挑战定义键
     */
    @Column(name = "tier_key", nullable = false, length = 50)
    private String tierKey;

    @Column(name = "external_role_id", nullable = false)
    private Long externalRoleId;
}
