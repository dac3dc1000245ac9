package com.community.tracker.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * Person 实体类：每个真实用户一行，在其所属的所有社区间共享
 * 对应 'person' 表
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "person")
public class Person {

    /**
     * person_id: 内部标识，创建后不再变化
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "person_id")
    private Long personId;

    /**
     * external_user_id: 聊天平台用户 ID（唯一）
     */
    @Column(name = "external_user_id", nullable = false, unique = true)
    private Long externalUserId;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    /**
     * external_handle: 已绑定的外部目录用户名，未绑定时为 null
     */
    @Column(name = "external_handle", unique = true, length = 100)
    private String externalHandle;

    /** external_profile_id: 外部目录中该账号的数字 ID */
    @Column(name = "external_profile_id")
    private Long externalProfileId;

    @Column(name = "linked_at")
    private LocalDateTime linkedAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
