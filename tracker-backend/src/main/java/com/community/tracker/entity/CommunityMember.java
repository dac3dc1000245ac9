package com.community.tracker.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

@Entity
@Table(name = "community_member",
       uniqueConstraints = @UniqueConstraint(name = "uk_member_person_community", columnNames = {"person_id", "community_id"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommunityMember {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "member_id")
    private Long memberId;

    @Column(name = "person_id", nullable = false)
    private Long personId;

    @Column(name = "community_id", nullable = false)
    private Long communityId;

    // 机器人管理员无需平台权限即可获得管理员作用域
    @Column(name = "moderator", nullable = false)
    private boolean moderator;

    @Column(name = "joined_at", nullable = false)
    private LocalDateTime joinedAt;
}
