package com.community.tracker.event;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * 挑战完成事件：每个 (成员, 社区, 挑战) 首次达到目标时发布一次。
 * 事件携带发放角色所需的全部信息，账本本身不直接调用聊天平台。
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class ChallengeCompletedEvent {

    private final Long personId;

    private final Long externalUserId;

    private final Long communityId;

    private final String definitionKey;

    private final Long progressValue;

    private final LocalDateTime completedAt;

    /**
     * 要发放的角色；社区未为该挑战配置角色时为 null
     */
    private final Long rewardRoleId;
}
