package com.community.tracker.event;

import com.community.tracker.client.RoleGrantClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 完成事件监听器：事务提交后向聊天平台发放角色。
 * 发放失败只记录日志、不重试，挑战完成记录保持不变。
 */
@Component
public class RoleGrantListener {

    private static final Logger log = LoggerFactory.getLogger(RoleGrantListener.class);

    private final RoleGrantClient roleGrantClient;

    public RoleGrantListener(RoleGrantClient roleGrantClient) {
        this.roleGrantClient = roleGrantClient;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onChallengeCompleted(ChallengeCompletedEvent event) {
        if (event.getRewardRoleId() == null) {
            log.debug("Challenge {} completed by person {} in community {}, no reward role configured",
                    event.getDefinitionKey(), event.getPersonId(), event.getCommunityId());
            return;
        }
        try {
            boolean granted = roleGrantClient.grantRole(event.getExternalUserId(), event.getCommunityId(), event.getRewardRoleId());
            if (granted) {
                log.info("Granted role {} to user {} in community {} for {}",
                        event.getRewardRoleId(), event.getExternalUserId(), event.getCommunityId(), event.getDefinitionKey());
            } else {
                log.warn("Role grant {} for user {} in community {} was not applied",
                        event.getRewardRoleId(), event.getExternalUserId(), event.getCommunityId());
            }
        } catch (RuntimeException ex) {
            log.error("Role grant {} for user {} in community {} failed: {}",
                    event.getRewardRoleId(), event.getExternalUserId(), event.getCommunityId(), ex.getMessage(), ex);
        }
    }
}
