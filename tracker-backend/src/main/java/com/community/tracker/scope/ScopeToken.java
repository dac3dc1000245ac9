package com.community.tracker.scope;

import com.community.tracker.exception.TrackerException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 作用域令牌：代表一个 (成员, 社区) 隔离边界的访问权限。
 * <p>
 * 只有 {@link GuildScopeResolver} 能在确认社区已注册、成员存在后创建令牌。
 * 所有社区范围内的读写都使用令牌而非原始 ID，
 * 查询不会因漏掉过滤条件而读到其他社区的数据。
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ScopeToken {

    private final Long personId;

    private final Long communityId;

    private final boolean administrator;

    ScopeToken(Long personId, Long communityId, boolean administrator) {
        this.personId = personId;
        this.communityId = communityId;
        this.administrator = administrator;
    }

    /**
     * @return 令牌具有该社区管理员权限时返回自身
     * @throws TrackerException 否则为 PERMISSION_DENIED
     */
    public ScopeToken requireAdministrator() {
        if (!administrator) {
            throw TrackerException.permissionDenied(
                    "Person " + personId + " is not an administrator of community " + communityId);
        }
        return this;
    }
}
