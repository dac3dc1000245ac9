package com.community.tracker.scope;

import com.community.tracker.config.TrackerProperties;
import com.community.tracker.entity.Community;
import com.community.tracker.entity.CommunityMember;
import com.community.tracker.exception.TrackerException;
import com.community.tracker.repository.CommunityMemberRepository;
import com.community.tracker.repository.CommunityRepository;
import com.community.tracker.repository.PersonRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 社区隔离边界的唯一构建入口。
 * <p>
 * 只为已注册的社区和已存在的成员签发令牌；某对 (成员, 社区) 的首个令牌会记录成员关系，
 * 跨社区排行榜依赖这份成员关系。
 */
@Service
public class GuildScopeResolver {

    private static final Logger log = LoggerFactory.getLogger(GuildScopeResolver.class);

    private final CommunityRepository communityRepository;
    private final CommunityMemberRepository memberRepository;
    private final PersonRepository personRepository;
    private final TrackerProperties properties;
    private final Clock clock;

    public GuildScopeResolver(CommunityRepository communityRepository,
                              CommunityMemberRepository memberRepository,
                              PersonRepository personRepository,
                              TrackerProperties properties,
                              Clock clock) {
        this.communityRepository = communityRepository;
        this.memberRepository = memberRepository;
        this.personRepository = personRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 普通成员作用域。社区 ID 为 null 时回退到配置的主社区。
     *
     * @throws TrackerException 社区未注册时为 UNKNOWN_COMMUNITY
     */
    @Transactional
    public ScopeToken scope(Long personId, Long communityId) {
        CommunityMember member = resolveMember(personId, communityId);
        return new ScopeToken(member.getPersonId(), member.getCommunityId(), member.isModerator());
    }

    /**
     * 管理员作用域。平台认定调用方为社区管理员，或调用方是该社区的机器人管理员时授予。
     *
     * @throws TrackerException 两者都不满足时为 PERMISSION_DENIED
     */
    @Transactional
    public ScopeToken adminScope(Long personId, Long communityId, boolean platformAdministrator) {
        CommunityMember member = resolveMember(personId, communityId);
        if (!platformAdministrator && !member.isModerator()) {
            log.warn("Person {} requested administrator scope in community {} without permission",
                    personId, member.getCommunityId());
            throw TrackerException.permissionDenied(
                    "Person " + personId + " is not an administrator of community " + member.getCommunityId());
        }
        return new ScopeToken(member.getPersonId(), member.getCommunityId(), true);
    }

    /**
     * UNKNOWN_COMMUNITY 的恢复路径：首次接触时先注册社区，再签发令牌
     */
    @Transactional
    public ScopeToken scopeOnFirstContact(Long personId, Long communityId, String communityName) {
        if (communityId == null) {
            throw TrackerException.invalidArgument("Community id is required for first contact");
        }
        if (!communityRepository.existsById(communityId)) {
            Community community = new Community();
            community.setCommunityId(communityId);
            community.setName(communityName != null && !communityName.isBlank() ? communityName : "community-" + communityId);
            community.setRegisteredAt(LocalDateTime.now(clock));
            communityRepository.save(community);
            log.info("Auto-registered community {} ({}) on first contact", communityId, community.getName());
        }
        return scope(personId, communityId);
    }

    @Transactional
    public void grantModerator(ScopeToken token, Long targetPersonId) {
        setModerator(token, targetPersonId, true);
    }

    @Transactional
    public void revokeModerator(ScopeToken token, Long targetPersonId) {
        setModerator(token, targetPersonId, false);
    }

    private void setModerator(ScopeToken token, Long targetPersonId, boolean moderator) {
        token.requireAdministrator();
        CommunityMember target = memberRepository.findByPersonIdAndCommunityId(targetPersonId, token.getCommunityId())
                .orElseThrow(() -> TrackerException.notFound("Member " + targetPersonId));
        target.setModerator(moderator);
        memberRepository.save(target);
        log.info("Moderator flag of person {} in community {} set to {} by {}",
                targetPersonId, token.getCommunityId(), moderator, token.getPersonId());
    }

    private CommunityMember resolveMember(Long personId, Long communityId) {
        Long effectiveCommunityId = communityId != null ? communityId : properties.getPrimaryCommunityId();
        if (effectiveCommunityId == null || !communityRepository.existsById(effectiveCommunityId)) {
            throw TrackerException.unknownCommunity(effectiveCommunityId);
        }
        if (personId == null || !personRepository.existsById(personId)) {
            throw TrackerException.notFound("Person " + personId);
        }
        Optional<CommunityMember> existing = memberRepository.findByPersonIdAndCommunityId(personId, effectiveCommunityId);
        if (existing.isPresent()) {
            return existing.get();
        }
        CommunityMember member = new CommunityMember();
        member.setPersonId(personId);
        member.setCommunityId(effectiveCommunityId);
        member.setModerator(false);
        member.setJoinedAt(LocalDateTime.now(clock));
        log.debug("Person {} joined community {}", personId, effectiveCommunityId);
        return memberRepository.save(member);
    }
}
