package com.community.tracker.service;

import com.community.tracker.dto.CommunityDTO;
import com.community.tracker.entity.Community;
import com.community.tracker.exception.TrackerException;
import com.community.tracker.repository.CommunityChallengeSelectionRepository;
import com.community.tracker.repository.CommunityMemberRepository;
import com.community.tracker.repository.CommunityRepository;
import com.community.tracker.repository.ProgressRecordRepository;
import com.community.tracker.repository.RoleConfigRepository;
import com.community.tracker.scope.ScopeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Service
@Transactional
public class CommunityServiceImpl implements CommunityService {

    private static final Logger log = LoggerFactory.getLogger(CommunityServiceImpl.class);

    private final CommunityRepository communityRepository;
    private final CommunityMemberRepository memberRepository;
    private final CommunityChallengeSelectionRepository selectionRepository;
    private final RoleConfigRepository roleConfigRepository;
    private final ProgressRecordRepository progressRepository;
    private final Clock clock;

    public CommunityServiceImpl(CommunityRepository communityRepository,
                                CommunityMemberRepository memberRepository,
                                CommunityChallengeSelectionRepository selectionRepository,
                                RoleConfigRepository roleConfigRepository,
                                ProgressRecordRepository progressRepository,
                                Clock clock) {
        this.communityRepository = communityRepository;
        this.memberRepository = memberRepository;
        this.selectionRepository = selectionRepository;
        this.roleConfigRepository = roleConfigRepository;
        this.progressRepository = progressRepository;
        this.clock = clock;
    }

    @Override
    public CommunityDTO registerCommunity(Long communityId, String name) {
        if (communityId == null) {
            throw TrackerException.invalidArgument("Community id is required");
        }
        Community community = communityRepository.findById(communityId).orElse(null);
        if (community == null) {
            community = new Community();
            community.setCommunityId(communityId);
            community.setRegisteredAt(LocalDateTime.now(clock));
            log.info("Registered community {} ({})", communityId, name);
        }
        if (name != null && !name.isBlank()) {
            community.setName(name);
        } else if (community.getName() == null) {
            community.setName("community-" + communityId);
        }
        return toDTO(communityRepository.save(community));
    }

    @Override
    @Transactional(readOnly = true)
    public CommunityDTO getCommunity(ScopeToken token) {
        return toDTO(loadCommunity(token.getCommunityId()));
    }

    @Override
    @Transactional(readOnly = true)
    public List<CommunityDTO> listCommunities() {
        return communityRepository.findAll(Sort.by("communityId")).stream()
                .map(this::toDTO)
                .collect(Collectors.toList());
    }

    @Override
    public CommunityDTO setBotUpdateChannel(ScopeToken token, Long channelId) {
        token.requireAdministrator();
        Community community = loadCommunity(token.getCommunityId());
        community.setBotUpdateChannelId(channelId);
        log.info("Community {} bot update channel set to {}", community.getCommunityId(), channelId);
        return toDTO(communityRepository.save(community));
    }

    @Override
    public void removeCommunity(ScopeToken token) {
        token.requireAdministrator();
        Long communityId = token.getCommunityId();
        Community community = loadCommunity(communityId);
        int records = progressRepository.deleteAllByCommunityId(communityId);
        int selections = selectionRepository.deleteAllByCommunityId(communityId);
        int roles = roleConfigRepository.deleteAllByCommunityId(communityId);
        int members = memberRepository.deleteAllByCommunityId(communityId);
        communityRepository.deleteById(community.getCommunityId());
        log.info("Removed community {}: {} progress records, {} selections, {} role mappings, {} members",
                communityId, records, selections, roles, members);
    }

    private Community loadCommunity(Long communityId) {
        return communityRepository.findById(communityId)
                .orElseThrow(() -> TrackerException.unknownCommunity(communityId));
    }

    private CommunityDTO toDTO(Community community) {
        CommunityDTO dto = new CommunityDTO();
        dto.setCommunityId(community.getCommunityId());
        dto.setName(community.getName());
        dto.setBotUpdateChannelId(community.getBotUpdateChannelId());
        dto.setRegisteredAt(community.getRegisteredAt());
        return dto;
    }
}
