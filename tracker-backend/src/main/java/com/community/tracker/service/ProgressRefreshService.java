package com.community.tracker.service;

import com.community.tracker.client.CatalogSnapshot;
import com.community.tracker.client.ProfileClient;
import com.community.tracker.config.TrackerProperties;
import com.community.tracker.dto.ObservationOutcome;
import com.community.tracker.dto.ObservationResultDTO;
import com.community.tracker.dto.RefreshSummaryDTO;
import com.community.tracker.entity.Community;
import com.community.tracker.entity.Person;
import com.community.tracker.exception.TrackerException;
import com.community.tracker.repository.CommunityRepository;
import com.community.tracker.repository.PersonRepository;
import com.community.tracker.scope.GuildScopeResolver;
import com.community.tracker.scope.ScopeToken;
import com.community.tracker.util.ProgressBar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 定时刷新：为每个社区中已绑定账号的成员拉取一次快照并记录进度。
 * 每次运行中同一账号只拉取一次快照，无论该成员在多少个社区中。
 * 单个成员失败只计入失败数，不中断其余社区的刷新。
 */
@Service
public class ProgressRefreshService {

    private static final Logger log = LoggerFactory.getLogger(ProgressRefreshService.class);

    private final CommunityRepository communityRepository;
    private final PersonRepository personRepository;
    private final GuildScopeResolver scopeResolver;
    private final ProgressLedgerService ledgerService;
    private final ProfileClient profileClient;
    private final TrackerProperties properties;
    private final Clock clock;

    public ProgressRefreshService(CommunityRepository communityRepository,
                                  PersonRepository personRepository,
                                  GuildScopeResolver scopeResolver,
                                  ProgressLedgerService ledgerService,
                                  ProfileClient profileClient,
                                  TrackerProperties properties,
                                  Clock clock) {
        this.communityRepository = communityRepository;
        this.personRepository = personRepository;
        this.scopeResolver = scopeResolver;
        this.ledgerService = ledgerService;
        this.profileClient = profileClient;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${tracker.refresh.cron:0 0 4 * * *}")
    public void scheduledRefresh() {
        if (!properties.getRefresh().isEnabled()) {
            log.debug("Scheduled refresh disabled");
            return;
        }
        refreshAll();
    }

    public RefreshSummaryDTO refreshAll() {
        RefreshSummaryDTO summary = new RefreshSummaryDTO();
        summary.setStartedAt(LocalDateTime.now(clock));
        log.info("Progress refresh started.");

        List<Community> communities = communityRepository.findAll(Sort.by("communityId"));
        summary.setCommunities(communities.size());
        ProgressBar progressBar = new ProgressBar("Progress refresh", communities.size());

        // 账号 -> 快照；null 表示拉取失败，本次运行不再重试
        Map<String, CatalogSnapshot> snapshots = new HashMap<>();
        for (Community community : communities) {
            for (Person person : personRepository.findLinkedMembersOfCommunity(community.getCommunityId())) {
                summary.setMembers(summary.getMembers() + 1);
                CatalogSnapshot snapshot = snapshotFor(person, snapshots, summary);
                if (snapshot == null) {
                    continue;
                }
                try {
                    ScopeToken token = scopeResolver.scope(person.getPersonId(), community.getCommunityId());
                    for (ObservationResultDTO result : ledgerService.recordObservations(token, snapshot)) {
                        summary.setObservations(summary.getObservations() + 1);
                        if (result.getOutcome() == ObservationOutcome.COMPLETED) {
                            summary.setCompletions(summary.getCompletions() + 1);
                        }
                    }
                } catch (TrackerException ex) {
                    summary.setFailures(summary.getFailures() + 1);
                    log.warn("Refresh of person {} in community {} failed: {}",
                            person.getPersonId(), community.getCommunityId(), ex.getMessage());
                } catch (RuntimeException ex) {
                    summary.setFailures(summary.getFailures() + 1);
                    log.error("Refresh of person {} in community {} failed unexpectedly",
                            person.getPersonId(), community.getCommunityId(), ex);
                }
            }
            progressBar.step();
        }
        summary.setDurationMs(progressBar.complete());
        log.info("Progress refresh finished: {}", summary);
        return summary;
    }

    /**
     * 按需刷新：令牌对应成员在令牌社区中的进度。
     */
    public List<ObservationResultDTO> refreshMember(ScopeToken token) {
        Person person = personRepository.findById(token.getPersonId())
                .orElseThrow(() -> TrackerException.notFound("Person " + token.getPersonId()));
        if (person.getExternalHandle() == null) {
            throw TrackerException.notLinked(person.getPersonId());
        }
        CatalogSnapshot snapshot = profileClient.fetchCatalogSnapshot(person.getExternalHandle());
        List<ObservationResultDTO> results = ledgerService.recordObservations(token, snapshot);
        log.debug("Refreshed person {} in community {}: {} observations", person.getPersonId(), token.getCommunityId(), results.size());
        return results;
    }

    private CatalogSnapshot snapshotFor(Person person, Map<String, CatalogSnapshot> snapshots, RefreshSummaryDTO summary) {
        String key = person.getExternalHandle().toLowerCase(Locale.ROOT);
        if (snapshots.containsKey(key)) {
            return snapshots.get(key);
        }
        CatalogSnapshot snapshot = null;
        try {
            snapshot = profileClient.fetchCatalogSnapshot(person.getExternalHandle());
            summary.setSnapshotsFetched(summary.getSnapshotsFetched() + 1);
        } catch (TrackerException ex) {
            summary.setFailures(summary.getFailures() + 1);
            log.warn("Snapshot of {} (person {}) unavailable: {}", person.getExternalHandle(), person.getPersonId(), ex.getMessage());
        } catch (RuntimeException ex) {
            summary.setFailures(summary.getFailures() + 1);
            log.error("Snapshot of {} (person {}) failed unexpectedly", person.getExternalHandle(), person.getPersonId(), ex);
        }
        snapshots.put(key, snapshot);
        return snapshot;
    }
}
