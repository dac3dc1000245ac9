package com.community.tracker.service;

import com.community.tracker.challenge.ChallengeMetricRegistry;
import com.community.tracker.client.CatalogSnapshot;
import com.community.tracker.dto.ObservationOutcome;
import com.community.tracker.dto.ObservationResultDTO;
import com.community.tracker.dto.ProgressRecordDTO;
import com.community.tracker.entity.ChallengeDefinition;
import com.community.tracker.entity.CommunityChallengeSelection;
import com.community.tracker.entity.Person;
import com.community.tracker.entity.ProgressRecord;
import com.community.tracker.event.ChallengeCompletedEvent;
import com.community.tracker.exception.TrackerException;
import com.community.tracker.repository.ChallengeDefinitionRepository;
import com.community.tracker.repository.CommunityChallengeSelectionRepository;
import com.community.tracker.repository.PersonRepository;
import com.community.tracker.repository.ProgressRecordRepository;
import com.community.tracker.scope.ScopeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 挑战进度账本：每个 (成员, 社区, 挑战) 一行。
 * <p>
 * 进度值只增不减：写入是一条带条件的 UPDATE，并发观测无法把值改小。
 * 完成时间由第二条条件 UPDATE 设置，影响行数决定由谁发布 {@link ChallengeCompletedEvent}，且只发布一次。
 * <p>
 * 写入事务使用 READ COMMITTED：并发插入的行在 MySQL 默认的 REPEATABLE READ 快照中不可见。
 */
@Service
@Transactional
public class ProgressLedgerServiceImpl implements ProgressLedgerService {

    private static final Logger log = LoggerFactory.getLogger(ProgressLedgerServiceImpl.class);

    static final String INSERT_RECORD_SQL =
            "INSERT INTO progress_record (person_id, community_id, definition_key, progress_value, completed_at, created_at, updated_at) " +
            "VALUES (?, ?, ?, 0, NULL, ?, ?)";

    static final String UPDATE_STATS_SQL =
            "UPDATE person_stats SET total_anime = ?, total_manga = ?, avg_anime_score = ?, avg_manga_score = ?, refreshed_at = ? " +
            "WHERE person_id = ?";

    static final String INSERT_STATS_SQL =
            "INSERT INTO person_stats (person_id, total_anime, total_manga, avg_anime_score, avg_manga_score, refreshed_at) " +
            "VALUES (?, ?, ?, ?, ?, ?)";

    private final ProgressRecordRepository progressRepository;
    private final CommunityChallengeSelectionRepository selectionRepository;
    private final ChallengeDefinitionRepository definitionRepository;
    private final PersonRepository personRepository;
    private final ChallengeMetricRegistry metricRegistry;
    private final RoleConfigService roleConfigService;
    private final ApplicationEventPublisher eventPublisher;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public ProgressLedgerServiceImpl(ProgressRecordRepository progressRepository,
                                     CommunityChallengeSelectionRepository selectionRepository,
                                     ChallengeDefinitionRepository definitionRepository,
                                     PersonRepository personRepository,
                                     ChallengeMetricRegistry metricRegistry,
                                     RoleConfigService roleConfigService,
                                     ApplicationEventPublisher eventPublisher,
                                     JdbcTemplate jdbcTemplate,
                                     Clock clock) {
        this.progressRepository = progressRepository;
        this.selectionRepository = selectionRepository;
        this.definitionRepository = definitionRepository;
        this.personRepository = personRepository;
        this.metricRegistry = metricRegistry;
        this.roleConfigService = roleConfigService;
        this.eventPublisher = eventPublisher;
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public ObservationResultDTO recordObservation(ScopeToken token, String definitionKey, CatalogSnapshot snapshot) {
        requireSnapshot(snapshot);
        CommunityChallengeSelection selection = selectionRepository
                .findByCommunityIdAndDefinitionKey(token.getCommunityId(), definitionKey)
                .orElseThrow(() -> TrackerException.notFound("Selection " + definitionKey));
        ObservationResultDTO result = observe(token, selection, snapshot);
        upsertStats(token.getPersonId(), snapshot);
        return result;
    }

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public List<ObservationResultDTO> recordObservations(ScopeToken token, CatalogSnapshot snapshot) {
        requireSnapshot(snapshot);
        List<ObservationResultDTO> results = new ArrayList<>();
        for (CommunityChallengeSelection selection :
                selectionRepository.findByCommunityIdOrderBySelectedAtAscSelectionIdAsc(token.getCommunityId())) {
            results.add(observe(token, selection, snapshot));
        }
        upsertStats(token.getPersonId(), snapshot);
        return results;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProgressRecordDTO> getProgress(ScopeToken token) {
        Map<String, Long> targets = new HashMap<>();
        for (CommunityChallengeSelection selection :
                selectionRepository.findByCommunityIdOrderBySelectedAtAscSelectionIdAsc(token.getCommunityId())) {
            definitionRepository.findById(selection.getDefinitionKey())
                    .ifPresent(d -> targets.put(d.getDefinitionKey(), selection.effectiveTarget(d)));
        }
        List<ProgressRecordDTO> result = new ArrayList<>();
        for (ProgressRecord record :
                progressRepository.findByPersonIdAndCommunityIdOrderByDefinitionKeyAsc(token.getPersonId(), token.getCommunityId())) {
            result.add(toDTO(record, targets.get(record.getDefinitionKey())));
        }
        return result;
    }

    @Override
    public int resetProgress(ScopeToken token, String definitionKey) {
        token.requireAdministrator();
        if (!selectionRepository.existsByCommunityIdAndDefinitionKey(token.getCommunityId(), definitionKey)) {
            throw TrackerException.notFound("Selection " + definitionKey);
        }
        int reset = progressRepository.resetProgress(token.getCommunityId(), definitionKey, LocalDateTime.now(clock));
        log.info("Community {} reset {} progress records of {} (by person {})",
                token.getCommunityId(), reset, definitionKey, token.getPersonId());
        return reset;
    }

    @Override
    public int removePersonProgress(ScopeToken token, Long personId) {
        token.requireAdministrator();
        if (personId == null) {
            throw TrackerException.invalidArgument("Person id is required");
        }
        int removed = progressRepository.deleteAllByCommunityIdAndPersonId(token.getCommunityId(), personId);
        log.info("Community {} removed {} progress records of person {}", token.getCommunityId(), removed, personId);
        return removed;
    }

    private ObservationResultDTO observe(ScopeToken token, CommunityChallengeSelection selection, CatalogSnapshot snapshot) {
        ChallengeDefinition definition = definitionRepository.findById(selection.getDefinitionKey())
                .orElseThrow(() -> TrackerException.notFound("Challenge definition " + selection.getDefinitionKey()));
        long observed = metricRegistry.evaluate(definition, snapshot);
        long target = selection.effectiveTarget(definition);

        ProgressRecord record = findOrCreate(token.getPersonId(), token.getCommunityId(), definition.getDefinitionKey());
        LocalDateTime now = LocalDateTime.now(clock);

        // 1. 单调写入：只有更大的值才会落库
        int advanced = progressRepository.advanceProgress(record.getRecordId(), observed, now);
        // 2. 完成时间戳只会被设置一次
        int completed = progressRepository.markCompleted(record.getRecordId(), target, now);

        ProgressRecord stored = progressRepository.findById(record.getRecordId())
                .orElseThrow(() -> TrackerException.notFound("Progress record " + record.getRecordId()));

        ObservationOutcome outcome;
        if (completed == 1) {
            outcome = ObservationOutcome.COMPLETED;
            publishCompletion(stored, selection, definition);
        } else if (advanced == 1) {
            outcome = ObservationOutcome.ADVANCED;
        } else {
            outcome = ObservationOutcome.STALE_WRITE;
            log.debug("Stale observation {} for {} of person {} in community {} (stored {})",
                    observed, definition.getDefinitionKey(), token.getPersonId(), token.getCommunityId(), stored.getProgressValue());
        }
        return new ObservationResultDTO(outcome, observed, toDTO(stored, target));
    }

    /**
     * 取得该三元组的进度行，不存在时以 0 插入。
     * 并发插入撞上唯一键不算错误：INSERT 会等待对方提交，随后重新读取对方插入的行。
     */
    private ProgressRecord findOrCreate(Long personId, Long communityId, String definitionKey) {
        Optional<ProgressRecord> existing = progressRepository.findByPersonIdAndCommunityIdAndDefinitionKey(personId, communityId, definitionKey);
        if (existing.isPresent()) {
            return existing.get();
        }
        Timestamp now = Timestamp.valueOf(LocalDateTime.now(clock));
        try {
            jdbcTemplate.update(INSERT_RECORD_SQL, personId, communityId, definitionKey, now, now);
        } catch (DuplicateKeyException ex) {
            log.debug("Progress record for person {} community {} challenge {} created concurrently",
                    personId, communityId, definitionKey);
        }
        return progressRepository.findByPersonIdAndCommunityIdAndDefinitionKey(personId, communityId, definitionKey)
                .orElseThrow(() -> new IllegalStateException(
                        "Progress record missing after insert: " + personId + "/" + communityId + "/" + definitionKey));
    }

    private void publishCompletion(ProgressRecord record, CommunityChallengeSelection selection, ChallengeDefinition definition) {
        Long externalUserId = personRepository.findById(record.getPersonId())
                .map(Person::getExternalUserId)
                .orElse(null);
        Long rewardRoleId = roleConfigService.resolveRewardRole(record.getCommunityId(), selection, definition);
        log.info("Person {} completed {} in community {} with {}",
                record.getPersonId(), definition.getDefinitionKey(), record.getCommunityId(), record.getProgressValue());
        eventPublisher.publishEvent(new ChallengeCompletedEvent(
                record.getPersonId(),
                externalUserId,
                record.getCommunityId(),
                definition.getDefinitionKey(),
                record.getProgressValue(),
                record.getCompletedAt(),
                rewardRoleId));
    }

    // person_stats 是全局数据，不区分社区；先 UPDATE，行不存在再 INSERT，并发插入冲突时回到 UPDATE
    private void upsertStats(Long personId, CatalogSnapshot snapshot) {
        Object[] values = {
                snapshot.getAnime().getCount(),
                snapshot.getManga().getCount(),
                snapshot.getAnime().weightedMeanScore(),
                snapshot.getManga().weightedMeanScore(),
                Timestamp.valueOf(LocalDateTime.now(clock))
        };
        if (updateStats(personId, values) > 0) {
            return;
        }
        try {
            jdbcTemplate.update(INSERT_STATS_SQL, personId, values[0], values[1], values[2], values[3], values[4]);
        } catch (DuplicateKeyException ex) {
            log.debug("Stats row of person {} created concurrently", personId);
            updateStats(personId, values);
        }
    }

    private int updateStats(Long personId, Object[] values) {
        return jdbcTemplate.update(UPDATE_STATS_SQL, values[0], values[1], values[2], values[3], values[4], personId);
    }

    private void requireSnapshot(CatalogSnapshot snapshot) {
        if (snapshot == null) {
            throw TrackerException.invalidArgument("Catalog snapshot is required");
        }
    }

    private ProgressRecordDTO toDTO(ProgressRecord record, Long target) {
        ProgressRecordDTO dto = new ProgressRecordDTO();
        dto.setPersonId(record.getPersonId());
        dto.setCommunityId(record.getCommunityId());
        dto.setDefinitionKey(record.getDefinitionKey());
        dto.setValue(record.getProgressValue());
        dto.setTarget(target);
        dto.setCompletedAt(record.getCompletedAt());
        return dto;
    }
}
