package com.community.tracker.service;

import com.community.tracker.dto.LeaderboardEntryDTO;
import com.community.tracker.entity.Person;
import com.community.tracker.entity.ProgressRecord;
import com.community.tracker.exception.TrackerException;
import com.community.tracker.repository.CommunityChallengeSelectionRepository;
import com.community.tracker.repository.CommunityMemberRepository;
import com.community.tracker.repository.PersonRepository;
import com.community.tracker.repository.ProgressRecordRepository;
import com.community.tracker.scope.ScopeToken;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class LeaderboardServiceImpl implements LeaderboardService {

    /**
     * 排序：进度值降序，其次完成时间升序（未完成排最后），最后按成员 ID
     */
    static final Comparator<Row> RANKING = Comparator
            .comparingLong(Row::getValue).reversed()
            .thenComparing(Row::getCompletedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Row::getPersonId);

    private final ProgressRecordRepository progressRepository;
    private final CommunityChallengeSelectionRepository selectionRepository;
    private final CommunityMemberRepository memberRepository;
    private final PersonRepository personRepository;

    public LeaderboardServiceImpl(ProgressRecordRepository progressRepository,
                                  CommunityChallengeSelectionRepository selectionRepository,
                                  CommunityMemberRepository memberRepository,
                                  PersonRepository personRepository) {
        this.progressRepository = progressRepository;
        this.selectionRepository = selectionRepository;
        this.memberRepository = memberRepository;
        this.personRepository = personRepository;
    }

    @Override
    public List<LeaderboardEntryDTO> rank(ScopeToken token, LeaderboardMetric metric, int limit) {
        Long communityId = token.getCommunityId();
        List<Row> rows;
        if (metric.isCompletions()) {
            rows = completionRows(List.of(communityId));
        } else {
            if (!selectionRepository.existsByCommunityIdAndDefinitionKey(communityId, metric.getDefinitionKey())) {
                return new ArrayList<>();
            }
            rows = progressRepository.findByCommunityIdAndDefinitionKey(communityId, metric.getDefinitionKey()).stream()
                    .map(Row::of)
                    .collect(Collectors.toList());
        }
        return toEntries(rows, limit);
    }

    @Override
    public List<LeaderboardEntryDTO> rankCrossCommunity(Long personId, LeaderboardMetric metric, int limit) {
        if (personId == null || !personRepository.existsById(personId)) {
            throw TrackerException.notFound("Person " + personId);
        }
        List<Long> communityIds = memberRepository.findCommunityIdsByPersonId(personId);
        if (communityIds.isEmpty()) {
            return new ArrayList<>();
        }
        List<Row> rows;
        if (metric.isCompletions()) {
            rows = completionRows(communityIds);
        } else {
            // 每个人只保留其在各社区中的最佳记录
            Map<Long, Row> best = new HashMap<>();
            for (ProgressRecord record : progressRepository.findByCommunityIdInAndDefinitionKey(communityIds, metric.getDefinitionKey())) {
                Row row = Row.of(record);
                best.merge(row.getPersonId(), row, (a, b) -> RANKING.compare(a, b) <= 0 ? a : b);
            }
            rows = new ArrayList<>(best.values());
        }
        return toEntries(rows, limit);
    }

    private List<Row> completionRows(Collection<Long> communityIds) {
        List<Row> rows = new ArrayList<>();
        for (Object[] result : progressRepository.countCompletionsByPerson(communityIds)) {
            rows.add(new Row((Long) result[0], ((Number) result[1]).longValue(), (LocalDateTime) result[2]));
        }
        return rows;
    }

    private List<LeaderboardEntryDTO> toEntries(List<Row> rows, int limit) {
        int effectiveLimit = limit < 1 ? DEFAULT_LIMIT : limit;
        List<Row> ranked = rows.stream()
                .sorted(RANKING)
                .limit(effectiveLimit)
                .collect(Collectors.toList());

        Map<Long, String> names = new LinkedHashMap<>();
        for (Person person : personRepository.findAllById(ranked.stream().map(Row::getPersonId).collect(Collectors.toList()))) {
            names.put(person.getPersonId(), person.getDisplayName());
        }

        List<LeaderboardEntryDTO> entries = new ArrayList<>();
        int position = 1;
        for (Row row : ranked) {
            LeaderboardEntryDTO entry = new LeaderboardEntryDTO();
            entry.setRank(position++);
            entry.setPersonId(row.getPersonId());
            entry.setDisplayName(names.get(row.getPersonId()));
            entry.setValue(row.getValue());
            entry.setCompletedAt(row.getCompletedAt());
            entries.add(entry);
        }
        return entries;
    }

    @Getter
    @AllArgsConstructor
    static final class Row {
        private final Long personId;
        private final long value;
        private final LocalDateTime completedAt;

        static Row of(ProgressRecord record) {
            return new Row(record.getPersonId(), record.getProgressValue(), record.getCompletedAt());
        }
    }
}
