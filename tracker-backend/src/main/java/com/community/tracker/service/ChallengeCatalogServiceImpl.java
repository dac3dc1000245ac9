package com.community.tracker.service;

import com.community.tracker.challenge.ChallengeMetric;
import com.community.tracker.challenge.ChallengeMetricRegistry;
import com.community.tracker.dto.ChallengeDefinitionDTO;
import com.community.tracker.dto.SelectionDTO;
import com.community.tracker.dto.SelectionOverrides;
import com.community.tracker.entity.ChallengeDefinition;
import com.community.tracker.entity.CommunityChallengeSelection;
import com.community.tracker.exception.TrackerException;
import com.community.tracker.repository.ChallengeDefinitionRepository;
import com.community.tracker.repository.CommunityChallengeSelectionRepository;
import com.community.tracker.repository.ProgressRecordRepository;
import com.community.tracker.scope.ScopeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Service
@Transactional
public class ChallengeCatalogServiceImpl implements ChallengeCatalogService {

    private static final Logger log = LoggerFactory.getLogger(ChallengeCatalogServiceImpl.class);

    // 与 challenge_definition 的列宽一致
    static final int MAX_KEY_LENGTH = 50;
    static final int MAX_NAME_LENGTH = 100;
    static final int MAX_FILTER_LENGTH = 50;

    private final ChallengeDefinitionRepository definitionRepository;
    private final CommunityChallengeSelectionRepository selectionRepository;
    private final ProgressRecordRepository progressRepository;
    private final ChallengeMetricRegistry metricRegistry;
    private final Clock clock;

    public ChallengeCatalogServiceImpl(ChallengeDefinitionRepository definitionRepository,
                                       CommunityChallengeSelectionRepository selectionRepository,
                                       ProgressRecordRepository progressRepository,
                                       ChallengeMetricRegistry metricRegistry,
                                       Clock clock) {
        this.definitionRepository = definitionRepository;
        this.selectionRepository = selectionRepository;
        this.progressRepository = progressRepository;
        this.metricRegistry = metricRegistry;
        this.clock = clock;
    }

    @Override
    public ChallengeDefinitionDTO createDefinition(ChallengeDefinitionDTO dto) {
        if (dto.getDefinitionKey() == null || dto.getDefinitionKey().isBlank()) {
            throw TrackerException.invalidArgument("Definition key is required");
        }
        String key = dto.getDefinitionKey().trim();
        if (key.length() > MAX_KEY_LENGTH) {
            throw TrackerException.invalidArgument("Definition key must be at most " + MAX_KEY_LENGTH + " characters");
        }
        if (definitionRepository.existsById(key)) {
            throw TrackerException.duplicateDefinition(key);
        }
        if (dto.getName() == null || dto.getMetric() == null || dto.getMediaType() == null
                || dto.getTier() == null || dto.getDefaultTarget() == null) {
            throw TrackerException.invalidArgument("Name, metric, media type, tier and default target are required");
        }

        ChallengeDefinition definition = new ChallengeDefinition();
        definition.setDefinitionKey(key);
        definition.setName(dto.getName());
        definition.setDescription(dto.getDescription());
        definition.setMetric(dto.getMetric());
        definition.setMediaType(dto.getMediaType());
        definition.setTier(dto.getTier());
        definition.setDefaultTarget(dto.getDefaultTarget());
        definition.setFilterValue(dto.getFilterValue());
        validate(definition);

        LocalDateTime now = LocalDateTime.now(clock);
        definition.setCreatedAt(now);
        definition.setUpdatedAt(now);
        ChallengeDefinition saved = definitionRepository.save(definition);
        log.info("Created challenge definition {} ({} {} target {})",
                key, saved.getMetric(), saved.getMediaType(), saved.getDefaultTarget());
        return toDTO(saved, 0L);
    }

    @Override
    public ChallengeDefinitionDTO correctDefinition(String definitionKey, ChallengeDefinitionDTO changes) {
        ChallengeDefinition definition = loadDefinition(definitionKey);
        if (changes.getName() != null) {
            definition.setName(changes.getName());
        }
        if (changes.getDescription() != null) {
            definition.setDescription(changes.getDescription());
        }
        if (changes.getMetric() != null) {
            definition.setMetric(changes.getMetric());
        }
        if (changes.getMediaType() != null) {
            definition.setMediaType(changes.getMediaType());
        }
        if (changes.getTier() != null) {
            definition.setTier(changes.getTier());
        }
        if (changes.getDefaultTarget() != null) {
            definition.setDefaultTarget(changes.getDefaultTarget());
        }
        if (changes.getFilterValue() != null) {
            definition.setFilterValue(changes.getFilterValue());
        }
        validate(definition);
        definition.setUpdatedAt(LocalDateTime.now(clock));
        ChallengeDefinition saved = definitionRepository.save(definition);
        // 已记录的进度保留，新规则从下一次观测起生效
        log.info("Corrected challenge definition {}", definitionKey);
        return toDTO(saved, selectionRepository.countByDefinitionKey(definitionKey));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChallengeDefinitionDTO> listDefinitions() {
        return definitionRepository.findAllByOrderByDefinitionKeyAsc().stream()
                .map(d -> toDTO(d, selectionRepository.countByDefinitionKey(d.getDefinitionKey())))
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public ChallengeDefinitionDTO getDefinition(String definitionKey) {
        ChallengeDefinition definition = loadDefinition(definitionKey);
        return toDTO(definition, selectionRepository.countByDefinitionKey(definitionKey));
    }

    @Override
    public SelectionDTO selectChallenge(ScopeToken token, String definitionKey, SelectionOverrides overrides) {
        token.requireAdministrator();
        ChallengeDefinition definition = loadDefinition(definitionKey);
        if (selectionRepository.existsByCommunityIdAndDefinitionKey(token.getCommunityId(), definitionKey)) {
            throw TrackerException.alreadySelected(definitionKey);
        }
        SelectionOverrides effective = overrides != null ? overrides : SelectionOverrides.none();
        validateOverrides(effective);

        CommunityChallengeSelection selection = new CommunityChallengeSelection();
        selection.setCommunityId(token.getCommunityId());
        selection.setDefinitionKey(definitionKey);
        selection.setTargetOverride(effective.getTargetOverride());
        selection.setRewardRoleId(effective.getRewardRoleId());
        selection.setSelectedBy(token.getPersonId());
        selection.setSelectedAt(LocalDateTime.now(clock));
        CommunityChallengeSelection saved = selectionRepository.save(selection);
        log.info("Community {} selected challenge {} (target {})",
                token.getCommunityId(), definitionKey, saved.effectiveTarget(definition));
        return toDTO(saved, definition);
    }

    @Override
    public SelectionDTO updateSelection(ScopeToken token, String definitionKey, SelectionOverrides overrides) {
        token.requireAdministrator();
        ChallengeDefinition definition = loadDefinition(definitionKey);
        CommunityChallengeSelection selection = selectionRepository
                .findByCommunityIdAndDefinitionKey(token.getCommunityId(), definitionKey)
                .orElseThrow(() -> TrackerException.notFound("Selection " + definitionKey));
        SelectionOverrides effective = overrides != null ? overrides : SelectionOverrides.none();
        validateOverrides(effective);
        // null 表示清除覆盖值，重新使用挑战定义的默认值
        selection.setTargetOverride(effective.getTargetOverride());
        selection.setRewardRoleId(effective.getRewardRoleId());
        CommunityChallengeSelection saved = selectionRepository.save(selection);
        log.info("Community {} updated challenge {} (target {}, role {})",
                token.getCommunityId(), definitionKey, saved.effectiveTarget(definition), saved.getRewardRoleId());
        return toDTO(saved, definition);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SelectionDTO> listSelections(ScopeToken token) {
        return selectionRepository.findByCommunityIdOrderBySelectedAtAscSelectionIdAsc(token.getCommunityId()).stream()
                .map(s -> toDTO(s, loadDefinition(s.getDefinitionKey())))
                .collect(Collectors.toList());
    }

    @Override
    public int removeSelection(ScopeToken token, String definitionKey) {
        token.requireAdministrator();
        CommunityChallengeSelection selection = selectionRepository
                .findByCommunityIdAndDefinitionKey(token.getCommunityId(), definitionKey)
                .orElseThrow(() -> TrackerException.notFound("Selection " + definitionKey));
        int removed = progressRepository.deleteAllByCommunityIdAndDefinitionKey(token.getCommunityId(), definitionKey);
        selectionRepository.delete(selection);
        log.info("Community {} removed challenge {} and {} progress records",
                token.getCommunityId(), definitionKey, removed);
        return removed;
    }

    private void validate(ChallengeDefinition definition) {
        ChallengeMetric metric = definition.getMetric();
        if (!metricRegistry.supports(metric)) {
            throw TrackerException.invalidArgument("Metric " + metric + " is not supported");
        }
        if (metric.isFilterRequired() && (definition.getFilterValue() == null || definition.getFilterValue().isBlank())) {
            throw TrackerException.invalidArgument("Metric " + metric + " requires a filter value");
        }
        if (definition.getDefaultTarget() == null || definition.getDefaultTarget() <= 0) {
            throw TrackerException.invalidArgument("Default target must be positive");
        }
        if (definition.getName().length() > MAX_NAME_LENGTH) {
            throw TrackerException.invalidArgument("Name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (definition.getFilterValue() != null && definition.getFilterValue().length() > MAX_FILTER_LENGTH) {
            throw TrackerException.invalidArgument("Filter value must be at most " + MAX_FILTER_LENGTH + " characters");
        }
    }

    private void validateOverrides(SelectionOverrides overrides) {
        if (overrides.getTargetOverride() != null && overrides.getTargetOverride() <= 0) {
            throw TrackerException.invalidArgument("Custom target must be positive");
        }
    }

    private ChallengeDefinition loadDefinition(String definitionKey) {
        if (definitionKey == null) {
            throw TrackerException.invalidArgument("Definition key is required");
        }
        return definitionRepository.findById(definitionKey)
                .orElseThrow(() -> TrackerException.notFound("Challenge definition " + definitionKey));
    }

    private ChallengeDefinitionDTO toDTO(ChallengeDefinition definition, Long selectedCount) {
        ChallengeDefinitionDTO dto = new ChallengeDefinitionDTO();
        dto.setDefinitionKey(definition.getDefinitionKey());
        dto.setName(definition.getName());
        dto.setDescription(definition.getDescription());
        dto.setMetric(definition.getMetric());
        dto.setMediaType(definition.getMediaType());
        dto.setTier(definition.getTier());
        dto.setDefaultTarget(definition.getDefaultTarget());
        dto.setFilterValue(definition.getFilterValue());
        dto.setSelectedCount(selectedCount);
        return dto;
    }

    private SelectionDTO toDTO(CommunityChallengeSelection selection, ChallengeDefinition definition) {
        SelectionDTO dto = new SelectionDTO();
        dto.setSelectionId(selection.getSelectionId());
        dto.setCommunityId(selection.getCommunityId());
        dto.setDefinitionKey(selection.getDefinitionKey());
        dto.setName(definition.getName());
        dto.setMetric(definition.getMetric());
        dto.setTier(definition.getTier());
        dto.setTarget(selection.effectiveTarget(definition));
        dto.setRewardRoleId(selection.getRewardRoleId());
        dto.setSelectedAt(selection.getSelectedAt());
        return dto;
    }
}
