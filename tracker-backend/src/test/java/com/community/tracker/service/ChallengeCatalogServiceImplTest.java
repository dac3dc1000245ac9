package com.community.tracker.service;

import com.community.tracker.challenge.ChallengeMetric;
import com.community.tracker.challenge.ChallengeMetricRegistry;
import com.community.tracker.challenge.ChallengeTier;
import com.community.tracker.challenge.MediaType;
import com.community.tracker.challenge.metrics.CompletedTitlesEvaluator;
import com.community.tracker.challenge.metrics.GenreEntriesEvaluator;
import com.community.tracker.dto.ChallengeDefinitionDTO;
import com.community.tracker.dto.SelectionDTO;
import com.community.tracker.dto.SelectionOverrides;
import com.community.tracker.entity.ChallengeDefinition;
import com.community.tracker.entity.CommunityChallengeSelection;
import com.community.tracker.exception.ErrorKind;
import com.community.tracker.exception.TrackerException;
import com.community.tracker.repository.ChallengeDefinitionRepository;
import com.community.tracker.repository.CommunityChallengeSelectionRepository;
import com.community.tracker.repository.ProgressRecordRepository;
import com.community.tracker.scope.ScopeTokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChallengeCatalogServiceImplTest {

    private static final String KEY = "read-50-manga";

    @Mock
    private ChallengeDefinitionRepository definitionRepository;

    @Mock
    private CommunityChallengeSelectionRepository selectionRepository;

    @Mock
    private ProgressRecordRepository progressRepository;

    private ChallengeCatalogServiceImpl catalogService;

    @BeforeEach
    void setUp() {
        ChallengeMetricRegistry registry = new ChallengeMetricRegistry(
                List.of(new CompletedTitlesEvaluator(), new GenreEntriesEvaluator()));
        catalogService = new ChallengeCatalogServiceImpl(definitionRepository, selectionRepository, progressRepository,
                registry, Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void createDefinitionRejectsDuplicateKey() {
        when(definitionRepository.existsById(KEY)).thenReturn(true);

        TrackerException ex = assertThrows(TrackerException.class, () -> catalogService.createDefinition(dto(KEY)));

        assertEquals(ErrorKind.DUPLICATE_DEFINITION, ex.getKind());
        verify(definitionRepository, never()).save(any());
    }

    @Test
    void createDefinitionRejectsOverlongKey() {
        String key = "k".repeat(ChallengeCatalogServiceImpl.MAX_KEY_LENGTH + 1);

        TrackerException ex = assertThrows(TrackerException.class, () -> catalogService.createDefinition(dto(key)));

        assertEquals(ErrorKind.INVALID_ARGUMENT, ex.getKind());
        verify(definitionRepository, never()).existsById(anyString());
        verify(definitionRepository, never()).save(any());
    }

    @Test
    void createDefinitionAcceptsKeyAtColumnWidth() {
        String key = "k".repeat(ChallengeCatalogServiceImpl.MAX_KEY_LENGTH);
        when(definitionRepository.existsById(key)).thenReturn(false);
        when(definitionRepository.save(any(ChallengeDefinition.class))).thenAnswer(inv -> inv.getArgument(0));

        assertEquals(key, catalogService.createDefinition(dto(key)).getDefinitionKey());
    }

    @Test
    void createDefinitionRequiresFilterForGenreMetric() {
        ChallengeDefinitionDTO dto = dto("romance-20");
        dto.setMetric(ChallengeMetric.GENRE_ENTRIES);
        when(definitionRepository.existsById("romance-20")).thenReturn(false);

        TrackerException ex = assertThrows(TrackerException.class, () -> catalogService.createDefinition(dto));

        assertEquals(ErrorKind.INVALID_ARGUMENT, ex.getKind());
    }

    @Test
    void createDefinitionRejectsMetricWithoutEvaluator() {
        ChallengeDefinitionDTO dto = dto("variety");
        dto.setMetric(ChallengeMetric.GENRE_VARIETY);
        when(definitionRepository.existsById("variety")).thenReturn(false);

        TrackerException ex = assertThrows(TrackerException.class, () -> catalogService.createDefinition(dto));

        assertEquals(ErrorKind.INVALID_ARGUMENT, ex.getKind());
    }

    @Test
    void createDefinitionStoresTemplate() {
        when(definitionRepository.existsById(KEY)).thenReturn(false);
        when(definitionRepository.save(any(ChallengeDefinition.class))).thenAnswer(inv -> inv.getArgument(0));

        ChallengeDefinitionDTO result = catalogService.createDefinition(dto(KEY));

        assertEquals(KEY, result.getDefinitionKey());
        assertEquals(50L, result.getDefaultTarget());
        assertEquals(0L, result.getSelectedCount());
    }

    @Test
    void selectChallengeAppliesOverrides() {
        when(definitionRepository.findById(KEY)).thenReturn(Optional.of(definition()));
        when(selectionRepository.existsByCommunityIdAndDefinitionKey(10L, KEY)).thenReturn(false);
        when(selectionRepository.save(any(CommunityChallengeSelection.class))).thenAnswer(inv -> inv.getArgument(0));

        SelectionDTO result = catalogService.selectChallenge(ScopeTokens.admin(1L, 10L), KEY, new SelectionOverrides(30L, 555L));

        assertEquals(10L, result.getCommunityId());
        assertEquals(30L, result.getTarget());
        assertEquals(555L, result.getRewardRoleId());
    }

    @Test
    void selectChallengeTwiceIsAlreadySelected() {
        when(definitionRepository.findById(KEY)).thenReturn(Optional.of(definition()));
        when(selectionRepository.existsByCommunityIdAndDefinitionKey(10L, KEY)).thenReturn(true);

        TrackerException ex = assertThrows(TrackerException.class,
                () -> catalogService.selectChallenge(ScopeTokens.admin(1L, 10L), KEY, SelectionOverrides.none()));

        assertEquals(ErrorKind.ALREADY_SELECTED, ex.getKind());
    }

    @Test
    void selectUnknownDefinitionIsNotFound() {
        when(definitionRepository.findById("nope")).thenReturn(Optional.empty());

        TrackerException ex = assertThrows(TrackerException.class,
                () -> catalogService.selectChallenge(ScopeTokens.admin(1L, 10L), "nope", null));

        assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
    }

    @Test
    void selectChallengeNeedsAdministrator() {
        TrackerException ex = assertThrows(TrackerException.class,
                () -> catalogService.selectChallenge(ScopeTokens.member(1L, 10L), KEY, null));

        assertEquals(ErrorKind.PERMISSION_DENIED, ex.getKind());
    }

    @Test
    void removeSelectionDeletesOnlyThatCommunitysProgress() {
        CommunityChallengeSelection selection = new CommunityChallengeSelection();
        selection.setCommunityId(10L);
        selection.setDefinitionKey(KEY);
        when(selectionRepository.findByCommunityIdAndDefinitionKey(10L, KEY)).thenReturn(Optional.of(selection));
        when(progressRepository.deleteAllByCommunityIdAndDefinitionKey(10L, KEY)).thenReturn(4);

        int removed = catalogService.removeSelection(ScopeTokens.admin(1L, 10L), KEY);

        assertEquals(4, removed);
        verify(selectionRepository).delete(selection);
        verify(progressRepository, never()).deleteAllByCommunityIdAndDefinitionKey(20L, KEY);
    }

    @Test
    void removeMissingSelectionIsNotFound() {
        when(selectionRepository.findByCommunityIdAndDefinitionKey(10L, KEY)).thenReturn(Optional.empty());

        TrackerException ex = assertThrows(TrackerException.class,
                () -> catalogService.removeSelection(ScopeTokens.admin(1L, 10L), KEY));

        assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
        verify(progressRepository, never()).deleteAllByCommunityIdAndDefinitionKey(anyLong(), anyString());
    }

    @Test
    void correctDefinitionKeepsUnsetFields() {
        when(definitionRepository.findById(KEY)).thenReturn(Optional.of(definition()));
        when(definitionRepository.save(any(ChallengeDefinition.class))).thenAnswer(inv -> inv.getArgument(0));
        when(selectionRepository.countByDefinitionKey(KEY)).thenReturn(2L);
        ChallengeDefinitionDTO changes = new ChallengeDefinitionDTO();
        changes.setDefaultTarget(60L);

        ChallengeDefinitionDTO result = catalogService.correctDefinition(KEY, changes);

        assertEquals(60L, result.getDefaultTarget());
        assertEquals("Read 50 manga", result.getName());
        assertEquals(2L, result.getSelectedCount());
    }

    private ChallengeDefinition definition() {
        ChallengeDefinition definition = new ChallengeDefinition();
        definition.setDefinitionKey(KEY);
        definition.setName("Read 50 manga");
        definition.setMetric(ChallengeMetric.COMPLETED_TITLES);
        definition.setMediaType(MediaType.MANGA);
        definition.setTier(ChallengeTier.SILVER);
        definition.setDefaultTarget(50L);
        return definition;
    }

    private ChallengeDefinitionDTO dto(String key) {
        ChallengeDefinitionDTO dto = new ChallengeDefinitionDTO();
        dto.setDefinitionKey(key);
        dto.setName("Read 50 manga");
        dto.setMetric(ChallengeMetric.COMPLETED_TITLES);
        dto.setMediaType(MediaType.MANGA);
        dto.setTier(ChallengeTier.SILVER);
        dto.setDefaultTarget(50L);
        return dto;
    }
}
