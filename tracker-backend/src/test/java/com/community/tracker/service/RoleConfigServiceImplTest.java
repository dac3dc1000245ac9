package com.community.tracker.service;

import com.community.tracker.challenge.ChallengeTier;
import com.community.tracker.entity.ChallengeDefinition;
import com.community.tracker.entity.CommunityChallengeSelection;
import com.community.tracker.entity.RoleConfig;
import com.community.tracker.exception.ErrorKind;
import com.community.tracker.exception.TrackerException;
import com.community.tracker.repository.RoleConfigRepository;
import com.community.tracker.scope.ScopeTokens;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RoleConfigServiceImplTest {

    @Mock
    private RoleConfigRepository roleConfigRepository;

    @InjectMocks
    private RoleConfigServiceImpl roleConfigService;

    @Test
    void setRoleReplacesExistingMapping() {
        RoleConfig existing = new RoleConfig(3L, 10L, "GOLD", 100L);
        when(roleConfigRepository.findByCommunityIdAndTierKey(10L, "GOLD")).thenReturn(Optional.of(existing));

        roleConfigService.setRole(ScopeTokens.admin(1L, 10L), "GOLD", 200L);

        verify(roleConfigRepository).save(existing);
        assertThat(existing.getExternalRoleId()).isEqualTo(200L);
    }

    @Test
    void setRoleInsertsIntoTokenCommunity() {
        when(roleConfigRepository.findByCommunityIdAndTierKey(10L, "read-50-manga")).thenReturn(Optional.empty());

        roleConfigService.setRole(ScopeTokens.admin(1L, 10L), "read-50-manga", 300L);

        ArgumentCaptor<RoleConfig> captor = ArgumentCaptor.forClass(RoleConfig.class);
        verify(roleConfigRepository).save(captor.capture());
        assertThat(captor.getValue().getCommunityId()).isEqualTo(10L);
        assertThat(captor.getValue().getTierKey()).isEqualTo("read-50-manga");
        assertThat(captor.getValue().getExternalRoleId()).isEqualTo(300L);
    }

    @Test
    void setRoleNeedsAdministrator() {
        assertThatThrownBy(() -> roleConfigService.setRole(ScopeTokens.member(1L, 10L), "GOLD", 1L))
                .isInstanceOf(TrackerException.class);
        verifyNoInteractions(roleConfigRepository);
    }

    @Test
    void listRolesIsSortedByKey() {
        when(roleConfigRepository.findByCommunityIdOrderByTierKeyAsc(10L)).thenReturn(List.of(
                new RoleConfig(2L, 10L, "SILVER", 20L),
                new RoleConfig(1L, 10L, "GOLD", 10L)));

        SortedMap<String, Long> roles = roleConfigService.listRoles(ScopeTokens.member(1L, 10L));

        assertThat(roles.keySet()).containsExactly("GOLD", "SILVER");
        assertThat(roles.get("SILVER")).isEqualTo(20L);
    }

    @Test
    void removeMissingRoleIsNotFound() {
        when(roleConfigRepository.findByCommunityIdAndTierKey(10L, "GOLD")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> roleConfigService.removeRole(ScopeTokens.admin(1L, 10L), "GOLD"))
                .isInstanceOf(TrackerException.class)
                .extracting(ex -> ((TrackerException) ex).getKind())
                .isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    void rewardRolePrefersSelectionThenDefinitionKeyThenTier() {
        ChallengeDefinition definition = new ChallengeDefinition();
        definition.setDefinitionKey("read-50-manga");
        definition.setTier(ChallengeTier.SILVER);
        CommunityChallengeSelection selection = new CommunityChallengeSelection();

        selection.setRewardRoleId(1L);
        assertThat(roleConfigService.resolveRewardRole(10L, selection, definition)).isEqualTo(1L);

        selection.setRewardRoleId(null);
        when(roleConfigRepository.findByCommunityIdAndTierKey(10L, "read-50-manga"))
                .thenReturn(Optional.of(new RoleConfig(1L, 10L, "read-50-manga", 2L)));
        assertThat(roleConfigService.resolveRewardRole(10L, selection, definition)).isEqualTo(2L);

        when(roleConfigRepository.findByCommunityIdAndTierKey(10L, "SILVER"))
                .thenReturn(Optional.of(new RoleConfig(2L, 10L, "SILVER", 3L)));
        when(roleConfigRepository.findByCommunityIdAndTierKey(10L, "read-50-manga")).thenReturn(Optional.empty());
        assertThat(roleConfigService.resolveRewardRole(10L, selection, definition)).isEqualTo(3L);

        when(roleConfigRepository.findByCommunityIdAndTierKey(10L, "SILVER")).thenReturn(Optional.empty());
        assertThat(roleConfigService.resolveRewardRole(10L, selection, definition)).isNull();
    }
}
