package com.community.tracker.dto;

import com.community.tracker.challenge.ChallengeMetric;
import com.community.tracker.challenge.ChallengeTier;
import lombok.Data;

import java.time.LocalDateTime;

@Data
public class SelectionDTO {
    private Long selectionId;
    private Long communityId;
    private String definitionKey;
    private String name;
    private ChallengeMetric metric;
    private ChallengeTier tier;
    private Long target;            // override if set, otherwise the definition default
    private Long rewardRoleId;
    private LocalDateTime selectedAt;
}
