package com.community.tracker.dto;

import com.community.tracker.challenge.ChallengeMetric;
import com.community.tracker.challenge.ChallengeTier;
import com.community.tracker.challenge.MediaType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 挑战定义 DTO，同时用作创建与修正请求的请求体
 */
@Data
public class ChallengeDefinitionDTO {

    @NotBlank
    @Size(max = 50)
    private String definitionKey;

    @NotBlank
    @Size(max = 100)
    private String name;

    private String description;

    @NotNull
    private ChallengeMetric metric;

    @NotNull
    private MediaType mediaType;

    @NotNull
    private ChallengeTier tier;

    @NotNull
    @Positive
    private Long defaultTarget;

    @Size(max = 50)
    private String filterValue;

    // 选用该挑战的社区数（只读）
    private Long selectedCount;
}
