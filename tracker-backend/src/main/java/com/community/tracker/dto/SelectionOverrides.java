package com.community.tracker.dto;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 社区选用挑战时的自定义参数，为 null 的字段沿用挑战定义的默认值
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SelectionOverrides {

    @Positive
    private Long targetOverride;

    private Long rewardRoleId;

    public static SelectionOverrides none() {
        return new SelectionOverrides();
    }
}
