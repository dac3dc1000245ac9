package com.community.tracker.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 成员已绑定的外部账号
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProfileDTO {
    private Long personId;
    private String externalHandle;
    private Long externalProfileId;
    private LocalDateTime linkedAt;
}
