package com.community.tracker.dto;

import lombok.Data;

import java.time.LocalDateTime;

@Data
public class PersonDTO {
    private Long personId;
    private Long externalUserId;
    private String displayName;
    private String externalHandle;      // null until linked
    private LocalDateTime linkedAt;
}
