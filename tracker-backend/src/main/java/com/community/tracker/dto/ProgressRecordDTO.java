package com.community.tracker.dto;

import lombok.Data;

import java.time.LocalDateTime;

@Data
public class ProgressRecordDTO {
    private Long personId;
    private Long communityId;
    private String definitionKey;
    private Long value;
    private Long target;
    private LocalDateTime completedAt;   // null until the target is met

    public boolean isCompleted() {
        return completedAt != null;
    }
}
