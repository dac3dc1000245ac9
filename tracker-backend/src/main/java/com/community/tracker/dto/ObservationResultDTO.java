package com.community.tracker.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ObservationResultDTO {
    private ObservationOutcome outcome;
    // 由快照计算出的值，过期写入时可能低于 record.value
    private Long observedValue;
    private ProgressRecordDTO record;
}
