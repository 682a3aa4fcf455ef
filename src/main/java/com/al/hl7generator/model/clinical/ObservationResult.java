package com.al.hl7generator.model.clinical;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A single result value feeding OBX/OBR.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObservationResult {
    private String code;
    private String name;
    private String codingSystem;
    private String valueType;
    private String value;
    private String units;
    private String referenceRange;
    private String abnormalFlag;
    private String resultStatus;
    private LocalDateTime observedAt;
}
