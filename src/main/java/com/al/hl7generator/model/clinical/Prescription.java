package com.al.hl7generator.model.clinical;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Medication order feeding ORC/RXE.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Prescription {
    private String orderNumber;
    private Medication medication;
    private String dose;
    private String doseUnits;
    private String route;
    private String frequency;
    private Provider prescriber;
    private LocalDateTime orderedAt;
}
