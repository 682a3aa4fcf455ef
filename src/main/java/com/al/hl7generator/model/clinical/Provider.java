package com.al.hl7generator.model.clinical;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Clinician referenced by XCN fields (attending doctor, ordering provider).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Provider {
    private String id;
    private PersonName name;
}
