package com.al.hl7generator.model.clinical;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Medication {
    private String code;
    private String name;
    private String codingSystem;
}
