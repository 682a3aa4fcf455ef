package com.al.hl7generator.model.clinical;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Address {
    private String street;
    private String otherDesignation;
    private String city;
    private String state;
    private String postalCode;
    private String country;
}
