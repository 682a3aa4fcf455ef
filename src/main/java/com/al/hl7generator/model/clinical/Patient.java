package com.al.hl7generator.model.clinical;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Patient {

    /**
     * External patient identifier (PID-2)
     */
    private String id;

    /**
     * Medical record number (PID-3)
     */
    private String mrn;

    /**
     * Patient account number (PID-18)
     */
    private String accountNumber;

    private String ssn;
    private PersonName name;
    private LocalDate birthDate;

    /**
     * Administrative sex code from table 0001 (M, F, O, U)
     */
    private String gender;

    private String race;
    private Address address;
    private String phoneNumber;
    private String email;
    private String maritalStatus;
    private String language;
    private String religion;
}
