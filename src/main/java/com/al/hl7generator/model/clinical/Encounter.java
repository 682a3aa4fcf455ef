package com.al.hl7generator.model.clinical;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Encounter {

    private String visitNumber;

    /**
     * Patient class from table 0004 (I, O, E, ...)
     */
    private String patientClass;

    private String pointOfCare;
    private String room;
    private String bed;
    private String facility;
    private Provider attendingDoctor;
    private String hospitalService;
    private String admissionType;

    /**
     * Start of the encounter. Anchors all dependent timestamps in a message.
     */
    private LocalDateTime admitDateTime;

    private LocalDateTime dischargeDateTime;
}
