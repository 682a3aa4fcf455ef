package com.al.hl7generator.model.clinical;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read-only clinical seed for one message. Only the patient is mandatory.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClinicalBundle {
    private Patient patient;
    private Encounter encounter;
    private Prescription prescription;
    private ObservationResult observation;

    public boolean hasEncounter() {
        return encounter != null;
    }

    public boolean hasPrescription() {
        return prescription != null;
    }

    public boolean hasObservation() {
        return observation != null;
    }
}
