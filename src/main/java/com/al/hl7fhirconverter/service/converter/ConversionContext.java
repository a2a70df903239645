package com.al.hl7fhirconverter.service.converter;

import lombok.Builder;
import lombok.Data;

/**
 * Ids assigned during one conversion. Created per call, never shared.
 */
@Data
@Builder
public class ConversionContext {
    private String patientId;
    private String encounterId;
    private String messageControlId;

    public String patientReference() {
        return "Patient/" + patientId;
    }

    public String encounterReference() {
        return encounterId == null ? null : "Encounter/" + encounterId;
    }
}
