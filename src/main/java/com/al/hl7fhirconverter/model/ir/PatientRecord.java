package com.al.hl7fhirconverter.model.ir;

import lombok.Builder;
import lombok.Value;

/**
 * Decoded PID segment. The MRN is the only key used for patient identity.
 */
@Value
@Builder
public class PatientRecord {
    String mrn;
    /**
     * PID-3.5, e.g. {@code MR}.
     */
    String identifierType;
    String familyName;
    String givenName;
    /**
     * {@code YYYYMMDD} as sent.
     */
    String birthDate;
    String sex;
}
