package com.al.hl7fhirconverter.exception;

import lombok.Getter;

/**
 * Fatal conversion failure. No partial bundle is produced when this is thrown.
 */
@Getter
public class Hl7ConversionException extends RuntimeException {

    public enum Reason {
        NO_PATIENT,
        NON_NUMERIC_OBSERVATION
    }

    private final Reason reason;

    public Hl7ConversionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Hl7ConversionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static Hl7ConversionException missingPatient() {
        return new Hl7ConversionException(Reason.NO_PATIENT, "No PID segment found");
    }

    public static Hl7ConversionException nonNumericObservation(String code, String value, Throwable cause) {
        return new Hl7ConversionException(Reason.NON_NUMERIC_OBSERVATION,
                "OBX value '" + value + "' for " + code + " is declared NM but is not a number", cause);
    }
}
