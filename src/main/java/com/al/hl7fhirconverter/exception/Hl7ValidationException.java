package com.al.hl7fhirconverter.exception;

import com.al.hl7fhirconverter.dto.ConversionError;
import lombok.Getter;

import java.util.List;

/**
 * Raised in strict mode when structural validation reports errors.
 */
@Getter
public class Hl7ValidationException extends RuntimeException {

    private final List<ConversionError> violations;

    public Hl7ValidationException(List<ConversionError> violations) {
        super("HL7 message failed structural validation with " + violations.size() + " violation(s)");
        this.violations = List.copyOf(violations);
    }
}
