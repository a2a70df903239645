package com.al.hl7fhirconverter.model.ir;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AllergyRecord {
    String allergenType;
    String allergenCode;
    String description;
    String reaction;
    String severity;
}
