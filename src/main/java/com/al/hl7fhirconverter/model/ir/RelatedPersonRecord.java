package com.al.hl7fhirconverter.model.ir;

import lombok.Builder;
import lombok.Value;

/**
 * Decoded NK1 segment. When the name carries no components only
 * {@link #rawName} is populated.
 */
@Value
@Builder
public class RelatedPersonRecord {
    String familyName;
    String givenName;
    String rawName;
    String relationshipCode;
    String relationshipText;
    String phone;

    public boolean hasStructuredName() {
        return familyName != null || givenName != null;
    }
}
