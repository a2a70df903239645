package com.al.hl7fhirconverter.model.ir;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * Decoded OBX segment, one per segment in message order.
 */
@Value
@Builder
public class ObservationRecord {

    public static final String NUMERIC = "NM";

    String valueType;
    String code;
    String text;
    String value;
    String unit;
    /**
     * {@code low-high} as sent, e.g. {@code 70-110}.
     */
    String referenceRange;
    String abnormalFlag;

    @JsonIgnore
    public boolean isNumeric() {
        return NUMERIC.equals(valueType);
    }
}
