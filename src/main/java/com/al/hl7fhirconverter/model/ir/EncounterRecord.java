package com.al.hl7fhirconverter.model.ir;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * Decoded PV1 segment.
 */
@Value
@Builder
public class EncounterRecord {
    String setId;
    String patientClass;
    String location;
    String attendingDoctor;
    String hospitalService;
    String visitNumber;
    String admitTime;
    String dischargeTime;

    @JsonIgnore
    public boolean isDischarged() {
        return dischargeTime != null && !dischargeTime.isEmpty();
    }
}
