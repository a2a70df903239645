package com.al.hl7fhirconverter.model.ir;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Decoded form of one HL7 message. Created once per conversion and never
 * mutated afterwards.
 */
@Value
@Builder
public class ParsedMessage {
    MessageHeaderRecord header;
    PatientRecord patient;
    EncounterRecord encounter;
    EventRecord event;
    @Singular
    List<OrderRecord> orders;
    @Singular
    List<ObservationRecord> observations;
    @Singular
    List<RelatedPersonRecord> relatedPersons;
    @Singular
    List<AllergyRecord> allergies;

    public boolean hasEncounter() {
        return encounter != null;
    }
}
