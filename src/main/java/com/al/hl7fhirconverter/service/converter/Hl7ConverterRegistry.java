package com.al.hl7fhirconverter.service.converter;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Getter
@Service
public class Hl7ConverterRegistry {

    private final PatientConverter patientConverter;
    private final EncounterConverter encounterConverter;
    private final ObservationConverter observationConverter;
    private final RelatedPersonConverter relatedPersonConverter;
    private final AllergyConverter allergyConverter;

    @Autowired
    public Hl7ConverterRegistry(
            PatientConverter patientConverter,
            EncounterConverter encounterConverter,
            ObservationConverter observationConverter,
            RelatedPersonConverter relatedPersonConverter,
            AllergyConverter allergyConverter) {
        this.patientConverter = patientConverter;
        this.encounterConverter = encounterConverter;
        this.observationConverter = observationConverter;
        this.relatedPersonConverter = relatedPersonConverter;
        this.allergyConverter = allergyConverter;
    }

    /**
     * Registry wired without a Spring context, e.g. for the command line.
     */
    public static Hl7ConverterRegistry withDefaults() {
        return new Hl7ConverterRegistry(new PatientConverter(), new EncounterConverter(),
                new ObservationConverter(), new RelatedPersonConverter(), new AllergyConverter());
    }
}
