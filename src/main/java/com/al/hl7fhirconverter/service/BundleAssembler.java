package com.al.hl7fhirconverter.service;

import org.hl7.fhir.r4.model.AllergyIntolerance;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.Encounter;
import org.hl7.fhir.r4.model.Observation;
import org.hl7.fhir.r4.model.Patient;
import org.hl7.fhir.r4.model.RelatedPerson;
import org.hl7.fhir.r4.model.Resource;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Collects converted resources into a collection bundle in a fixed order:
 * patient, encounter, observations, related persons, allergies.
 */
@Component
public class BundleAssembler {

    public Bundle assemble(Patient patient, List<Encounter> encounters, List<Observation> observations,
            List<RelatedPerson> relatedPersons, List<AllergyIntolerance> allergies) {
        Bundle bundle = new Bundle();
        bundle.setType(Bundle.BundleType.COLLECTION);

        addEntry(bundle, patient);
        addEntries(bundle, encounters);
        addEntries(bundle, observations);
        addEntries(bundle, relatedPersons);
        addEntries(bundle, allergies);
        return bundle;
    }

    private void addEntries(Bundle bundle, List<? extends Resource> resources) {
        for (Resource resource : resources) {
            addEntry(bundle, resource);
        }
    }

    private void addEntry(Bundle bundle, Resource resource) {
        bundle.addEntry().setResource(resource);
    }
}
