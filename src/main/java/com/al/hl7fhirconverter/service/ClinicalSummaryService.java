package com.al.hl7fhirconverter.service;

import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.Encounter;
import org.hl7.fhir.r4.model.HumanName;
import org.hl7.fhir.r4.model.Observation;
import org.hl7.fhir.r4.model.Patient;
import org.hl7.fhir.r4.model.Resource;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Plain-text digest of a converted bundle. Output depends only on the bundle
 * content.
 */
@Service
public class ClinicalSummaryService {

    static final String NOT_PROVIDED = "Not provided";

    public String summarize(Bundle bundle) {
        Patient patient = null;
        Encounter encounter = null;
        List<Observation> observations = new ArrayList<>();

        for (Bundle.BundleEntryComponent entry : bundle.getEntry()) {
            Resource resource = entry.getResource();
            if (resource instanceof Patient && patient == null) {
                patient = (Patient) resource;
            } else if (resource instanceof Encounter && encounter == null) {
                encounter = (Encounter) resource;
            } else if (resource instanceof Observation) {
                observations.add((Observation) resource);
            }
        }

        StringJoiner summary = new StringJoiner("\n");
        summary.add(patientLine(patient));
        if (encounter != null) {
            summary.add(encounterLine(encounter));
        }
        summary.add("");
        summary.add("Lab Observations:");
        if (observations.isEmpty()) {
            summary.add("- None");
        }
        for (Observation observation : observations) {
            summary.add(observationLine(observation));
        }
        return summary.toString();
    }

    private String patientLine(Patient patient) {
        if (patient == null) {
            return "Patient: " + NOT_PROVIDED;
        }
        String name = NOT_PROVIDED;
        if (patient.hasName()) {
            HumanName humanName = patient.getNameFirstRep();
            StringJoiner parts = new StringJoiner(" ");
            if (humanName.hasGiven()) {
                parts.add(humanName.getGivenAsSingleString());
            }
            if (humanName.hasFamily()) {
                parts.add(humanName.getFamily());
            }
            if (humanName.hasText() && parts.length() == 0) {
                parts.add(humanName.getText());
            }
            if (parts.length() > 0) {
                name = parts.toString();
            }
        }
        String dob = patient.hasBirthDateElement() ? patient.getBirthDateElement().getValueAsString() : NOT_PROVIDED;
        String sex = patient.hasGender() ? patient.getGender().toCode() : NOT_PROVIDED;
        return "Patient: " + name + ", DOB: " + dob + ", Sex: " + sex;
    }

    private String encounterLine(Encounter encounter) {
        String encounterClass = encounter.hasClass_() ? encounter.getClass_().getCode() : NOT_PROVIDED;
        String status = encounter.hasStatus() ? encounter.getStatus().toCode() : NOT_PROVIDED;
        StringBuilder line = new StringBuilder("Encounter: ")
                .append(encounterClass)
                .append(", ")
                .append(status);
        if (encounter.hasPeriod()) {
            String start = encounter.getPeriod().hasStart()
                    ? encounter.getPeriod().getStartElement().getValueAsString()
                    : NOT_PROVIDED;
            String end = encounter.getPeriod().hasEnd()
                    ? encounter.getPeriod().getEndElement().getValueAsString()
                    : NOT_PROVIDED;
            line.append(", ").append(start).append(" to ").append(end);
        }
        return line.toString();
    }

    private String observationLine(Observation observation) {
        Coding coding = observation.getCode().getCodingFirstRep();
        String text = coding.hasDisplay() ? coding.getDisplay() : NOT_PROVIDED;
        String code = coding.hasCode() ? coding.getCode() : NOT_PROVIDED;

        String value = "N/A";
        String unit = "";
        if (observation.hasValueQuantity()) {
            value = observation.getValueQuantity().getValue().toPlainString();
            unit = observation.getValueQuantity().hasUnit() ? observation.getValueQuantity().getUnit() : "";
        } else if (observation.hasValueStringType()) {
            value = observation.getValueStringType().getValue();
        }

        StringBuilder line = new StringBuilder("- ")
                .append(text).append(" (").append(code).append("): ").append(value);
        if (!unit.isEmpty()) {
            line.append(' ').append(unit);
        }
        if (observation.hasInterpretation()) {
            line.append(" [").append(observation.getInterpretationFirstRep().getCodingFirstRep().getCode())
                    .append(']');
        }
        return line.toString();
    }
}
