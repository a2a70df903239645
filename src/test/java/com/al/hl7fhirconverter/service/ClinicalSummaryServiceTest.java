package com.al.hl7fhirconverter.service;

import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.DateTimeType;
import org.hl7.fhir.r4.model.DateType;
import org.hl7.fhir.r4.model.Encounter;
import org.hl7.fhir.r4.model.Enumerations;
import org.hl7.fhir.r4.model.Observation;
import org.hl7.fhir.r4.model.Patient;
import org.hl7.fhir.r4.model.Period;
import org.hl7.fhir.r4.model.Quantity;
import org.hl7.fhir.r4.model.StringType;
import org.hl7.fhir.r4.model.Coding;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ClinicalSummaryServiceTest {

    private final ClinicalSummaryService summaryService = new ClinicalSummaryService();

    private static Patient patient() {
        Patient patient = new Patient();
        patient.addName().setFamily("Doe").addGiven("Jane");
        patient.setBirthDateElement(new DateType("1990-01-01"));
        patient.setGender(Enumerations.AdministrativeGender.FEMALE);
        return patient;
    }

    @Test
    public void testSummaryWithEncounterAndNoObservations() {
        Encounter encounter = new Encounter();
        encounter.setClass_(new Coding().setCode("AMB"));
        encounter.setStatus(Encounter.EncounterStatus.FINISHED);
        encounter.setPeriod(new Period()
                .setStartElement(new DateTimeType("2024-01-01T01:00:00"))
                .setEndElement(new DateTimeType("2024-01-01T02:00:00")));

        Bundle bundle = new Bundle();
        bundle.addEntry().setResource(patient());
        bundle.addEntry().setResource(encounter);

        String expected = "Patient: Jane Doe, DOB: 1990-01-01, Sex: female\n"
                + "Encounter: AMB, finished, 2024-01-01T01:00:00 to 2024-01-01T02:00:00\n"
                + "\n"
                + "Lab Observations:\n"
                + "- None";
        assertEquals(expected, summaryService.summarize(bundle));
    }

    @Test
    public void testSummaryObservationLines() {
        Observation glucose = new Observation();
        glucose.getCode().addCoding().setCode("2345-7").setDisplay("Glucose");
        Quantity quantity = new Quantity();
        quantity.setValue(95.5);
        quantity.setUnit("mg/dL");
        glucose.setValue(quantity);
        glucose.addInterpretation().addCoding().setCode("H");

        Observation note = new Observation();
        note.getCode().addCoding().setCode("8867-4");
        note.setValue(new StringType("stable"));

        Observation empty = new Observation();
        empty.getCode().addCoding().setCode("X1").setDisplay("Pending");

        Bundle bundle = new Bundle();
        bundle.addEntry().setResource(patient());
        bundle.addEntry().setResource(glucose);
        bundle.addEntry().setResource(note);
        bundle.addEntry().setResource(empty);

        String expected = "Patient: Jane Doe, DOB: 1990-01-01, Sex: female\n"
                + "\n"
                + "Lab Observations:\n"
                + "- Glucose (2345-7): 95.5 mg/dL [H]\n"
                + "- Not provided (8867-4): stable\n"
                + "- Pending (X1): N/A";
        assertEquals(expected, summaryService.summarize(bundle));
    }

    @Test
    public void testSummaryWithoutPatientDetails() {
        Bundle bundle = new Bundle();
        bundle.addEntry().setResource(new Patient());

        String summary = summaryService.summarize(bundle);

        assertEquals("Patient: Not provided, DOB: Not provided, Sex: Not provided", summary.split("\n")[0]);
    }
}
