package com.al.hl7fhirconverter.service.converter;

import com.al.hl7fhirconverter.model.ir.ParsedMessage;
import com.al.hl7fhirconverter.model.ir.PatientRecord;
import com.al.hl7fhirconverter.model.ir.RelatedPersonRecord;
import org.hl7.fhir.r4.model.ContactPoint;
import org.hl7.fhir.r4.model.RelatedPerson;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RelatedPersonConverterTest {

    private final RelatedPersonConverter converter = new RelatedPersonConverter();

    @Test
    public void testConvertNextOfKin() {
        ParsedMessage message = ParsedMessage.builder()
                .patient(PatientRecord.builder().mrn("MRN123").build())
                .relatedPerson(RelatedPersonRecord.builder()
                        .familyName("Doe")
                        .givenName("John")
                        .rawName("Doe^John")
                        .relationshipCode("SPO")
                        .relationshipText("Spouse")
                        .phone("555-1234")
                        .build())
                .relatedPerson(RelatedPersonRecord.builder().rawName("Mary Smith").build())
                .build();

        List<RelatedPerson> persons = converter.convert(message,
                ConversionContext.builder().patientId("patient-1").build());

        assertEquals(2, persons.size());
        RelatedPerson spouse = persons.get(0);
        assertTrue(spouse.getIdElement().getIdPart().startsWith("rp-"));
        assertEquals("Patient/patient-1", spouse.getPatient().getReference());
        assertEquals("Doe", spouse.getNameFirstRep().getFamily());
        assertEquals("John", spouse.getNameFirstRep().getGivenAsSingleString());
        assertEquals("SPO", spouse.getRelationshipFirstRep().getCodingFirstRep().getCode());
        assertEquals("Spouse", spouse.getRelationshipFirstRep().getText());
        assertEquals(ContactPoint.ContactPointSystem.PHONE, spouse.getTelecomFirstRep().getSystem());
        assertEquals("555-1234", spouse.getTelecomFirstRep().getValue());

        RelatedPerson other = persons.get(1);
        assertEquals("Mary Smith", other.getNameFirstRep().getText());
        assertFalse(other.getNameFirstRep().hasFamily());
        assertFalse(other.hasRelationship());
        assertFalse(other.hasTelecom());
    }
}
