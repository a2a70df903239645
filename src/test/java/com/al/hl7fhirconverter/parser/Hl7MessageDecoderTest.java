package com.al.hl7fhirconverter.parser;

import com.al.hl7fhirconverter.config.ParsingConfiguration;
import com.al.hl7fhirconverter.config.ParsingConfiguration.Pv1TimestampStrategy;
import com.al.hl7fhirconverter.exception.Hl7ConversionException;
import com.al.hl7fhirconverter.model.ir.EncounterRecord;
import com.al.hl7fhirconverter.model.ir.ParsedMessage;
import com.al.hl7fhirconverter.model.ir.PatientRecord;
import com.al.hl7fhirconverter.model.ir.RelatedPersonRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class Hl7MessageDecoderTest {

    private static final String ADT_MESSAGE = "MSH|^~\\&|A|B|C|D|20240101010101||ADT^A01|1|P|2.3\r"
            + "PID|1||MRN123^^^HOSP^MR||Doe^Jane||19900101|F\r"
            + "PV1|1|O|AMB^^^Hosp||||1^Smith^John|||||||||||VIS1||||||||||||||||||20240101010000|20240101020000";

    private final Hl7MessageDecoder decoder = new Hl7MessageDecoder(new SegmentTokenizer(), new ParsingConfiguration());

    @Test
    public void testDecodeAdtMessage() {
        ParsedMessage parsed = decoder.decode(ADT_MESSAGE);

        assertEquals("ADT", parsed.getHeader().getMessageType());
        assertEquals("A01", parsed.getHeader().getTriggerEvent());
        assertEquals("1", parsed.getHeader().getControlId());
        assertEquals("2.3", parsed.getHeader().getVersion());

        PatientRecord patient = parsed.getPatient();
        assertEquals("MRN123", patient.getMrn());
        assertEquals("MR", patient.getIdentifierType());
        assertEquals("Doe", patient.getFamilyName());
        assertEquals("Jane", patient.getGivenName());
        assertEquals("19900101", patient.getBirthDate());
        assertEquals("F", patient.getSex());

        EncounterRecord encounter = parsed.getEncounter();
        assertNotNull(encounter, "PV1 should produce an encounter record");
        assertEquals("O", encounter.getPatientClass());
        assertEquals("AMB^^^Hosp", encounter.getLocation());
        assertEquals("1^Smith^John", encounter.getAttendingDoctor());
        assertEquals("VIS1", encounter.getVisitNumber());
        assertEquals("20240101010000", encounter.getAdmitTime());
        assertEquals("20240101020000", encounter.getDischargeTime());
        assertTrue(parsed.getObservations().isEmpty());
    }

    @Test
    public void testTrailingHeuristicOnShortVisit() {
        ParsedMessage parsed = decoder.decode("MSH|^~\\&|A\rPID|1||MRN1\rPV1|1|I");

        assertEquals("1", parsed.getEncounter().getAdmitTime(), "Second-to-last populated field is the admit time");
        assertEquals("I", parsed.getEncounter().getDischargeTime(), "Last populated field is the discharge time");
    }

    @Test
    public void testTrailingHeuristicWithSingleField() {
        ParsedMessage parsed = decoder.decode("PID|1||MRN1\rPV1|1");

        assertNull(parsed.getEncounter().getAdmitTime());
        assertNull(parsed.getEncounter().getDischargeTime());
    }

    @Test
    public void testFixedPositionStrategy() {
        String pv1 = "PV1|1|I" + "|".repeat(42) + "20240101010000|20240101020000|";
        List<String> lines = List.of("PID|1||MRN1", pv1);

        ParsedMessage parsed = decoder.decodeLines(lines, Pv1TimestampStrategy.FIXED_POSITION);
        assertEquals("20240101010000", parsed.getEncounter().getAdmitTime());
        assertEquals("20240101020000", parsed.getEncounter().getDischargeTime());

        ParsedMessage sample = decoder.decodeLines(new SegmentTokenizer().tokenize(ADT_MESSAGE),
                Pv1TimestampStrategy.FIXED_POSITION);
        assertNull(sample.getEncounter().getAdmitTime(), "PV1-44 is absent in the sample");
        assertNull(sample.getEncounter().getDischargeTime(), "PV1-45 is absent in the sample");
    }

    @Test
    public void testObservationsKeepOrderAndOnlyFirstOrderIsUsed() {
        String message = "MSH|^~\\&|LAB|HOSP|||20240101||ORU^R01|42|P|2.5\r"
                + "PID|1||MRN9\r"
                + "OBR|1|P1|F1|GLU^Glucose\r"
                + "OBX|1|NM|2345-7^Glucose||95|mg/dL|70-110|N\r"
                + "OBR|2|P2|F2|NA^Sodium\r"
                + "OBX|2|ST|8867-4^Note||stable\r"
                + "ZPI|custom|data";

        ParsedMessage parsed = decoder.decode(message);

        assertEquals(1, parsed.getOrders().size(), "Only the first OBR is kept");
        assertEquals("GLU", parsed.getOrders().get(0).getTestCode());
        assertEquals("Glucose", parsed.getOrders().get(0).getTestName());
        assertEquals(2, parsed.getObservations().size());
        assertEquals("2345-7", parsed.getObservations().get(0).getCode());
        assertEquals("95", parsed.getObservations().get(0).getValue());
        assertEquals("mg/dL", parsed.getObservations().get(0).getUnit());
        assertEquals("70-110", parsed.getObservations().get(0).getReferenceRange());
        assertEquals("N", parsed.getObservations().get(0).getAbnormalFlag());
        assertTrue(parsed.getObservations().get(0).isNumeric());
        assertEquals("stable", parsed.getObservations().get(1).getValue());
        assertFalse(parsed.getObservations().get(1).isNumeric());
        assertFalse(parsed.hasEncounter());
    }

    @Test
    public void testLastPatientWins() {
        ParsedMessage parsed = decoder.decode("PID|1||FIRST\rPID|2||SECOND");

        assertEquals("SECOND", parsed.getPatient().getMrn());
    }

    @Test
    public void testNextOfKinAndAllergies() {
        String message = "PID|1||MRN1\r"
                + "NK1|1|Doe^John|SPO^Spouse|123 Main St|555-1234\r"
                + "NK1|2|Mary Smith|MTH\r"
                + "AL1|1|DA^Drug|PCN^Penicillin|SV^Severe|Hives\r"
                + "AL1|2|FA|PEANUT";

        ParsedMessage parsed = decoder.decode(message);

        RelatedPersonRecord spouse = parsed.getRelatedPersons().get(0);
        assertTrue(spouse.hasStructuredName());
        assertEquals("Doe", spouse.getFamilyName());
        assertEquals("John", spouse.getGivenName());
        assertEquals("SPO", spouse.getRelationshipCode());
        assertEquals("Spouse", spouse.getRelationshipText());
        assertEquals("555-1234", spouse.getPhone());

        RelatedPersonRecord mother = parsed.getRelatedPersons().get(1);
        assertFalse(mother.hasStructuredName(), "Name without components stays unstructured");
        assertEquals("Mary Smith", mother.getRawName());

        assertEquals(2, parsed.getAllergies().size());
        assertEquals("DA", parsed.getAllergies().get(0).getAllergenType());
        assertEquals("Penicillin", parsed.getAllergies().get(0).getDescription());
        assertEquals("SV", parsed.getAllergies().get(0).getSeverity());
        assertEquals("Hives", parsed.getAllergies().get(0).getReaction());
        assertEquals("PEANUT", parsed.getAllergies().get(1).getDescription(), "Description falls back to the code");
    }

    @Test
    public void testMissingPatientIsRejected() {
        Hl7ConversionException ex = assertThrows(Hl7ConversionException.class,
                () -> decoder.decode("MSH|^~\\&|A\rPV1|1|I"));

        assertEquals(Hl7ConversionException.Reason.NO_PATIENT, ex.getReason());
        assertEquals("No PID segment found", ex.getMessage());
    }
}
