package com.al.hl7fhirconverter.validation;

import com.al.hl7fhirconverter.dto.ConversionError;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class Hl7StructureValidatorTest {

    private static final String MSH_ADT = "MSH|^~\\&|A|B|C|D|20240101010101||ADT^A01|1|P|2.3";
    private static final String MSH_ORU = "MSH|^~\\&|LAB|HOSP|||20240101||ORU^R01|42|P|2.5";
    private static final String EVN = "EVN|A01|20240101010101";
    private static final String PID = "PID|1||MRN123^^^HOSP^MR||Doe^Jane||19900101|F";
    private static final String PV1 = "PV1|1|O|AMB";
    private static final String OBR = "OBR|1|P1|F1|GLU^Glucose";
    private static final String OBX = "OBX|1|NM|2345-7^Glucose||95|mg/dL";

    private final Hl7StructureValidator validator = new Hl7StructureValidator();

    private static List<String> messages(List<ConversionError> violations) {
        return violations.stream().map(ConversionError::getMessage).collect(Collectors.toList());
    }

    @Test
    public void testCanonicalMessageHasNoViolations() {
        List<ConversionError> violations = validator.validate(List.of(MSH_ADT, EVN, PID, PV1, OBR, OBX));

        assertTrue(violations.isEmpty(), "Unexpected violations: " + messages(violations));
    }

    @Test
    public void testAdtWithoutEvnIsOnlyAWarning() {
        List<ConversionError> violations = validator.validate(List.of(MSH_ADT, PID, PV1));

        assertEquals(1, violations.size());
        assertEquals("Recommended segment missing for ADT message: EVN", violations.get(0).getMessage());
        assertEquals(ConversionError.Severity.WARNING, violations.get(0).getSeverity());
        assertFalse(violations.get(0).isError());
    }

    @Test
    public void testAdtWithoutVisitIsAnError() {
        List<ConversionError> violations = validator.validate(List.of(MSH_ADT, EVN, PID));

        assertEquals(List.of("Missing required segment for ADT message: PV1"), messages(violations));
        assertTrue(violations.get(0).isError());
    }

    @Test
    public void testVisitRulesDoNotApplyToNonAdt() {
        List<ConversionError> violations = validator.validate(List.of(MSH_ORU, PID, OBR, OBX));

        assertTrue(violations.isEmpty(), "Unexpected violations: " + messages(violations));
    }

    @Test
    public void testMissingRequiredSegments() {
        List<String> found = messages(validator.validate(List.of(OBX)));

        assertTrue(found.contains("Missing required segment: MSH"));
        assertTrue(found.contains("Missing required segment: PID"));
        assertTrue(found.contains("OBX exists but OBR segment is missing"));
    }

    @Test
    public void testOrderingViolations() {
        List<String> found = messages(validator.validate(List.of(PID, MSH_ORU, OBX, OBR)));

        assertTrue(found.contains("PID appears before MSH (invalid order)"));
        assertTrue(found.contains("OBX appears before OBR (invalid order)"));
        assertEquals(2, found.size(), "Unexpected violations: " + found);
    }

    @Test
    public void testVisitOrdering() {
        List<String> beforePatient = messages(validator.validate(List.of(MSH_ORU, PV1, PID)));
        List<String> afterOrder = messages(validator.validate(List.of(MSH_ORU, PID, OBR, PV1, OBX)));

        assertTrue(beforePatient.contains("PV1 appears before PID (invalid order)"));
        assertTrue(afterOrder.contains("PV1 appears after OBR (invalid order)"));
        assertTrue(messages(validator.validate(List.of(MSH_ORU, OBR, PID))).contains(
                "OBR appears before PID (invalid order)"));
    }

    @Test
    public void testLineLevelViolations() {
        List<ConversionError> violations = validator.validate(List.of(MSH_ORU, "", PID, "pid|x", "ZZZ"));
        List<String> found = messages(violations);

        assertTrue(found.contains("Line 2: Empty or whitespace-only line"));
        assertTrue(found.contains("Line 4: Invalid segment name 'pid'"));
        assertTrue(found.contains("Line 5: Segment 'ZZZ' contains no field separators '|'"));
        ConversionError blank = violations.stream()
                .filter(v -> v.getMessage().startsWith("Line 2"))
                .findFirst()
                .orElseThrow();
        assertEquals(2, blank.getLine());
        assertEquals(ConversionError.LINE_FORMAT, blank.getErrorCode());
    }

    @Test
    public void testRequiredFields() {
        List<String> found = messages(validator.validate(List.of(
                "MSH|^~\\&|A|B|C|D|20240101||",
                "PID|1",
                "OBR|1",
                "OBX|1|NM")));

        assertTrue(found.contains("MSH-9 (message type) is missing or empty"));
        assertTrue(found.contains("PID-3 (patient identifier) is missing or empty"));
        assertTrue(found.contains("PID-5 (patient name) is missing or empty"));
        assertTrue(found.contains("OBR-4 (test code) is missing or empty"));
        assertTrue(found.contains("OBX-3 (observation code) is missing or empty"));
        assertTrue(found.contains("OBX-5 (observation value) is missing or empty"));
    }

    @Test
    public void testVisitFieldFormats() {
        String pv1 = "PV1|1|IN" + "|".repeat(17) + "VIS#1" + "|".repeat(25) + "2024|202401010100";
        List<String> found = messages(validator.validate(List.of(MSH_ORU, PID, pv1)));

        assertTrue(found.contains("PV1-2 (patient class) must be a single character, got 'IN'"), found.toString());
        assertTrue(found.stream().anyMatch(m -> m.startsWith("PV1-19") && m.endsWith("has invalid format 'VIS#1'")),
                found.toString());
        assertTrue(found.stream().anyMatch(m -> m.startsWith("PV1-44") && m.endsWith("has invalid format '2024'")),
                found.toString());
        assertFalse(found.stream().anyMatch(m -> m.startsWith("PV1-45")), "12-digit discharge time is valid");
    }

    @Test
    public void testMissingPatientClassAndEventFields() {
        List<String> found = messages(validator.validate(List.of(MSH_ADT, "EVN||2024", PID, "PV1|1")));

        assertTrue(found.contains("PV1-2 (patient class) is missing or empty"), found.toString());
        assertTrue(found.contains("EVN-1 (event type code) is missing or empty"), found.toString());
        assertTrue(found.stream().anyMatch(m -> m.startsWith("EVN-2") && m.endsWith("has invalid format '2024'")),
                found.toString());
    }
}
