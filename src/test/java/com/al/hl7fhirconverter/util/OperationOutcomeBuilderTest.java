package com.al.hl7fhirconverter.util;

import com.al.hl7fhirconverter.dto.ConversionError;
import org.hl7.fhir.r4.model.OperationOutcome;
import org.hl7.fhir.r4.model.OperationOutcome.IssueSeverity;
import org.hl7.fhir.r4.model.OperationOutcome.IssueType;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class OperationOutcomeBuilderTest {

    @Test
    public void testEmptyViolationsGiveInformationalIssue() {
        OperationOutcome outcome = OperationOutcomeBuilder.fromViolations(Collections.emptyList());

        assertEquals(1, outcome.getIssue().size());
        assertEquals(IssueSeverity.INFORMATION, outcome.getIssueFirstRep().getSeverity());
        assertEquals(IssueType.INFORMATIONAL, outcome.getIssueFirstRep().getCode());
        assertEquals("No structural issues detected", outcome.getIssueFirstRep().getDiagnostics());
    }

    @Test
    public void testViolationsMapToIssues() {
        OperationOutcome outcome = OperationOutcomeBuilder.fromViolations(List.of(
                ConversionError.fieldError(3, "PID", "PID-3", ConversionError.REQUIRED_FIELD_MISSING,
                        "PID-3 (patient identifier) is missing or empty"),
                ConversionError.warning("EVN", "Recommended segment missing for ADT message: EVN")));

        assertEquals(2, outcome.getIssue().size());
        OperationOutcome.OperationOutcomeIssueComponent required = outcome.getIssue().get(0);
        assertEquals(IssueSeverity.ERROR, required.getSeverity());
        assertEquals(IssueType.REQUIRED, required.getCode());
        assertEquals("Line 3, Segment: PID, Field: PID-3", required.getLocation().get(0).getValue());
        assertEquals(ConversionError.REQUIRED_FIELD_MISSING, required.getDetails().getText());

        OperationOutcome.OperationOutcomeIssueComponent warning = outcome.getIssue().get(1);
        assertEquals(IssueSeverity.WARNING, warning.getSeverity());
        assertEquals(IssueType.INFORMATIONAL, warning.getCode());
    }
}
