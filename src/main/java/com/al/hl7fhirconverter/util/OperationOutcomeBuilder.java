package com.al.hl7fhirconverter.util;

import com.al.hl7fhirconverter.dto.ConversionError;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.OperationOutcome;
import org.hl7.fhir.r4.model.OperationOutcome.IssueSeverity;
import org.hl7.fhir.r4.model.OperationOutcome.IssueType;
import org.hl7.fhir.r4.model.OperationOutcome.OperationOutcomeIssueComponent;

import java.util.List;

/**
 * Builds FHIR OperationOutcome resources from structural violations.
 */
public final class OperationOutcomeBuilder {

    private OperationOutcomeBuilder() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * One issue per violation. An empty list yields a single informational
     * "no issues" entry, since an OperationOutcome needs at least one issue.
     */
    public static OperationOutcome fromViolations(List<ConversionError> violations) {
        if (violations == null || violations.isEmpty()) {
            return fromMessage("No structural issues detected", IssueSeverity.INFORMATION);
        }
        OperationOutcome outcome = new OperationOutcome();
        for (ConversionError violation : violations) {
            outcome.addIssue(createIssue(violation));
        }
        return outcome;
    }

    public static OperationOutcome fromMessage(String message, IssueSeverity severity) {
        OperationOutcome outcome = new OperationOutcome();
        OperationOutcomeIssueComponent issue = outcome.addIssue();
        issue.setSeverity(severity);
        issue.setCode(severity == IssueSeverity.INFORMATION ? IssueType.INFORMATIONAL : IssueType.PROCESSING);
        issue.setDiagnostics(message);
        return outcome;
    }

    private static OperationOutcomeIssueComponent createIssue(ConversionError violation) {
        OperationOutcomeIssueComponent issue = new OperationOutcomeIssueComponent();
        issue.setSeverity(mapSeverity(violation.getSeverity()));
        issue.setCode(mapIssueType(violation.getErrorCode()));
        issue.setDiagnostics(violation.getMessage());

        if (violation.getSegment() != null || violation.getLine() > 0) {
            StringBuilder location = new StringBuilder();
            if (violation.getLine() > 0) {
                location.append("Line ").append(violation.getLine());
            }
            if (violation.getSegment() != null && !violation.getSegment().isEmpty()) {
                if (location.length() > 0) {
                    location.append(", ");
                }
                location.append("Segment: ").append(violation.getSegment());
            }
            if (violation.getField() != null) {
                location.append(", Field: ").append(violation.getField());
            }
            issue.addLocation(location.toString());
        }

        if (violation.getErrorCode() != null) {
            CodeableConcept details = new CodeableConcept();
            details.setText(violation.getErrorCode());
            issue.setDetails(details);
        }
        return issue;
    }

    private static IssueSeverity mapSeverity(ConversionError.Severity severity) {
        if (severity == null) {
            return IssueSeverity.ERROR;
        }
        switch (severity) {
            case WARNING:
                return IssueSeverity.WARNING;
            case ERROR:
            default:
                return IssueSeverity.ERROR;
        }
    }

    private static IssueType mapIssueType(String errorCode) {
        if (errorCode == null) {
            return IssueType.PROCESSING;
        }
        switch (errorCode) {
            case ConversionError.MISSING_SEGMENT:
            case ConversionError.SEGMENT_ORDER:
            case ConversionError.LINE_FORMAT:
                return IssueType.STRUCTURE;
            case ConversionError.REQUIRED_FIELD_MISSING:
                return IssueType.REQUIRED;
            case ConversionError.FIELD_FORMAT:
                return IssueType.VALUE;
            case ConversionError.RECOMMENDED_SEGMENT:
                return IssueType.INFORMATIONAL;
            default:
                return IssueType.PROCESSING;
        }
    }
}
