package com.al.hl7fhirconverter.validation;

import com.al.hl7fhirconverter.dto.ConversionError;
import com.al.hl7fhirconverter.parser.FieldDescriptor;
import com.al.hl7fhirconverter.parser.Segment;
import com.al.hl7fhirconverter.parser.SegmentLayouts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Structural checks over the normalized segment lines of an HL7 message.
 *
 * <p>
 * All rules run on every call and every violation is collected. Malformed
 * input is reported, never thrown. Only the "EVN recommended for ADT" rule is a
 * warning; everything else is an error.
 */
@Slf4j
@Component
public class Hl7StructureValidator {

    private static final Pattern SEGMENT_NAME = Pattern.compile("^[A-Z][A-Z0-9]{1,2}$");
    private static final Pattern VISIT_NUMBER = Pattern.compile("^[A-Za-z0-9-]+$");
    private static final Pattern HL7_TIMESTAMP = Pattern.compile("^\\d{12,14}$");

    public List<ConversionError> validate(List<String> lines) {
        List<ConversionError> violations = new ArrayList<>();

        List<String> segmentIds = new ArrayList<>(lines.size());
        for (String line : lines) {
            segmentIds.add(Segment.parse(line).getId());
        }

        checkPresence(lines, segmentIds, violations);
        checkOrdering(segmentIds, violations);

        for (int i = 0; i < lines.size(); i++) {
            checkLine(i + 1, lines.get(i), violations);
        }

        log.debug("Structural validation of {} lines found {} violation(s)", lines.size(), violations.size());
        return violations;
    }

    private void checkPresence(List<String> lines, List<String> segmentIds, List<ConversionError> violations) {
        boolean hasMsh = segmentIds.contains("MSH");
        if (!hasMsh) {
            violations.add(ConversionError.missingSegment("MSH", "Missing required segment: MSH"));
        }
        if (!segmentIds.contains("PID")) {
            violations.add(ConversionError.missingSegment("PID", "Missing required segment: PID"));
        }
        if (segmentIds.contains("OBX") && !segmentIds.contains("OBR")) {
            violations.add(ConversionError.missingSegment("OBR", "OBX exists but OBR segment is missing"));
        }

        if (hasMsh && isAdt(Segment.parse(lines.get(segmentIds.indexOf("MSH"))))) {
            if (!segmentIds.contains("PV1")) {
                violations.add(ConversionError.missingSegment("PV1",
                        "Missing required segment for ADT message: PV1"));
            }
            if (!segmentIds.contains("EVN")) {
                violations.add(ConversionError.warning("EVN",
                        "Recommended segment missing for ADT message: EVN"));
            }
        }
    }

    private boolean isAdt(Segment msh) {
        return SegmentLayouts.MSH_MESSAGE_TYPE.read(msh).map(type -> type.startsWith("ADT")).orElse(false);
    }

    private void checkOrdering(List<String> segmentIds, List<ConversionError> violations) {
        checkBefore(segmentIds, "PID", "MSH", "PID appears before MSH (invalid order)", violations);
        checkBefore(segmentIds, "OBR", "PID", "OBR appears before PID (invalid order)", violations);
        checkBefore(segmentIds, "OBX", "OBR", "OBX appears before OBR (invalid order)", violations);
        checkBefore(segmentIds, "PV1", "PID", "PV1 appears before PID (invalid order)", violations);
        checkBefore(segmentIds, "OBR", "PV1", "PV1 appears after OBR (invalid order)", violations);
    }

    /**
     * Reports when the first {@code earlier} precedes the first {@code later};
     * silent when either segment is absent.
     */
    private void checkBefore(List<String> segmentIds, String earlier, String later, String message,
            List<ConversionError> violations) {
        int earlierIndex = segmentIds.indexOf(earlier);
        int laterIndex = segmentIds.indexOf(later);
        if (earlierIndex >= 0 && laterIndex >= 0 && earlierIndex < laterIndex) {
            violations.add(ConversionError.orderError(earlier, message));
        }
    }

    private void checkLine(int lineNumber, String line, List<ConversionError> violations) {
        if (line.isBlank()) {
            violations.add(ConversionError.lineError(lineNumber, null,
                    "Line " + lineNumber + ": Empty or whitespace-only line"));
            return;
        }

        Segment segment = Segment.parse(line);
        String id = segment.getId();

        if (!SEGMENT_NAME.matcher(id).matches() && !id.startsWith("Z")) {
            violations.add(ConversionError.lineError(lineNumber, id,
                    "Line " + lineNumber + ": Invalid segment name '" + id + "'"));
        }
        if (!line.contains(Segment.FIELD_SEPARATOR)) {
            violations.add(ConversionError.lineError(lineNumber, id,
                    "Line " + lineNumber + ": Segment '" + id + "' contains no field separators '|'"));
        }

        switch (id) {
            case "MSH":
                requireField(lineNumber, segment, SegmentLayouts.MSH_MESSAGE_TYPE, violations);
                break;
            case "PID":
                requireField(lineNumber, segment, SegmentLayouts.PID_IDENTIFIER, violations);
                requireField(lineNumber, segment, SegmentLayouts.PID_NAME, violations);
                break;
            case "OBR":
                requireField(lineNumber, segment, SegmentLayouts.OBR_SERVICE, "test code", violations);
                break;
            case "OBX":
                requireField(lineNumber, segment, SegmentLayouts.OBX_IDENTIFIER, "observation code", violations);
                requireField(lineNumber, segment, SegmentLayouts.OBX_VALUE, violations);
                break;
            case "PV1":
                checkVisit(lineNumber, segment, violations);
                break;
            case "EVN":
                requireField(lineNumber, segment, SegmentLayouts.EVN_EVENT_TYPE, violations);
                checkFormat(lineNumber, segment, SegmentLayouts.EVN_RECORDED_TIME, HL7_TIMESTAMP, violations);
                break;
            default:
                break;
        }
    }

    private void checkVisit(int lineNumber, Segment segment, List<ConversionError> violations) {
        FieldDescriptor patientClass = SegmentLayouts.PV1_PATIENT_CLASS;
        if (requireField(lineNumber, segment, patientClass, violations)) {
            String value = patientClass.readOrNull(segment);
            if (value.length() != 1) {
                violations.add(ConversionError.fieldError(lineNumber, "PV1", patientClass.reference(),
                        ConversionError.FIELD_FORMAT, patientClass.reference() + " (" + patientClass.getDescription()
                                + ") must be a single character, got '" + value + "'"));
            }
        }
        checkFormat(lineNumber, segment, SegmentLayouts.PV1_VISIT_NUMBER_STRICT, VISIT_NUMBER, violations);
        checkFormat(lineNumber, segment, SegmentLayouts.PV1_ADMIT_TIME, HL7_TIMESTAMP, violations);
        checkFormat(lineNumber, segment, SegmentLayouts.PV1_DISCHARGE_TIME, HL7_TIMESTAMP, violations);
    }

    private boolean requireField(int lineNumber, Segment segment, FieldDescriptor descriptor,
            List<ConversionError> violations) {
        return requireField(lineNumber, segment, descriptor, descriptor.getDescription(), violations);
    }

    private boolean requireField(int lineNumber, Segment segment, FieldDescriptor descriptor, String label,
            List<ConversionError> violations) {
        if (descriptor.read(segment).isPresent()) {
            return true;
        }
        violations.add(ConversionError.fieldError(lineNumber, descriptor.getSegmentId(), descriptor.reference(),
                ConversionError.REQUIRED_FIELD_MISSING,
                descriptor.reference() + " (" + label + ") is missing or empty"));
        return false;
    }

    /**
     * Format check for optional fields; absent values pass.
     */
    private void checkFormat(int lineNumber, Segment segment, FieldDescriptor descriptor, Pattern pattern,
            List<ConversionError> violations) {
        descriptor.read(segment)
                .filter(value -> !pattern.matcher(value).matches())
                .ifPresent(value -> violations.add(ConversionError.fieldError(lineNumber,
                        descriptor.getSegmentId(), descriptor.reference(), ConversionError.FIELD_FORMAT,
                        descriptor.reference() + " (" + descriptor.getDescription() + ") has invalid format '"
                                + value + "'")));
    }
}
