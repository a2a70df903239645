package com.al.hl7fhirconverter.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collection;

/**
 * One structural violation found in an HL7 message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversionError {

    public static final String MISSING_SEGMENT = "MISSING_SEGMENT";
    public static final String SEGMENT_ORDER = "SEGMENT_ORDER";
    public static final String LINE_FORMAT = "LINE_FORMAT";
    public static final String REQUIRED_FIELD_MISSING = "REQUIRED_FIELD_MISSING";
    public static final String FIELD_FORMAT = "FIELD_FORMAT";
    public static final String RECOMMENDED_SEGMENT = "RECOMMENDED_SEGMENT";

    /**
     * The segment the violation relates to (e.g., "PID", "OBX", "PV1")
     */
    private String segment;

    /**
     * 1-based line number in the normalized message, 0 when not line specific
     */
    private int line;

    /**
     * Field reference such as "PID-5" (if applicable)
     */
    private String field;

    /**
     * Error code for programmatic handling
     */
    private String errorCode;

    /**
     * Human-readable message
     */
    private String message;

    private Severity severity;

    public enum Severity {
        ERROR,
        WARNING
    }

    @JsonIgnore
    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * True when at least one violation is an error; warnings alone never fail
     * a message.
     */
    public static boolean containsErrors(Collection<ConversionError> violations) {
        return violations != null && violations.stream().anyMatch(ConversionError::isError);
    }

    public static ConversionError missingSegment(String segment, String message) {
        return ConversionError.builder()
                .segment(segment)
                .message(message)
                .severity(Severity.ERROR)
                .errorCode(MISSING_SEGMENT)
                .build();
    }

    public static ConversionError orderError(String segment, String message) {
        return ConversionError.builder()
                .segment(segment)
                .message(message)
                .severity(Severity.ERROR)
                .errorCode(SEGMENT_ORDER)
                .build();
    }

    public static ConversionError lineError(int line, String segment, String message) {
        return ConversionError.builder()
                .segment(segment)
                .line(line)
                .message(message)
                .severity(Severity.ERROR)
                .errorCode(LINE_FORMAT)
                .build();
    }

    public static ConversionError fieldError(int line, String segment, String field, String errorCode,
            String message) {
        return ConversionError.builder()
                .segment(segment)
                .line(line)
                .field(field)
                .message(message)
                .severity(Severity.ERROR)
                .errorCode(errorCode)
                .build();
    }

    public static ConversionError warning(String segment, String message) {
        return ConversionError.builder()
                .segment(segment)
                .message(message)
                .severity(Severity.WARNING)
                .errorCode(RECOMMENDED_SEGMENT)
                .build();
    }
}
