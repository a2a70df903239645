package com.al.hl7fhirconverter.config;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for HL7 decoding and FHIR conversion behavior.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.parsing")
@Validated
public class ParsingConfiguration {

    /**
     * How structural violations affect conversion.
     * STRICT: error-severity violations reject the message
     * LENIENT: violations are reported, conversion proceeds
     * PERMISSIVE: structural validation is skipped
     */
    @NotNull
    private StrictnessLevel strictness = StrictnessLevel.LENIENT;

    /**
     * Where PV1 admit/discharge timestamps are read from.
     */
    @NotNull
    private Pv1TimestampStrategy pv1TimestampStrategy = Pv1TimestampStrategy.TRAILING_NON_EMPTY;

    /**
     * Whether encoded bundles are pretty-printed by default.
     */
    private boolean prettyPrint = true;

    public enum StrictnessLevel {
        STRICT,
        LENIENT,
        PERMISSIVE
    }

    public enum Pv1TimestampStrategy {
        /**
         * Last two non-empty fields of the segment.
         */
        TRAILING_NON_EMPTY,

        /**
         * PV1-44 and PV1-45.
         */
        FIXED_POSITION
    }

    public boolean isValidationEnabled() {
        return strictness != StrictnessLevel.PERMISSIVE;
    }

    public boolean isValidationGating() {
        return strictness == StrictnessLevel.STRICT;
    }
}
