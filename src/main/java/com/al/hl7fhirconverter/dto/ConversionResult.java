package com.al.hl7fhirconverter.dto;

import com.al.hl7fhirconverter.model.ir.ParsedMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hl7.fhir.r4.model.Bundle;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything one conversion produced: the decoded message, the bundle, the
 * structural violations found along the way and the plain-text summary.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionResult {

    private ParsedMessage parsed;

    private Bundle bundle;

    @Builder.Default
    private List<ConversionError> violations = new ArrayList<>();

    private String summary;
}
