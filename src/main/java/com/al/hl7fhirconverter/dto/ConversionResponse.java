package com.al.hl7fhirconverter.dto;

import com.al.hl7fhirconverter.model.ir.ParsedMessage;
import com.fasterxml.jackson.annotation.JsonRawValue;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of the detailed conversion endpoint. {@code fhir} is the bundle as
 * encoded by the FHIR parser and is embedded verbatim.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversionResponse {
    private ParsedMessage parsed;
    @JsonRawValue
    private String fhir;
    private List<ConversionError> violations;
    private String summary;
}
