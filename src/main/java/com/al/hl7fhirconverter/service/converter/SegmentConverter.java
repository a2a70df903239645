package com.al.hl7fhirconverter.service.converter;

import com.al.hl7fhirconverter.model.ir.ParsedMessage;
import org.hl7.fhir.r4.model.Resource;

import java.util.List;

public interface SegmentConverter<T extends Resource> {
    /**
     * Converts the decoded records of one segment type to FHIR resources.
     *
     * @param message the decoded message
     * @param context per-conversion ids shared between converters
     * @return generated resources in source order, empty when the message has
     *         no matching segment
     */
    List<T> convert(ParsedMessage message, ConversionContext context);
}
