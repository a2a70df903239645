package com.al.hl7fhirconverter.service.converter;

import com.al.hl7fhirconverter.exception.Hl7ConversionException;
import com.al.hl7fhirconverter.model.ir.ObservationRecord;
import com.al.hl7fhirconverter.model.ir.ParsedMessage;
import com.al.hl7fhirconverter.util.MappingConstants;
import com.al.hl7fhirconverter.util.ResourceId;
import lombok.extern.slf4j.Slf4j;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Observation;
import org.hl7.fhir.r4.model.Quantity;
import org.hl7.fhir.r4.model.Reference;
import org.hl7.fhir.r4.model.SimpleQuantity;
import org.hl7.fhir.r4.model.StringType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
public class ObservationConverter implements SegmentConverter<Observation> {

    @Override
    public List<Observation> convert(ParsedMessage message, ConversionContext context) {
        List<Observation> observations = new ArrayList<>();

        for (ObservationRecord obx : message.getObservations()) {
            Observation observation = new Observation();
            observation.setId(ResourceId.sessionLocal(MappingConstants.PREFIX_OBSERVATION).getValue());
            observation.setStatus(Observation.ObservationStatus.FINAL);
            observation.setSubject(new Reference(context.patientReference()));
            if (context.getEncounterId() != null) {
                observation.setEncounter(new Reference(context.encounterReference()));
            }

            // OBX-3 code^text
            CodeableConcept code = new CodeableConcept();
            code.addCoding().setSystem(MappingConstants.SYSTEM_LOINC).setCode(obx.getCode()).setDisplay(obx.getText());
            observation.setCode(code);

            // OBX-2 / OBX-5 / OBX-6
            if (obx.getValue() != null) {
                if (obx.isNumeric()) {
                    observation.setValue(toQuantity(obx));
                } else {
                    observation.setValue(new StringType(obx.getValue()));
                }
            }

            // OBX-7 low-high
            parseReferenceRange(obx.getReferenceRange()).ifPresent(observation::addReferenceRange);

            // OBX-8 Abnormal Flag
            if (obx.getAbnormalFlag() != null) {
                observation.addInterpretation().addCoding()
                        .setSystem(MappingConstants.SYSTEM_OBSERVATION_INTERPRETATION)
                        .setCode(obx.getAbnormalFlag());
            }

            observations.add(observation);
        }

        return observations;
    }

    private Quantity toQuantity(ObservationRecord obx) {
        BigDecimal value;
        try {
            value = new BigDecimal(obx.getValue().trim());
        } catch (NumberFormatException e) {
            throw Hl7ConversionException.nonNumericObservation(obx.getCode(), obx.getValue(), e);
        }
        Quantity quantity = new Quantity();
        quantity.setValue(value);
        if (obx.getUnit() != null) {
            quantity.setUnit(obx.getUnit());
        }
        return quantity;
    }

    /**
     * Splits {@code low-high} on the first hyphen after the first character, so
     * a negative lower bound such as {@code -5-10} is kept. Unparseable ranges
     * yield nothing.
     */
    static Optional<Observation.ObservationReferenceRangeComponent> parseReferenceRange(String range) {
        if (range == null) {
            return Optional.empty();
        }
        String trimmed = range.trim();
        int separator = trimmed.indexOf('-', 1);
        if (separator < 0) {
            return Optional.empty();
        }
        try {
            BigDecimal low = new BigDecimal(trimmed.substring(0, separator).trim());
            BigDecimal high = new BigDecimal(trimmed.substring(separator + 1).trim());
            SimpleQuantity lowQuantity = new SimpleQuantity();
            lowQuantity.setValue(low);
            SimpleQuantity highQuantity = new SimpleQuantity();
            highQuantity.setValue(high);
            return Optional.of(new Observation.ObservationReferenceRangeComponent()
                    .setLow(lowQuantity)
                    .setHigh(highQuantity));
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparseable reference range '{}'", range);
            return Optional.empty();
        }
    }
}
