package com.al.hl7fhirconverter.service;

import ca.uhn.fhir.context.FhirContext;
import com.al.hl7fhirconverter.config.ParsingConfiguration;
import com.al.hl7fhirconverter.dto.ConversionError;
import com.al.hl7fhirconverter.dto.ConversionResult;
import com.al.hl7fhirconverter.exception.Hl7ConversionException;
import com.al.hl7fhirconverter.exception.Hl7ValidationException;
import com.al.hl7fhirconverter.model.ir.MessageHeaderRecord;
import com.al.hl7fhirconverter.model.ir.ParsedMessage;
import com.al.hl7fhirconverter.parser.Hl7MessageDecoder;
import com.al.hl7fhirconverter.parser.SegmentTokenizer;
import com.al.hl7fhirconverter.service.converter.ConversionContext;
import com.al.hl7fhirconverter.service.converter.Hl7ConverterRegistry;
import com.al.hl7fhirconverter.util.OperationOutcomeBuilder;
import com.al.hl7fhirconverter.util.ResourceId;
import com.al.hl7fhirconverter.validation.Hl7StructureValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.hl7.fhir.r4.model.AllergyIntolerance;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.Encounter;
import org.hl7.fhir.r4.model.Observation;
import org.hl7.fhir.r4.model.Patient;
import org.hl7.fhir.r4.model.RelatedPerson;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;

/**
 * HL7 v2 to FHIR R4 pipeline: tokenize, validate, decode, convert, assemble.
 *
 * <p>
 * Each stage is also callable on its own. Whether validation gates conversion
 * is decided by {@link ParsingConfiguration#getStrictness()}.
 */
@Slf4j
@Service
public class Hl7ToFhirService {

    static final String METRIC_COUNT = "fhir.conversion.count";
    static final String METRIC_DURATION = "fhir.conversion.duration";

    private final SegmentTokenizer tokenizer;
    private final Hl7MessageDecoder decoder;
    private final Hl7StructureValidator validator;
    private final Hl7ConverterRegistry converters;
    private final BundleAssembler bundleAssembler;
    private final ClinicalSummaryService summaryService;
    private final FhirContext fhirContext;
    private final ParsingConfiguration parsingConfiguration;
    private final MeterRegistry meterRegistry;

    @Autowired
    public Hl7ToFhirService(SegmentTokenizer tokenizer, Hl7MessageDecoder decoder,
            Hl7StructureValidator validator,
            Hl7ConverterRegistry converters, BundleAssembler bundleAssembler,
            ClinicalSummaryService summaryService, FhirContext fhirContext,
            ParsingConfiguration parsingConfiguration, MeterRegistry meterRegistry) {
        this.tokenizer = tokenizer;
        this.decoder = decoder;
        this.validator = validator;
        this.converters = converters;
        this.bundleAssembler = bundleAssembler;
        this.summaryService = summaryService;
        this.fhirContext = fhirContext;
        this.parsingConfiguration = parsingConfiguration;
        this.meterRegistry = meterRegistry;
    }

    public ParsedMessage parse(String hl7Message) {
        return decoder.decode(hl7Message);
    }

    public List<ConversionError> validate(String hl7Message) {
        return validator.validate(tokenizer.tokenize(hl7Message));
    }

    /**
     * Maps a decoded message to a collection bundle.
     *
     * @throws Hl7ConversionException if a numeric observation value is not a
     *                                number
     */
    public Bundle toBundle(ParsedMessage message) {
        if (message.getPatient() == null) {
            throw Hl7ConversionException.missingPatient();
        }
        ConversionContext context = ConversionContext.builder()
                .patientId(ResourceId.forPatient(message.getPatient().getMrn()).getValue())
                .messageControlId(message.getHeader() != null ? message.getHeader().getControlId() : null)
                .build();

        List<Patient> patients = converters.getPatientConverter().convert(message, context);
        // encounter first, observations reference its id
        List<Encounter> encounters = converters.getEncounterConverter().convert(message, context);
        List<Observation> observations = converters.getObservationConverter().convert(message, context);
        List<RelatedPerson> relatedPersons = converters.getRelatedPersonConverter().convert(message, context);
        List<AllergyIntolerance> allergies = converters.getAllergyConverter().convert(message, context);

        return bundleAssembler.assemble(patients.get(0), encounters, observations, relatedPersons, allergies);
    }

    /**
     * Runs the full pipeline and returns every intermediate product.
     *
     * @throws Hl7ValidationException in strict mode when validation reports
     *                                errors
     * @throws Hl7ConversionException on a missing PID or a non-numeric NM value
     */
    public ConversionResult convert(String hl7Message) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            List<String> lines = tokenizer.tokenize(hl7Message);

            List<ConversionError> violations = Collections.emptyList();
            if (parsingConfiguration.isValidationEnabled()) {
                violations = validator.validate(lines);
                if (!violations.isEmpty()) {
                    log.info("Structural validation reported {} violation(s)", violations.size());
                }
                if (parsingConfiguration.isValidationGating() && ConversionError.containsErrors(violations)) {
                    log.warn("Rejecting message in strict mode: {}", violations.get(0).getMessage());
                    meterRegistry.counter(METRIC_COUNT, "status", "rejected").increment();
                    throw new Hl7ValidationException(violations);
                }
            }

            ParsedMessage parsed = decoder.decodeLines(lines);
            MessageHeaderRecord header = parsed.getHeader();
            if (header != null) {
                log.info("Starting HL7 to FHIR conversion for {}^{} message: {}", header.getMessageType(),
                        header.getTriggerEvent(), header.getControlId());
            } else {
                log.info("Starting HL7 to FHIR conversion for message without MSH");
            }

            Bundle bundle = toBundle(parsed);
            String summary = summaryService.summarize(bundle);

            log.info("Conversion complete. Bundle contains {} entries.", bundle.getEntry().size());
            meterRegistry.counter(METRIC_COUNT, "status", "success").increment();

            return ConversionResult.builder()
                    .parsed(parsed)
                    .bundle(bundle)
                    .violations(violations)
                    .summary(summary)
                    .build();
        } catch (Hl7ConversionException e) {
            log.error("Error converting HL7 to FHIR: {}", e.getMessage());
            meterRegistry.counter(METRIC_COUNT, "status", "error").increment();
            throw e;
        } finally {
            sample.stop(meterRegistry.timer(METRIC_DURATION));
        }
    }

    public String convertHl7ToFhir(String hl7Message) {
        return encode(convert(hl7Message).getBundle());
    }

    public String encode(Bundle bundle) {
        return encode(bundle, parsingConfiguration.isPrettyPrint());
    }

    public String encode(Bundle bundle, boolean prettyPrint) {
        return fhirContext.newJsonParser().setPrettyPrint(prettyPrint).encodeResourceToString(bundle);
    }

    public String encodeOperationOutcome(List<ConversionError> violations) {
        return fhirContext.newJsonParser()
                .setPrettyPrint(parsingConfiguration.isPrettyPrint())
                .encodeResourceToString(OperationOutcomeBuilder.fromViolations(violations));
    }
}
