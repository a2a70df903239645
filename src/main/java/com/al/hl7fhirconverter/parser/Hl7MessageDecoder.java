package com.al.hl7fhirconverter.parser;

import com.al.hl7fhirconverter.config.ParsingConfiguration;
import com.al.hl7fhirconverter.config.ParsingConfiguration.Pv1TimestampStrategy;
import com.al.hl7fhirconverter.exception.Hl7ConversionException;
import com.al.hl7fhirconverter.model.ir.AllergyRecord;
import com.al.hl7fhirconverter.model.ir.EncounterRecord;
import com.al.hl7fhirconverter.model.ir.EventRecord;
import com.al.hl7fhirconverter.model.ir.MessageHeaderRecord;
import com.al.hl7fhirconverter.model.ir.ObservationRecord;
import com.al.hl7fhirconverter.model.ir.OrderRecord;
import com.al.hl7fhirconverter.model.ir.ParsedMessage;
import com.al.hl7fhirconverter.model.ir.PatientRecord;
import com.al.hl7fhirconverter.model.ir.RelatedPersonRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.al.hl7fhirconverter.parser.SegmentLayouts.*;

/**
 * Decodes tokenized HL7 segments into a {@link ParsedMessage}.
 *
 * <p>
 * Each recognized segment type has a handler reading its positions from
 * {@link SegmentLayouts}. Segments without a handler (Z-segments, NTE, ...) are
 * skipped. A message without PID is rejected.
 */
@Slf4j
@Component
public class Hl7MessageDecoder {

    @FunctionalInterface
    private interface SegmentHandler {
        void decode(Segment segment, DecodingState state);
    }

    private final SegmentTokenizer tokenizer;
    private final ParsingConfiguration parsingConfiguration;
    private final Map<String, SegmentHandler> handlers;

    public Hl7MessageDecoder(SegmentTokenizer tokenizer, ParsingConfiguration parsingConfiguration) {
        this.tokenizer = tokenizer;
        this.parsingConfiguration = parsingConfiguration;

        Map<String, SegmentHandler> map = new HashMap<>();
        map.put("MSH", this::decodeHeader);
        map.put("EVN", this::decodeEvent);
        map.put("PID", this::decodePatient);
        map.put("PV1", this::decodeVisit);
        map.put("OBR", this::decodeOrder);
        map.put("OBX", this::decodeObservation);
        map.put("NK1", this::decodeNextOfKin);
        map.put("AL1", this::decodeAllergy);
        this.handlers = Collections.unmodifiableMap(map);
    }

    public ParsedMessage decode(String rawMessage) {
        return decodeLines(tokenizer.tokenize(rawMessage));
    }

    public ParsedMessage decodeLines(List<String> lines) {
        return decodeLines(lines, parsingConfiguration.getPv1TimestampStrategy());
    }

    public ParsedMessage decodeLines(List<String> lines, Pv1TimestampStrategy pv1Strategy) {
        DecodingState state = new DecodingState(pv1Strategy);

        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            Segment segment = Segment.parse(line);
            if (!SegmentLayouts.isRecognized(segment.getId())) {
                log.debug("Skipping unrecognized segment {}", segment.getId());
                continue;
            }
            log.debug("Decoding {} segment with {} fields, layout {}", segment.getId(), segment.getFieldCount(),
                    SegmentLayouts.layoutOf(segment.getId()));
            handlers.get(segment.getId()).decode(segment, state);
        }

        if (!state.patientSeen) {
            throw Hl7ConversionException.missingPatient();
        }
        return state.builder.build();
    }

    private void decodeHeader(Segment segment, DecodingState state) {
        if (state.headerSeen) {
            log.debug("Ignoring repeated MSH segment");
            return;
        }
        state.headerSeen = true;
        state.builder.header(MessageHeaderRecord.builder()
                .sendingApplication(MSH_SENDING_APPLICATION.readOrNull(segment))
                .sendingFacility(MSH_SENDING_FACILITY.readOrNull(segment))
                .timestamp(MSH_TIMESTAMP.readOrNull(segment))
                .messageType(MSH_MESSAGE_CODE.readOrNull(segment))
                .triggerEvent(MSH_TRIGGER_EVENT.readOrNull(segment))
                .controlId(MSH_CONTROL_ID.readOrNull(segment))
                .version(MSH_VERSION.readOrNull(segment))
                .build());
    }

    private void decodeEvent(Segment segment, DecodingState state) {
        state.builder.event(EventRecord.builder()
                .eventType(EVN_EVENT_TYPE.readOrNull(segment))
                .recordedTime(EVN_RECORDED_TIME.readOrNull(segment))
                .occurredTime(EVN_OCCURRED_TIME.readOrNull(segment))
                .build());
    }

    private void decodePatient(Segment segment, DecodingState state) {
        state.patientSeen = true;
        state.builder.patient(PatientRecord.builder()
                .mrn(PID_MRN.readOrNull(segment))
                .identifierType(PID_IDENTIFIER_TYPE.readOrNull(segment))
                .familyName(PID_FAMILY_NAME.readOrNull(segment))
                .givenName(PID_GIVEN_NAME.readOrNull(segment))
                .birthDate(PID_BIRTH_DATE.readOrNull(segment))
                .sex(PID_SEX.readOrNull(segment))
                .build());
    }

    private void decodeVisit(Segment segment, DecodingState state) {
        String admit;
        String discharge;
        if (state.pv1Strategy == Pv1TimestampStrategy.FIXED_POSITION) {
            admit = PV1_ADMIT_TIME.readOrNull(segment);
            discharge = PV1_DISCHARGE_TIME.readOrNull(segment);
        } else {
            List<String> populated = segment.nonEmptyFields();
            int size = populated.size();
            admit = size >= 2 ? populated.get(size - 2) : null;
            discharge = size >= 2 ? populated.get(size - 1) : null;
        }

        state.builder.encounter(EncounterRecord.builder()
                .setId(PV1_SET_ID.readOrNull(segment))
                .patientClass(PV1_PATIENT_CLASS.readOrNull(segment))
                .location(PV1_LOCATION.readOrNull(segment))
                .attendingDoctor(PV1_ATTENDING.readOrNull(segment))
                .hospitalService(PV1_HOSPITAL_SERVICE.readOrNull(segment))
                .visitNumber(PV1_VISIT_NUMBER.readOrNull(segment))
                .admitTime(admit)
                .dischargeTime(discharge)
                .build());
    }

    private void decodeOrder(Segment segment, DecodingState state) {
        if (state.orderSeen) {
            log.debug("Ignoring additional OBR segment");
            return;
        }
        state.orderSeen = true;
        state.builder.order(OrderRecord.builder()
                .placerOrderNumber(OBR_PLACER_ORDER.readOrNull(segment))
                .fillerOrderNumber(OBR_FILLER_ORDER.readOrNull(segment))
                .testCode(OBR_TEST_CODE.readOrNull(segment))
                .testName(OBR_TEST_NAME.readOrNull(segment))
                .specimenTime(OBR_SPECIMEN_TIME.readOrNull(segment))
                .resultTime(OBR_RESULT_TIME.readOrNull(segment))
                .orderingProvider(OBR_ORDERING_PROVIDER.readOrNull(segment))
                .build());
    }

    private void decodeObservation(Segment segment, DecodingState state) {
        state.builder.observation(ObservationRecord.builder()
                .valueType(OBX_VALUE_TYPE.readOrNull(segment))
                .code(OBX_CODE.readOrNull(segment))
                .text(OBX_TEXT.readOrNull(segment))
                .value(OBX_VALUE.readOrNull(segment))
                .unit(OBX_UNIT.readOrNull(segment))
                .referenceRange(OBX_REFERENCE_RANGE.readOrNull(segment))
                .abnormalFlag(OBX_ABNORMAL_FLAG.readOrNull(segment))
                .build());
    }

    private void decodeNextOfKin(Segment segment, DecodingState state) {
        String rawName = NK1_NAME.readOrNull(segment);
        boolean composite = rawName != null && rawName.contains(Segment.COMPONENT_SEPARATOR);

        state.builder.relatedPerson(RelatedPersonRecord.builder()
                .familyName(composite ? NK1_FAMILY_NAME.readOrNull(segment) : null)
                .givenName(composite ? NK1_GIVEN_NAME.readOrNull(segment) : null)
                .rawName(rawName)
                .relationshipCode(NK1_RELATIONSHIP_CODE.readOrNull(segment))
                .relationshipText(NK1_RELATIONSHIP_TEXT.readOrNull(segment))
                .phone(NK1_PHONE.readOrNull(segment))
                .build());
    }

    private void decodeAllergy(Segment segment, DecodingState state) {
        String code = AL1_ALLERGEN_CODE.readOrNull(segment);
        String text = AL1_ALLERGEN_TEXT.readOrNull(segment);

        state.builder.allergy(AllergyRecord.builder()
                .allergenType(AL1_ALLERGEN_TYPE.readOrNull(segment))
                .allergenCode(code)
                .description(text != null ? text : code)
                .reaction(AL1_REACTION.readOrNull(segment))
                .severity(AL1_SEVERITY.readOrNull(segment))
                .build());
    }

    /**
     * Per-call accumulator; never shared between conversions.
     */
    private static final class DecodingState {
        private final ParsedMessage.ParsedMessageBuilder builder = ParsedMessage.builder();
        private final Pv1TimestampStrategy pv1Strategy;
        private boolean headerSeen;
        private boolean patientSeen;
        private boolean orderSeen;

        private DecodingState(Pv1TimestampStrategy pv1Strategy) {
            this.pv1Strategy = pv1Strategy;
        }
    }
}
