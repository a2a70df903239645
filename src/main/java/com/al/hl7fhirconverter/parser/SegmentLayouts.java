package com.al.hl7fhirconverter.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field layout of every segment type the decoder understands.
 *
 * <p>
 * Adding a field or a segment type is a change to this table; decoders and the
 * structural validator read positions from here rather than indexing segments
 * directly.
 */
public final class SegmentLayouts {

    private SegmentLayouts() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    // MSH (field separator counts as MSH-1)
    public static final FieldDescriptor MSH_SENDING_APPLICATION = FieldDescriptor.field("MSH", 3, "sending application");
    public static final FieldDescriptor MSH_SENDING_FACILITY = FieldDescriptor.field("MSH", 4, "sending facility");
    public static final FieldDescriptor MSH_TIMESTAMP = FieldDescriptor.field("MSH", 7, "message timestamp");
    public static final FieldDescriptor MSH_MESSAGE_TYPE = FieldDescriptor.field("MSH", 9, "message type");
    public static final FieldDescriptor MSH_MESSAGE_CODE = FieldDescriptor.component("MSH", 9, 1, "message code");
    public static final FieldDescriptor MSH_TRIGGER_EVENT = FieldDescriptor.component("MSH", 9, 2, "trigger event");
    public static final FieldDescriptor MSH_CONTROL_ID = FieldDescriptor.field("MSH", 10, "message control id");
    public static final FieldDescriptor MSH_VERSION = FieldDescriptor.field("MSH", 12, "version id");

    // EVN
    public static final FieldDescriptor EVN_EVENT_TYPE = FieldDescriptor.field("EVN", 1, "event type code");
    public static final FieldDescriptor EVN_RECORDED_TIME = FieldDescriptor.field("EVN", 2, "recorded date/time");
    public static final FieldDescriptor EVN_OCCURRED_TIME = FieldDescriptor.field("EVN", 6, "event occurred");

    // PID
    public static final FieldDescriptor PID_IDENTIFIER = FieldDescriptor.field("PID", 3, "patient identifier");
    public static final FieldDescriptor PID_MRN = FieldDescriptor.component("PID", 3, 1, "medical record number");
    public static final FieldDescriptor PID_IDENTIFIER_TYPE = FieldDescriptor.component("PID", 3, 5, "identifier type code");
    public static final FieldDescriptor PID_NAME = FieldDescriptor.field("PID", 5, "patient name");
    public static final FieldDescriptor PID_FAMILY_NAME = FieldDescriptor.component("PID", 5, 1, "family name");
    public static final FieldDescriptor PID_GIVEN_NAME = FieldDescriptor.component("PID", 5, 2, "given name");
    public static final FieldDescriptor PID_BIRTH_DATE = FieldDescriptor.field("PID", 7, "date of birth");
    public static final FieldDescriptor PID_SEX = FieldDescriptor.field("PID", 8, "administrative sex");

    // PV1
    public static final FieldDescriptor PV1_SET_ID = FieldDescriptor.field("PV1", 1, "set id");
    public static final FieldDescriptor PV1_PATIENT_CLASS = FieldDescriptor.field("PV1", 2, "patient class");
    public static final FieldDescriptor PV1_LOCATION = FieldDescriptor.field("PV1", 3, "assigned patient location");
    public static final FieldDescriptor PV1_ATTENDING = FieldDescriptor.field("PV1", 7, "attending doctor");
    public static final FieldDescriptor PV1_HOSPITAL_SERVICE = FieldDescriptor.field("PV1", 10, "hospital service");
    public static final FieldDescriptor PV1_VISIT_NUMBER = FieldDescriptor.field("PV1", 18, "visit number");
    public static final FieldDescriptor PV1_VISIT_NUMBER_STRICT = FieldDescriptor.field("PV1", 19, "visit number");
    public static final FieldDescriptor PV1_ADMIT_TIME = FieldDescriptor.field("PV1", 44, "admit date/time");
    public static final FieldDescriptor PV1_DISCHARGE_TIME = FieldDescriptor.field("PV1", 45, "discharge date/time");

    // OBR
    public static final FieldDescriptor OBR_PLACER_ORDER = FieldDescriptor.field("OBR", 2, "placer order number");
    public static final FieldDescriptor OBR_FILLER_ORDER = FieldDescriptor.field("OBR", 3, "filler order number");
    public static final FieldDescriptor OBR_SERVICE = FieldDescriptor.field("OBR", 4, "universal service identifier");
    public static final FieldDescriptor OBR_TEST_CODE = FieldDescriptor.component("OBR", 4, 1, "test code");
    public static final FieldDescriptor OBR_TEST_NAME = FieldDescriptor.component("OBR", 4, 2, "test name");
    public static final FieldDescriptor OBR_SPECIMEN_TIME = FieldDescriptor.field("OBR", 5, "specimen date/time");
    public static final FieldDescriptor OBR_RESULT_TIME = FieldDescriptor.field("OBR", 6, "result date/time");
    public static final FieldDescriptor OBR_ORDERING_PROVIDER = FieldDescriptor.field("OBR", 13, "ordering provider");

    // OBX
    public static final FieldDescriptor OBX_VALUE_TYPE = FieldDescriptor.field("OBX", 2, "value type");
    public static final FieldDescriptor OBX_IDENTIFIER = FieldDescriptor.field("OBX", 3, "observation identifier");
    public static final FieldDescriptor OBX_CODE = FieldDescriptor.component("OBX", 3, 1, "observation code");
    public static final FieldDescriptor OBX_TEXT = FieldDescriptor.component("OBX", 3, 2, "observation text");
    public static final FieldDescriptor OBX_VALUE = FieldDescriptor.field("OBX", 5, "observation value");
    public static final FieldDescriptor OBX_UNIT = FieldDescriptor.field("OBX", 6, "units");
    public static final FieldDescriptor OBX_REFERENCE_RANGE = FieldDescriptor.field("OBX", 7, "reference range");
    public static final FieldDescriptor OBX_ABNORMAL_FLAG = FieldDescriptor.field("OBX", 8, "abnormal flag");

    // NK1
    public static final FieldDescriptor NK1_NAME = FieldDescriptor.field("NK1", 2, "next of kin name");
    public static final FieldDescriptor NK1_FAMILY_NAME = FieldDescriptor.component("NK1", 2, 1, "family name");
    public static final FieldDescriptor NK1_GIVEN_NAME = FieldDescriptor.component("NK1", 2, 2, "given name");
    public static final FieldDescriptor NK1_RELATIONSHIP_CODE = FieldDescriptor.component("NK1", 3, 1, "relationship code");
    public static final FieldDescriptor NK1_RELATIONSHIP_TEXT = FieldDescriptor.component("NK1", 3, 2, "relationship text");
    public static final FieldDescriptor NK1_PHONE = FieldDescriptor.component("NK1", 5, 1, "phone number");

    // AL1
    public static final FieldDescriptor AL1_ALLERGEN_TYPE = FieldDescriptor.component("AL1", 2, 1, "allergen type");
    public static final FieldDescriptor AL1_ALLERGEN_CODE = FieldDescriptor.component("AL1", 3, 1, "allergen code");
    public static final FieldDescriptor AL1_ALLERGEN_TEXT = FieldDescriptor.component("AL1", 3, 2, "allergen description");
    public static final FieldDescriptor AL1_SEVERITY = FieldDescriptor.component("AL1", 4, 1, "allergy severity");
    public static final FieldDescriptor AL1_REACTION = FieldDescriptor.field("AL1", 5, "allergy reaction");

    private static final Map<String, List<FieldDescriptor>> LAYOUTS = buildLayouts();

    private static Map<String, List<FieldDescriptor>> buildLayouts() {
        Map<String, List<FieldDescriptor>> layouts = new LinkedHashMap<>();
        layouts.put("MSH", List.of(MSH_SENDING_APPLICATION, MSH_SENDING_FACILITY, MSH_TIMESTAMP, MSH_MESSAGE_CODE,
                MSH_TRIGGER_EVENT, MSH_CONTROL_ID, MSH_VERSION));
        layouts.put("EVN", List.of(EVN_EVENT_TYPE, EVN_RECORDED_TIME, EVN_OCCURRED_TIME));
        layouts.put("PID", List.of(PID_MRN, PID_IDENTIFIER_TYPE, PID_FAMILY_NAME, PID_GIVEN_NAME, PID_BIRTH_DATE,
                PID_SEX));
        layouts.put("PV1", List.of(PV1_SET_ID, PV1_PATIENT_CLASS, PV1_LOCATION, PV1_ATTENDING, PV1_HOSPITAL_SERVICE,
                PV1_VISIT_NUMBER, PV1_ADMIT_TIME, PV1_DISCHARGE_TIME));
        layouts.put("OBR", List.of(OBR_PLACER_ORDER, OBR_FILLER_ORDER, OBR_TEST_CODE, OBR_TEST_NAME,
                OBR_SPECIMEN_TIME, OBR_RESULT_TIME, OBR_ORDERING_PROVIDER));
        layouts.put("OBX", List.of(OBX_VALUE_TYPE, OBX_CODE, OBX_TEXT, OBX_VALUE, OBX_UNIT, OBX_REFERENCE_RANGE,
                OBX_ABNORMAL_FLAG));
        layouts.put("NK1", List.of(NK1_FAMILY_NAME, NK1_GIVEN_NAME, NK1_RELATIONSHIP_CODE, NK1_RELATIONSHIP_TEXT,
                NK1_PHONE));
        layouts.put("AL1", List.of(AL1_ALLERGEN_TYPE, AL1_ALLERGEN_CODE, AL1_ALLERGEN_TEXT, AL1_SEVERITY,
                AL1_REACTION));
        return Collections.unmodifiableMap(layouts);
    }

    public static boolean isRecognized(String segmentId) {
        return LAYOUTS.containsKey(segmentId);
    }

    public static List<FieldDescriptor> layoutOf(String segmentId) {
        return LAYOUTS.getOrDefault(segmentId, Collections.emptyList());
    }

    public static Map<String, List<FieldDescriptor>> all() {
        return LAYOUTS;
    }
}
