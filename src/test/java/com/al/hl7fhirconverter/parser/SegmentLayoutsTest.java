package com.al.hl7fhirconverter.parser;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SegmentLayoutsTest {

    @Test
    public void testEveryDescriptorBelongsToItsSegment() {
        for (Map.Entry<String, List<FieldDescriptor>> layout : SegmentLayouts.all().entrySet()) {
            assertFalse(layout.getValue().isEmpty(), "Empty layout for " + layout.getKey());
            for (FieldDescriptor descriptor : layout.getValue()) {
                assertEquals(layout.getKey(), descriptor.getSegmentId(), descriptor.toString());
                assertTrue(descriptor.getPosition() > 0, descriptor.toString());
            }
        }
    }

    @Test
    public void testRecognizedSegments() {
        for (String id : List.of("MSH", "EVN", "PID", "PV1", "OBR", "OBX", "NK1", "AL1")) {
            assertTrue(SegmentLayouts.isRecognized(id), id);
        }
        assertFalse(SegmentLayouts.isRecognized("ZPI"));
        assertTrue(SegmentLayouts.layoutOf("NTE").isEmpty());
    }

    @Test
    public void testDescriptorReference() {
        assertEquals("PID-5", SegmentLayouts.PID_NAME.reference());
        assertEquals("PID-5.1", SegmentLayouts.PID_FAMILY_NAME.reference());
        assertEquals("MSH-9.2", SegmentLayouts.MSH_TRIGGER_EVENT.reference());
    }

    @Test
    public void testDescriptorRead() {
        Segment obx = Segment.parse("OBX|1|NM|2345-7^Glucose||95|mg/dL");

        assertEquals("2345-7", SegmentLayouts.OBX_CODE.readOrNull(obx));
        assertEquals("Glucose", SegmentLayouts.OBX_TEXT.readOrNull(obx));
        assertEquals(null, SegmentLayouts.OBX_ABNORMAL_FLAG.readOrNull(obx));
    }
}
