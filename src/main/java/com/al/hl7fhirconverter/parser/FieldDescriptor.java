package com.al.hl7fhirconverter.parser;

import java.util.Optional;

/**
 * Position of one clinical value inside a segment: a whole field, or a single
 * caret-delimited component of it.
 */
public final class FieldDescriptor {

    private final String segmentId;
    private final int position;
    private final int component;
    private final String description;

    private FieldDescriptor(String segmentId, int position, int component, String description) {
        this.segmentId = segmentId;
        this.position = position;
        this.component = component;
        this.description = description;
    }

    public static FieldDescriptor field(String segmentId, int position, String description) {
        return new FieldDescriptor(segmentId, position, 0, description);
    }

    public static FieldDescriptor component(String segmentId, int position, int component, String description) {
        return new FieldDescriptor(segmentId, position, component, description);
    }

    public Optional<String> read(Segment segment) {
        return component == 0 ? segment.field(position) : segment.component(position, component);
    }

    /**
     * Shorthand for {@code read(segment).orElse(null)}, used when populating
     * nullable IR properties.
     */
    public String readOrNull(Segment segment) {
        return read(segment).orElse(null);
    }

    public String getSegmentId() {
        return segmentId;
    }

    public int getPosition() {
        return position;
    }

    public String getDescription() {
        return description;
    }

    /**
     * HL7 style reference, e.g. {@code PID-5} or {@code PID-5.1}.
     */
    public String reference() {
        String ref = segmentId + "-" + position;
        return component == 0 ? ref : ref + "." + component;
    }

    @Override
    public String toString() {
        return reference() + " (" + description + ")";
    }
}
