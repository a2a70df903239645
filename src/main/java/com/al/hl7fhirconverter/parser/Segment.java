package com.al.hl7fhirconverter.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One pipe-delimited HL7 segment with total, 1-based field access.
 *
 * <p>
 * Every accessor returns {@link Optional#empty()} for positions past the end of
 * the segment and for blank values, so decoding short or malformed segments
 * never fails. For {@code MSH} the field separator itself counts as MSH-1, so
 * MSH-9 is the ninth pipe-delimited token after the segment id.
 */
public final class Segment {

    public static final String FIELD_SEPARATOR = "|";
    public static final String COMPONENT_SEPARATOR = "^";

    private static final String MSH = "MSH";

    private final String id;
    private final List<String> tokens;

    private Segment(String id, List<String> tokens) {
        this.id = id;
        this.tokens = tokens;
    }

    public static Segment parse(String line) {
        String safeLine = line == null ? "" : line;
        List<String> tokens = Collections.unmodifiableList(
                new ArrayList<>(Arrays.asList(safeLine.split("\\|", -1))));
        return new Segment(tokens.get(0).trim(), tokens);
    }

    public String getId() {
        return id;
    }

    public boolean isHeader() {
        return MSH.equals(id);
    }

    /**
     * Highest field position present in the segment.
     */
    public int getFieldCount() {
        return isHeader() ? tokens.size() : tokens.size() - 1;
    }

    public Optional<String> field(int position) {
        if (position < 1) {
            return Optional.empty();
        }
        if (isHeader() && position == 1) {
            return Optional.of(FIELD_SEPARATOR);
        }
        int index = isHeader() ? position - 1 : position;
        if (index >= tokens.size()) {
            return Optional.empty();
        }
        return nonBlank(tokens.get(index));
    }

    public Optional<String> component(int position, int component) {
        if (component < 1) {
            return Optional.empty();
        }
        return field(position).flatMap(value -> {
            String[] parts = value.split("\\^", -1);
            return component <= parts.length ? nonBlank(parts[component - 1]) : Optional.empty();
        });
    }

    /**
     * Non-blank field values in position order, the segment id excluded.
     */
    public List<String> nonEmptyFields() {
        List<String> values = new ArrayList<>();
        for (int i = 1; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (token != null && !token.isBlank()) {
                values.add(token);
            }
        }
        return values;
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    @Override
    public String toString() {
        return String.join(FIELD_SEPARATOR, tokens);
    }
}
