package com.al.hl7fhirconverter.util;

import java.time.DateTimeException;
import java.time.LocalDate;

/**
 * Reformats HL7 v2 date and timestamp strings into their ISO-8601 text form.
 *
 * <p>
 * Conversion is fixed-width slicing; no time zone is attached. Examples:
 * <ul>
 * <li>{@code 19900101} becomes {@code 1990-01-01}</li>
 * <li>{@code 202401010100} becomes {@code 2024-01-01T01:00:00}</li>
 * <li>{@code 20240101010203} becomes {@code 2024-01-01T01:02:03}</li>
 * </ul>
 */
public final class DateTimeUtil {

    private DateTimeUtil() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    private static final int DATE_LENGTH = 8;
    private static final int MINUTE_PRECISION_LENGTH = 12;
    private static final int SECOND_PRECISION_LENGTH = 14;

    /**
     * Whether the value is a 12 to 14 digit HL7 timestamp that can be sliced.
     */
    public static boolean isHl7Timestamp(String value) {
        return value != null
                && value.length() >= MINUTE_PRECISION_LENGTH
                && value.length() <= SECOND_PRECISION_LENGTH
                && value.chars().allMatch(Character::isDigit);
    }

    /**
     * {@code YYYYMMDDHHMM[SS]} to {@code YYYY-MM-DDTHH:MM:SS}, seconds default to
     * {@code 00}.
     *
     * @return the ISO local date-time text, or null when the value is not a
     *         sliceable timestamp
     */
    public static String hl7TimestampToIso(String hl7Timestamp) {
        if (!isHl7Timestamp(hl7Timestamp)) {
            return null;
        }
        String seconds = hl7Timestamp.length() >= SECOND_PRECISION_LENGTH
                ? hl7Timestamp.substring(12, 14)
                : "00";
        return hl7Timestamp.substring(0, 4) + "-" + hl7Timestamp.substring(4, 6) + "-"
                + hl7Timestamp.substring(6, 8) + "T" + hl7Timestamp.substring(8, 10) + ":"
                + hl7Timestamp.substring(10, 12) + ":" + seconds;
    }

    /**
     * {@code YYYYMMDD} to {@code YYYY-MM-DD}. Anything after the eighth
     * character is ignored.
     *
     * @return the ISO date text, or null when fewer than eight characters are
     *         present
     */
    public static String hl7DateToIso(String hl7Date) {
        if (hl7Date == null || hl7Date.length() < DATE_LENGTH) {
            return null;
        }
        return hl7Date.substring(0, 4) + "-" + hl7Date.substring(4, 6) + "-" + hl7Date.substring(6, 8);
    }

    /**
     * Same as {@link #hl7DateToIso(String)} but rejects slices that are not a
     * calendar date.
     *
     * @throws DateTimeException if the sliced text is not a real date
     */
    public static LocalDate parseHl7Date(String hl7Date) {
        String iso = hl7DateToIso(hl7Date);
        if (iso == null) {
            throw new DateTimeException("Not an HL7 date: " + hl7Date);
        }
        return LocalDate.parse(iso);
    }
}
