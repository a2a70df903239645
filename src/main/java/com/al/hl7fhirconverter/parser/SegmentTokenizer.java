package com.al.hl7fhirconverter.parser;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Splits raw HL7 v2 text into segment lines.
 *
 * <p>
 * Accepts {@code \r}, {@code \r\n} and bare {@code \n} segment breaks and a
 * leading byte-order mark. Interior blank lines are kept so the structural
 * validator can report them; leading and trailing breaks are dropped.
 */
@Component
public class SegmentTokenizer {

    public static final char SEGMENT_DELIMITER = '\r';

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    public List<String> tokenize(String rawMessage) {
        if (rawMessage == null) {
            return Collections.emptyList();
        }

        String text = rawMessage;
        while (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
        }
        text = text.replace("\r\n", "\r").replace('\n', SEGMENT_DELIMITER);
        text = stripDelimiters(text);

        if (text.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(text.split(String.valueOf(SEGMENT_DELIMITER), -1));
    }

    private static String stripDelimiters(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == SEGMENT_DELIMITER) {
            start++;
        }
        while (end > start && text.charAt(end - 1) == SEGMENT_DELIMITER) {
            end--;
        }
        return text.substring(start, end);
    }
}
