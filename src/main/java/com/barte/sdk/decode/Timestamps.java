package com.barte.sdk.decode;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parses the ISO-8601 shapes the API uses for dates.
 *
 * <p>Values without an offset are read as UTC; a bare calendar date becomes the
 * start of that day.
 */
public final class Timestamps {

    private Timestamps() {}

    public static OffsetDateTime parse(String text, String path) throws DecodingException {
        try {
            if (text.length() <= 10) {
                return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE)
                        .atStartOfDay()
                        .atOffset(ZoneOffset.UTC);
            }
            if (hasOffset(text)) {
                return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
            }
            return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new DecodingException(path, "not an ISO-8601 date or date-time: '" + text + "'", e);
        }
    }

    private static boolean hasOffset(String text) {
        int time = text.indexOf('T');
        if (time < 0) {
            return false;
        }
        String tail = text.substring(time);
        return tail.endsWith("Z") || tail.indexOf('+') >= 0 || tail.indexOf('-') >= 0;
    }
}
