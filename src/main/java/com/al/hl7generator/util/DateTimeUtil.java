package com.al.hl7generator.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * Formatting of HL7 v2 date/time values.
 *
 * <p>
 * Generated timestamps are always written without timezone and without
 * fractional seconds:
 * <ul>
 * <li>20260116120000 - TS / DTM</li>
 * <li>20260116 - DT</li>
 * <li>120000 - TM</li>
 * </ul>
 */
public final class DateTimeUtil {

    private DateTimeUtil() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    private static final DateTimeFormatter HL7_DATETIME = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private static final DateTimeFormatter HL7_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private static final DateTimeFormatter HL7_TIME = DateTimeFormatter.ofPattern("HHmmss");

    public static String formatDateTime(LocalDateTime dateTime) {
        if (dateTime == null) {
            return null;
        }
        return dateTime.format(HL7_DATETIME);
    }

    public static String formatDate(LocalDate date) {
        if (date == null) {
            return null;
        }
        return date.format(HL7_DATE);
    }

    public static String formatTime(LocalTime time) {
        if (time == null) {
            return null;
        }
        return time.format(HL7_TIME);
    }
}
