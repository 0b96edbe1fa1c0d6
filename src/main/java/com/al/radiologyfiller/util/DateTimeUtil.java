package com.al.radiologyfiller.util;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Date;

/**
 * Parsing and formatting of HL7 v2 DT/DTM values and conversion to the {@link Date} values HAPI FHIR
 * expects.
 * <p>
 * HL7 v2 datetime format: YYYY[MM[DD[HH[MM[SS[.S[S[S[S]]]]]]]]][+/-ZZZZ]. Missing trailing parts are
 * treated as zero (month and day as 01); a trailing offset is ignored and the clock time is kept as
 * sent.
 */
public final class DateTimeUtil {

    private DateTimeUtil() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    private static final DateTimeFormatter HL7_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter HL7_DATETIME = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    /**
     * @return the local date-time, or null for an empty value
     * @throws DateTimeException if the value is not an HL7 datetime
     */
    public static LocalDateTime parseHl7DateTime(String hl7DateTime) {
        if (hl7DateTime == null || hl7DateTime.isBlank()) {
            return null;
        }
        String digits = stripOffsetAndFraction(hl7DateTime.trim());
        if (digits.length() < 4 || !digits.chars().allMatch(Character::isDigit)) {
            throw new DateTimeException("Failed to parse HL7 datetime: " + hl7DateTime);
        }
        String d = digits.length() > 14 ? digits.substring(0, 14) : digits;
        if (d.length() % 2 != 0) {
            throw new DateTimeException("Failed to parse HL7 datetime: " + hl7DateTime);
        }
        StringBuilder padded = new StringBuilder(d.substring(0, 4))
                .append(d.length() >= 6 ? d.substring(4, 6) : "01")
                .append(d.length() >= 8 ? d.substring(6, 8) : "01")
                .append(d.length() > 8 ? d.substring(8) : "");
        while (padded.length() < 14) {
            padded.append('0');
        }
        try {
            return LocalDateTime.parse(padded.toString(), HL7_DATETIME);
        } catch (Exception e) {
            throw new DateTimeException("Failed to parse HL7 datetime: " + hl7DateTime, e);
        }
    }

    /**
     * Parses the date part (first eight digits) of an HL7 DT or DTM value.
     */
    public static LocalDate parseHl7Date(String hl7Date) {
        if (hl7Date == null || hl7Date.isBlank()) {
            return null;
        }
        String value = hl7Date.trim();
        if (value.length() < 8) {
            throw new DateTimeException("Failed to parse HL7 date: " + hl7Date);
        }
        try {
            return LocalDate.parse(value.substring(0, 8), HL7_DATE);
        } catch (Exception e) {
            throw new DateTimeException("Failed to parse HL7 date: " + hl7Date, e);
        }
    }

    public static String formatToHl7Date(LocalDate localDate) {
        return localDate == null ? null : localDate.format(HL7_DATE);
    }

    public static String formatToHl7DateTime(LocalDateTime localDateTime) {
        return localDateTime == null ? null : localDateTime.format(HL7_DATETIME);
    }

    public static Date toDate(LocalDateTime localDateTime) {
        return localDateTime == null ? null : Date.from(localDateTime.atZone(ZoneId.systemDefault()).toInstant());
    }

    public static Date toDate(LocalDate date, LocalTime time) {
        if (date == null) {
            return null;
        }
        return toDate(time == null ? date.atStartOfDay() : date.atTime(time));
    }

    public static LocalDateTime toLocalDateTime(Date date) {
        return date == null ? null : LocalDateTime.ofInstant(date.toInstant(), ZoneId.systemDefault());
    }

    private static String stripOffsetAndFraction(String value) {
        int end = value.length();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '+' || c == '-' || c == '.') {
                end = i;
                break;
            }
        }
        return value.substring(0, end);
    }
}
