package com.al.radiologyfiller.util;

import org.junit.jupiter.api.Test;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

public class DateTimeUtilTest {

    @Test
    public void testParseHl7DateTime_Full() {
        LocalDateTime result = DateTimeUtil.parseHl7DateTime("20251110083015");

        assertEquals(LocalDateTime.of(2025, 11, 10, 8, 30, 15), result);
    }

    @Test
    public void testParseHl7DateTime_OffsetIsIgnored() {
        LocalDateTime result = DateTimeUtil.parseHl7DateTime("20260116120000-0500");

        assertEquals(LocalDateTime.of(2026, 1, 16, 12, 0), result);
    }

    @Test
    public void testParseHl7DateTime_FractionalSeconds() {
        LocalDateTime result = DateTimeUtil.parseHl7DateTime("20260116120000.1234+0530");

        assertEquals(LocalDateTime.of(2026, 1, 16, 12, 0), result);
    }

    @Test
    public void testParseHl7DateTime_ReducedPrecision() {
        assertEquals(LocalDateTime.of(2026, 1, 1, 0, 0), DateTimeUtil.parseHl7DateTime("2026"));
        assertEquals(LocalDateTime.of(2026, 3, 1, 0, 0), DateTimeUtil.parseHl7DateTime("202603"));
        assertEquals(LocalDateTime.of(2026, 3, 9, 14, 0), DateTimeUtil.parseHl7DateTime("2026030914"));
    }

    @Test
    public void testParseHl7DateTime_Empty() {
        assertNull(DateTimeUtil.parseHl7DateTime(null));
        assertNull(DateTimeUtil.parseHl7DateTime("  "));
    }

    @Test
    public void testParseHl7DateTime_Invalid() {
        assertThrows(DateTimeException.class, () -> DateTimeUtil.parseHl7DateTime("yesterday"));
        assertThrows(DateTimeException.class, () -> DateTimeUtil.parseHl7DateTime("20261"));
        assertThrows(DateTimeException.class, () -> DateTimeUtil.parseHl7DateTime("20261399"));
    }

    @Test
    public void testParseHl7Date() {
        assertEquals(LocalDate.of(1980, 1, 15), DateTimeUtil.parseHl7Date("19800115"));
        assertEquals(LocalDate.of(1980, 1, 15), DateTimeUtil.parseHl7Date("198001151230"));
        assertThrows(DateTimeException.class, () -> DateTimeUtil.parseHl7Date("1980"));
    }

    @Test
    public void testFormat() {
        assertEquals("20251110", DateTimeUtil.formatToHl7Date(LocalDate.of(2025, 11, 10)));
        assertEquals("20251110083000", DateTimeUtil.formatToHl7DateTime(LocalDateTime.of(2025, 11, 10, 8, 30)));
        assertNull(DateTimeUtil.formatToHl7Date(null));
    }

    @Test
    public void testToDateRoundTripsLocalTime() {
        LocalDateTime value = LocalDateTime.of(2025, 11, 10, 9, 45);

        assertEquals(value, DateTimeUtil.toLocalDateTime(
                DateTimeUtil.toDate(LocalDate.of(2025, 11, 10), LocalTime.of(9, 45))));
        assertNull(DateTimeUtil.toDate(null, LocalTime.NOON));
    }
}
