package com.zakat.hawl.domain.service;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.chrono.HijrahDate;

import static org.junit.jupiter.api.Assertions.*;

class HawlCalendarTest {

    private final HawlCalendar calendar = new HawlCalendar();

    @Test
    void expectedCompletion_isOneLunarYearLater() {
        assertEquals(LocalDate.of(2025, 2, 18), calendar.expectedCompletion(LocalDate.of(2024, 3, 1)));
    }

    @Test
    void toHijri_formatsUmmAlQuraDate() {
        LocalDate firstOfRamadan = LocalDate.from(HijrahDate.of(1445, 9, 1));

        assertEquals("1445-09-01", calendar.toHijri(firstOfRamadan));
        assertEquals(1445, calendar.hijriYear(firstOfRamadan));
    }

    @Test
    void isSupported_coversWholeWindowInsideHijriRange() {
        assertTrue(calendar.isSupported(LocalDate.of(2025, 3, 1)));
        assertFalse(calendar.isSupported(LocalDate.of(1850, 1, 1)));
        // Start converts, completion date falls past the end of the table
        assertFalse(calendar.isSupported(LocalDate.of(2174, 6, 1)));
    }

    @Test
    void isComplete_fromExpectedDateOnwards() {
        LocalDate expected = LocalDate.of(2025, 2, 19);

        assertFalse(calendar.isComplete(expected, expected.minusDays(1)));
        assertTrue(calendar.isComplete(expected, expected));
        assertTrue(calendar.isComplete(expected, expected.plusDays(10)));
    }

    @Test
    void progress_isClampedToTheWindow() {
        LocalDate start = LocalDate.of(2024, 3, 1);

        assertEquals(new BigDecimal("50.00"), calendar.progressPercent(start, start.plusDays(177)));
        assertEquals(new BigDecimal("100.00"), calendar.progressPercent(start, start.plusDays(400)));
        assertEquals(new BigDecimal("0.00"), calendar.progressPercent(start, start.minusDays(3)));
    }

    @Test
    void daysRemaining_neverNegative() {
        LocalDate expected = LocalDate.of(2025, 2, 19);

        assertEquals(9, calendar.daysRemaining(expected, expected.minusDays(9)));
        assertEquals(0, calendar.daysRemaining(expected, expected.plusDays(5)));
    }
}
