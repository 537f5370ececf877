package com.zakat.hawl.domain.service;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.chrono.HijrahChronology;
import java.time.chrono.HijrahDate;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;

/**
 * Lunar-year arithmetic for the Hawl window.
 *
 * Hijri dates use the JDK's Umm al-Qura chronology and are rendered as {@code yyyy-MM-dd}.
 * Both calendars are computed once when a record is created and stored with it.
 */
@Component
public class HawlCalendar {

    public static final int HAWL_DAYS = 354;

    public LocalDate expectedCompletion(LocalDate hawlStart) {
        return hawlStart.plusDays(HAWL_DAYS);
    }

    /**
     * Whether the window starting on {@code hawlStart}, including its completion date,
     * lies inside the range the Hijri chronology can convert.
     */
    public boolean isSupported(LocalDate hawlStart) {
        return isConvertible(hawlStart) && isConvertible(expectedCompletion(hawlStart));
    }

    public String toHijri(LocalDate date) {
        HijrahDate hijri = HijrahDate.from(date);
        return String.format("%04d-%02d-%02d",
                hijri.get(ChronoField.YEAR),
                hijri.get(ChronoField.MONTH_OF_YEAR),
                hijri.get(ChronoField.DAY_OF_MONTH));
    }

    public int hijriYear(LocalDate date) {
        return HijrahDate.from(date).get(ChronoField.YEAR);
    }

    private boolean isConvertible(LocalDate date) {
        return HijrahChronology.INSTANCE.range(ChronoField.EPOCH_DAY).isValidValue(date.toEpochDay());
    }

    public boolean isComplete(LocalDate expectedCompletion, LocalDate today) {
        return !today.isBefore(expectedCompletion);
    }

    public long daysElapsed(LocalDate hawlStart, LocalDate today) {
        return Math.max(0, ChronoUnit.DAYS.between(hawlStart, today));
    }

    public long daysRemaining(LocalDate expectedCompletion, LocalDate today) {
        return Math.max(0, ChronoUnit.DAYS.between(today, expectedCompletion));
    }

    /**
     * Share of the window elapsed, 0 to 100 with two decimals.
     */
    public BigDecimal progressPercent(LocalDate hawlStart, LocalDate today) {
        long elapsed = Math.min(daysElapsed(hawlStart, today), HAWL_DAYS);
        return BigDecimal.valueOf(elapsed)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(HAWL_DAYS), 2, RoundingMode.HALF_UP);
    }
}
