package com.zakat.hawl.domain.service;

import com.zakat.hawl.domain.model.NisabBasis;
import com.zakat.hawl.domain.model.RecordStatus;
import com.zakat.hawl.infrastructure.persistence.entity.NisabYearRecordEntity;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.UUID;

final class TestFixtures {

    static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    static final LocalDate TODAY = LocalDate.of(2025, 3, 1);
    static final String KEY = Base64.getEncoder().encodeToString(new byte[32]);

    private TestFixtures() {
    }

    static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    static EncryptionService encryptionService() {
        return new EncryptionService(KEY);
    }

    static NisabYearRecordEntity draft(UUID userId, LocalDate hawlStart, String threshold) {
        return NisabYearRecordEntity.builder()
                .recordId(UUID.randomUUID())
                .userId(userId)
                .openWindowUserId(userId)
                .status(RecordStatus.DRAFT)
                .hawlStartDate(hawlStart)
                .hawlStartDateHijri("1446-01-01")
                .hawlStartHijriYear(1446)
                .expectedCompletionDate(hawlStart.plusDays(HawlCalendar.HAWL_DAYS))
                .expectedCompletionDateHijri("1447-01-01")
                .nisabBasis(NisabBasis.GOLD)
                .currency("USD")
                .thresholdValue(new BigDecimal(threshold))
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }
}
