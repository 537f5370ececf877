package com.zakat.hawl.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class RecordCreatedChange extends AuditChange {

    private LocalDate hawlStartDate;
    private String hawlStartDateHijri;
    private LocalDate expectedCompletionDate;
    private NisabBasis nisabBasis;
    private String currency;
    private BigDecimal thresholdValue;
    private BigDecimal wealthAtStart;
}
