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
public class WindowInterruptedChange extends AuditChange {

    private BigDecimal currentWealth;
    private BigDecimal thresholdValue;
    private LocalDate interruptedOn;
    private long daysCompleted;
}
