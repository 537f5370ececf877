package com.zakat.hawl.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Summary of a user's open window. Only {@code active} is set when there is none.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HawlStatus {

    private boolean active;
    private UUID recordId;
    private LocalDate hawlStartDate;
    private String hawlStartDateHijri;
    private LocalDate expectedCompletionDate;
    private String expectedCompletionDateHijri;
    private Long daysRemaining;
    private NisabBasis nisabBasis;
    private String currency;
    private BigDecimal thresholdValue;
    private LiveHawlTracking liveTracking;
}
