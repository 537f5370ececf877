package com.zakat.hawl.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Corrections applied to an unlocked record. Null fields are left untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordEdit {

    private BigDecimal thresholdValue;
    private BigDecimal zakatableWealth;
    private String userNotes;
}
