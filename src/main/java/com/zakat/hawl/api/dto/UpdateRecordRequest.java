package com.zakat.hawl.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateRecordRequest {

    @DecimalMin(value = "0.01")
    private BigDecimal thresholdValue;

    @DecimalMin(value = "0.00")
    private BigDecimal zakatableWealth;

    @Size(max = 1000)
    private String userNotes;
}
