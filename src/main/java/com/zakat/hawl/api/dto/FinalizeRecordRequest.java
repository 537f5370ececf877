package com.zakat.hawl.api.dto;

import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinalizeRecordRequest {

    /** Wealth confirmed by the user. Defaults to the aggregated total. */
    @DecimalMin(value = "0.00")
    private BigDecimal zakatableWealth;
}
