package com.zakat.hawl.api.dto;

import com.zakat.hawl.domain.model.NisabBasis;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Manual window creation. Every field is optional: start defaults to today, basis and
 * currency to the user's profile, threshold to the current oracle price.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateRecordRequest {

    @PastOrPresent
    private LocalDate hawlStartDate;

    private NisabBasis nisabBasis;

    @Pattern(regexp = "[A-Za-z]{3}", message = "must be a 3-letter ISO currency code")
    private String currency;

    @DecimalMin(value = "0.01")
    private BigDecimal thresholdValue;

    @Size(max = 1000)
    private String userNotes;
}
