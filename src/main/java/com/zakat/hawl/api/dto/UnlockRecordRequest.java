package com.zakat.hawl.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Length bounds on the reason are enforced by the record lifecycle, which reports
 * them as an insufficient justification rather than a generic validation error.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnlockRecordRequest {

    @NotNull
    private String reason;
}
