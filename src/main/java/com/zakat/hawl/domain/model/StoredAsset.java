package com.zakat.hawl.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A zakat-eligible asset as read from the asset store. The monetary value is still encrypted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredAsset {

    private UUID assetId;
    private UUID userId;
    private String category;
    private String encryptedValue;
    private BigDecimal calculationModifier;
}
