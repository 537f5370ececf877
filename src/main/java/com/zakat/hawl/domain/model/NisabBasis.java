package com.zakat.hawl.domain.model;

import java.math.BigDecimal;

/**
 * Metal the Nisab threshold is measured against.
 *
 * The gram weights are the canonical definitions (20 mithqal of gold, 200 dirham of silver)
 * and are deliberately not configurable.
 */
public enum NisabBasis {
    GOLD(MetalType.GOLD, new BigDecimal("87.48")),
    SILVER(MetalType.SILVER, new BigDecimal("612.36"));

    private final MetalType metal;
    private final BigDecimal nisabGrams;

    NisabBasis(MetalType metal, BigDecimal nisabGrams) {
        this.metal = metal;
        this.nisabGrams = nisabGrams;
    }

    public MetalType getMetal() {
        return metal;
    }

    public BigDecimal getNisabGrams() {
        return nisabGrams;
    }
}
