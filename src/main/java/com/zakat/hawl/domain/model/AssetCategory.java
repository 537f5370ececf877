package com.zakat.hawl.domain.model;

import java.util.Locale;

public enum AssetCategory {
    CASH,
    GOLD,
    SILVER,
    BUSINESS,
    CRYPTO,
    INVESTMENTS,
    RECEIVABLES,
    OTHER;

    /**
     * Lenient mapping from the asset store's free-form category label.
     * Unknown or missing labels fall into {@link #OTHER}.
     */
    public static AssetCategory fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return OTHER;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
