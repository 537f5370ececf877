package com.zakat.hawl.domain.model;

/**
 * Precious metals quoted by the price feed, with their ISO 4217 commodity codes.
 */
public enum MetalType {
    GOLD("XAU"),
    SILVER("XAG");

    private final String symbol;

    MetalType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
