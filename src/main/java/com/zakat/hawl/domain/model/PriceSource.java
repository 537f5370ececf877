package com.zakat.hawl.domain.model;

/**
 * Where a threshold's metal price came from.
 */
public enum PriceSource {
    /** Non-expired cache row. */
    CACHED,
    /** Fetched from the feed during this lookup. */
    FRESH,
    /** Feed failed; most recent cache row used regardless of expiry. */
    STALE_FALLBACK
}
