package com.zakat.hawl.domain.service;

import com.zakat.hawl.domain.model.StoredAsset;

import java.util.List;
import java.util.UUID;

/**
 * Read access to the external asset store.
 */
public interface AssetStore {

    /**
     * Active, zakat-eligible assets of a user, values still encrypted.
     */
    List<StoredAsset> findZakatableAssets(UUID userId);
}
