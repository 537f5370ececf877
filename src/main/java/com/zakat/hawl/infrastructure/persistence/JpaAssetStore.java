package com.zakat.hawl.infrastructure.persistence;

import com.zakat.hawl.domain.model.StoredAsset;
import com.zakat.hawl.domain.service.AssetStore;
import com.zakat.hawl.infrastructure.persistence.entity.AssetEntity;
import com.zakat.hawl.infrastructure.persistence.repository.AssetRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class JpaAssetStore implements AssetStore {

    private final AssetRepository assetRepository;

    @Override
    @Transactional(readOnly = true)
    public List<StoredAsset> findZakatableAssets(UUID userId) {
        return assetRepository.findByUserIdAndActiveTrueAndZakatEligibleTrue(userId).stream()
                .map(this::toStoredAsset)
                .collect(Collectors.toList());
    }

    private StoredAsset toStoredAsset(AssetEntity asset) {
        return StoredAsset.builder()
                .assetId(asset.getAssetId())
                .userId(asset.getUserId())
                .category(asset.getCategory())
                .encryptedValue(asset.getEncryptedValue())
                .calculationModifier(asset.getCalculationModifier())
                .build();
    }
}
