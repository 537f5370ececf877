package com.zakat.hawl.infrastructure.persistence.repository;

import com.zakat.hawl.infrastructure.persistence.entity.AssetEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AssetRepository extends JpaRepository<AssetEntity, UUID> {

    List<AssetEntity> findByUserIdAndActiveTrueAndZakatEligibleTrue(UUID userId);

    @Query("select distinct a.userId from AssetEntity a where a.active = true")
    List<UUID> findUserIdsWithActiveAssets();
}
