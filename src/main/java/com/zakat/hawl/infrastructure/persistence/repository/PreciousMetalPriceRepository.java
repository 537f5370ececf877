package com.zakat.hawl.infrastructure.persistence.repository;

import com.zakat.hawl.domain.model.MetalType;
import com.zakat.hawl.infrastructure.persistence.entity.PreciousMetalPriceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PreciousMetalPriceRepository extends JpaRepository<PreciousMetalPriceEntity, UUID> {

    Optional<PreciousMetalPriceEntity> findFirstByMetalAndCurrencyOrderByFetchedAtDesc(MetalType metal, String currency);
}
