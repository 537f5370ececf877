package com.zakat.hawl.infrastructure.persistence.repository;

import com.zakat.hawl.infrastructure.persistence.entity.AuditTrailEntryEntity;
import org.springframework.data.repository.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only access to the audit table. Extends the bare {@link Repository} marker so
 * no update or delete method is ever generated.
 */
@org.springframework.stereotype.Repository
public interface AuditTrailEntryRepository extends Repository<AuditTrailEntryEntity, UUID> {

    AuditTrailEntryEntity saveAndFlush(AuditTrailEntryEntity entry);

    List<AuditTrailEntryEntity> findByRecordIdOrderBySequenceNumberAsc(UUID recordId);

    Optional<AuditTrailEntryEntity> findFirstByRecordIdOrderBySequenceNumberDesc(UUID recordId);
}
