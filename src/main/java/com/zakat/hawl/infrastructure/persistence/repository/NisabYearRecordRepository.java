package com.zakat.hawl.infrastructure.persistence.repository;

import com.zakat.hawl.domain.model.RecordStatus;
import com.zakat.hawl.infrastructure.persistence.entity.NisabYearRecordEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface NisabYearRecordRepository extends JpaRepository<NisabYearRecordEntity, UUID> {

    /**
     * Find record with pessimistic write lock.
     *
     * Serializes every transition on one record, so a manual finalize and the
     * detection job's interruption cannot both apply to the same draft.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from NisabYearRecordEntity r where r.recordId = :recordId")
    Optional<NisabYearRecordEntity> findForUpdate(@Param("recordId") UUID recordId);

    Optional<NisabYearRecordEntity> findFirstByUserIdAndStatus(UUID userId, RecordStatus status);

    @Query("select r from NisabYearRecordEntity r where r.userId = :userId"
            + " and r.status in :statuses"
            + " and (:hijriYear is null or r.hawlStartHijriYear = :hijriYear)"
            + " order by r.createdAt desc")
    Page<NisabYearRecordEntity> search(@Param("userId") UUID userId,
                                       @Param("statuses") Collection<RecordStatus> statuses,
                                       @Param("hijriYear") Integer hijriYear,
                                       Pageable pageable);

    @Query("select distinct r.userId from NisabYearRecordEntity r where r.status = :status")
    List<UUID> findUserIdsWithStatus(@Param("status") RecordStatus status);
}
