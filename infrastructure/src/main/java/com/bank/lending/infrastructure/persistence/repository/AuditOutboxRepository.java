package com.bank.lending.infrastructure.persistence.repository;

import com.bank.lending.infrastructure.persistence.entity.AuditOutboxEntity;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditOutboxRepository extends JpaRepository<AuditOutboxEntity, Long> {

    /**
     * Pending audit records, oldest first. Rows locked by another dispatcher are skipped.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("SELECT o FROM AuditOutboxEntity o WHERE o.publishedAt IS NULL ORDER BY o.id ASC")
    List<AuditOutboxEntity> findPending(Pageable pageable);

    long countByPublishedAtIsNull();
}
