package com.bank.lending.infrastructure.persistence.repository;

import com.bank.lending.infrastructure.persistence.entity.ApplicantEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ApplicantRepository extends JpaRepository<ApplicantEntity, Long> {

    Optional<ApplicantEntity> findByUserId(Long userId);

    /**
     * Load the applicant holding a row lock until the transaction ends.
     * Serializes corrections, uploads and reviews that may reconcile the applicant's applications.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM ApplicantEntity a WHERE a.userId = :userId")
    Optional<ApplicantEntity> findByUserIdForUpdate(@Param("userId") Long userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM ApplicantEntity a WHERE a.id = :id")
    Optional<ApplicantEntity> findByIdForUpdate(@Param("id") Long id);
}
