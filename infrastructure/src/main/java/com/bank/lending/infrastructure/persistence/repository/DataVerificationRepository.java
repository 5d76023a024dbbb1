package com.bank.lending.infrastructure.persistence.repository;

import com.bank.lending.domain.enums.VerifiableField;
import com.bank.lending.domain.enums.VerificationStatus;
import com.bank.lending.infrastructure.persistence.entity.DataVerificationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface DataVerificationRepository extends JpaRepository<DataVerificationEntity, Long> {

    Optional<DataVerificationEntity> findByApplicantIdAndFieldName(Long applicantId, VerifiableField fieldName);

    Optional<DataVerificationEntity> findByApplicantIdAndFieldNameAndStatus(
            Long applicantId, VerifiableField fieldName, VerificationStatus status);

    List<DataVerificationEntity> findByApplicantIdAndStatusOrderByIdAsc(Long applicantId, VerificationStatus status);

    List<DataVerificationEntity> findByApplicantIdOrderByIdAsc(Long applicantId);

    /**
     * Fields corrected at or after the given instant, in correction order
     */
    @Query("SELECT v FROM DataVerificationEntity v WHERE v.applicantId = :applicantId " +
           "AND v.status = com.bank.lending.domain.enums.VerificationStatus.CORRECTED " +
           "AND v.correctedAt >= :since ORDER BY v.correctedAt ASC, v.id ASC")
    List<DataVerificationEntity> findCorrectedSince(@Param("applicantId") Long applicantId,
                                                    @Param("since") OffsetDateTime since);
}
