package com.bank.lending.infrastructure.persistence.repository;

import com.bank.lending.domain.enums.DocumentStatus;
import com.bank.lending.infrastructure.persistence.entity.DocumentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DocumentRepository extends JpaRepository<DocumentEntity, Long> {

    List<DocumentEntity> findByApplicationIdOrderByIdAsc(Long applicationId);

    /**
     * Documents in the given status across every application of an applicant
     */
    @Query("SELECT d FROM DocumentEntity d WHERE d.status = :status AND d.applicationId IN " +
           "(SELECT a.id FROM ApplicationEntity a WHERE a.applicantId = :applicantId) ORDER BY d.id ASC")
    List<DocumentEntity> findByApplicantIdAndStatus(@Param("applicantId") Long applicantId,
                                                    @Param("status") DocumentStatus status);

    @Query("SELECT CASE WHEN COUNT(d) > 0 THEN true ELSE false END FROM DocumentEntity d WHERE d.status = :status AND d.applicationId IN " +
           "(SELECT a.id FROM ApplicationEntity a WHERE a.applicantId = :applicantId)")
    boolean existsByApplicantIdAndStatus(@Param("applicantId") Long applicantId,
                                         @Param("status") DocumentStatus status);
}
