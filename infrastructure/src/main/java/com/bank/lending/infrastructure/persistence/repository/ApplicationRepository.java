package com.bank.lending.infrastructure.persistence.repository;

import com.bank.lending.domain.enums.ApplicationStatus;
import com.bank.lending.infrastructure.persistence.entity.ApplicationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ApplicationRepository extends JpaRepository<ApplicationEntity, Long> {

    List<ApplicationEntity> findByApplicantIdOrderByIdAsc(Long applicantId);

    /**
     * Applications of an applicant in the given status, oldest first
     */
    List<ApplicationEntity> findByApplicantIdAndStatusOrderByIdAsc(Long applicantId, ApplicationStatus status);

    Optional<ApplicationEntity> findByIdAndApplicantId(Long id, Long applicantId);
}
