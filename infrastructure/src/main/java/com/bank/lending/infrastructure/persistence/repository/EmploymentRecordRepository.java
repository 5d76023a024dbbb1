package com.bank.lending.infrastructure.persistence.repository;

import com.bank.lending.infrastructure.persistence.entity.EmploymentRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface EmploymentRecordRepository extends JpaRepository<EmploymentRecordEntity, Long> {

    Optional<EmploymentRecordEntity> findFirstByApplicantIdAndCurrentRecordTrueOrderByIdDesc(Long applicantId);
}
