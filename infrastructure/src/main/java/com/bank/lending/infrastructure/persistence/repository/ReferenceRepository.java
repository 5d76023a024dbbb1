package com.bank.lending.infrastructure.persistence.repository;

import com.bank.lending.infrastructure.persistence.entity.ReferenceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ReferenceRepository extends JpaRepository<ReferenceEntity, Long> {

    List<ReferenceEntity> findByApplicationIdOrderByIdAsc(Long applicationId);

    long countByApplicationId(Long applicationId);
}
