package com.bank.lending.infrastructure.persistence.repository;

import com.bank.lending.infrastructure.persistence.entity.AddressEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AddressRepository extends JpaRepository<AddressEntity, Long> {

    /**
     * Current primary HOME address of an applicant
     */
    @Query("SELECT a FROM AddressEntity a WHERE a.applicantId = :applicantId " +
           "AND a.primaryAddress = true AND a.type = 'HOME'")
    Optional<AddressEntity> findPrimaryHomeAddress(@Param("applicantId") Long applicantId);
}
