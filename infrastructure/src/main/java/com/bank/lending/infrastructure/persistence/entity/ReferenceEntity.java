package com.bank.lending.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * JPA entity for personal references attached to an application
 */
@Entity
@Table(name = "personal_reference", indexes = {
    @Index(name = "idx_reference_application_id", columnList = "application_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReferenceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "application_id", nullable = false)
    private Long applicationId;

    @Column(name = "full_name", nullable = false, length = 255)
    private String fullName;

    @Column(name = "phone", nullable = false, length = 20)
    private String phone;

    @Column(name = "relationship", length = 50)
    private String relationship;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;
}
