package com.bank.lending.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * JPA entity for applicant addresses. At most one primary row per type.
 */
@Entity
@Table(name = "address", indexes = {
    @Index(name = "idx_address_applicant_id", columnList = "applicant_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddressEntity {

    public static final String TYPE_HOME = "HOME";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "applicant_id", nullable = false)
    private Long applicantId;

    @Column(name = "type", nullable = false, length = 20)
    @Builder.Default
    private String type = TYPE_HOME;

    @Column(name = "is_primary", nullable = false)
    @Builder.Default
    private boolean primaryAddress = true;

    @Column(name = "street", length = 255)
    private String street;

    @Column(name = "ext_number", length = 20)
    private String extNumber;

    @Column(name = "int_number", length = 20)
    private String intNumber;

    @Column(name = "neighborhood", length = 255)
    private String neighborhood;

    @Column(name = "postal_code", length = 10)
    private String postalCode;

    @Column(name = "municipality", length = 255)
    private String municipality;

    @Column(name = "state", length = 100)
    private String state;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;
}
