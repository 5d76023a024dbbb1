package com.bank.lending.api.dto;

import com.bank.lending.infrastructure.persistence.entity.ReferenceEntity;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReferenceResponse {

    Long id;
    String fullName;
    String phone;
    String relationship;

    public static ReferenceResponse from(ReferenceEntity reference) {
        return ReferenceResponse.builder()
                .id(reference.getId())
                .fullName(reference.getFullName())
                .phone(reference.getPhone())
                .relationship(reference.getRelationship())
                .build();
    }
}
