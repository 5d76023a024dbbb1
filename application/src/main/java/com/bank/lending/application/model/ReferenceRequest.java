package com.bank.lending.application.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReferenceRequest {

    private String fullName;
    private String phone;
    private String relationship;
}
