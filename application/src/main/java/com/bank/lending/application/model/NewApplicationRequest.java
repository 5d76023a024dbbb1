package com.bank.lending.application.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NewApplicationRequest {

    private String productCode;
    private String purpose;
    private BigDecimal requestedAmount;
    private Integer termMonths;
}
