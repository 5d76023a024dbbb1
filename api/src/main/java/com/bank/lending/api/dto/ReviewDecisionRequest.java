package com.bank.lending.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReviewDecisionRequest {
    private boolean approve;
    private String reason;
}
