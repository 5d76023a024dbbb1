package com.bank.lending.application.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything the applicant's correction screen needs in one response
 */
@Value
@Builder
public class CorrectionOverview {

    List<RejectedFieldView> rejectedFields;
    List<RejectedDocumentView> rejectedDocuments;
    List<CorrectionHistoryItem> correctionHistory;
    Map<String, Object> applicantData;
    List<PendingApplicationView> pendingApplications;
    boolean hasCorrectionsPending;

    public static CorrectionOverview empty() {
        return CorrectionOverview.builder()
                .rejectedFields(List.of())
                .rejectedDocuments(List.of())
                .correctionHistory(List.of())
                .applicantData(Map.of())
                .pendingApplications(List.of())
                .hasCorrectionsPending(false)
                .build();
    }
}
