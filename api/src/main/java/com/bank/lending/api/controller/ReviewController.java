package com.bank.lending.api.controller;

import com.bank.lending.api.dto.ApplicationResponse;
import com.bank.lending.api.dto.DocumentResponse;
import com.bank.lending.api.dto.ReasonRequest;
import com.bank.lending.api.dto.ReviewDecisionRequest;
import com.bank.lending.api.dto.StatusChangeRequest;
import com.bank.lending.api.dto.VerificationResponse;
import com.bank.lending.api.service.RequestContextExtractor;
import com.bank.lending.application.service.ReviewService;
import com.bank.lending.domain.enums.ApplicationStatus;
import com.bank.lending.domain.exception.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

/**
 * REST controller for staff review of applications
 */
@RestController
@RequestMapping("/api/review")
public class ReviewController {

    private final ReviewService reviewService;
    private final RequestContextExtractor contextExtractor;

    public ReviewController(ReviewService reviewService, RequestContextExtractor contextExtractor) {
        this.reviewService = reviewService;
        this.contextExtractor = contextExtractor;
    }

    @PostMapping("/applications/{applicationId}/fields/{fieldName}/verify")
    public ResponseEntity<VerificationResponse> verifyField(@PathVariable Long applicationId,
                                                            @PathVariable String fieldName,
                                                            HttpServletRequest request) {
        return ResponseEntity.ok(VerificationResponse.from(
                reviewService.verifyField(applicationId, fieldName, contextExtractor.actor(request))));
    }

    @PostMapping("/applications/{applicationId}/fields/{fieldName}/reject")
    public ResponseEntity<VerificationResponse> rejectField(@PathVariable Long applicationId,
                                                            @PathVariable String fieldName,
                                                            @RequestBody ReasonRequest body,
                                                            HttpServletRequest request) {
        return ResponseEntity.ok(VerificationResponse.from(reviewService.rejectField(
                applicationId, fieldName, body.getReason(), contextExtractor.actor(request))));
    }

    @PostMapping("/documents/{documentId}")
    public ResponseEntity<DocumentResponse> reviewDocument(@PathVariable Long documentId,
                                                           @RequestBody ReviewDecisionRequest body,
                                                           HttpServletRequest request) {
        return ResponseEntity.ok(DocumentResponse.from(reviewService.reviewDocument(
                documentId, body.isApprove(), body.getReason(), contextExtractor.actor(request))));
    }

    @PostMapping("/applications/{applicationId}/status")
    public ResponseEntity<ApplicationResponse> changeStatus(@PathVariable Long applicationId,
                                                            @RequestBody StatusChangeRequest body,
                                                            HttpServletRequest request) {
        ApplicationStatus target = parseStatus(body.getStatus());
        return ResponseEntity.ok(ApplicationResponse.from(reviewService.changeStatus(
                applicationId, target, body.getReason(), contextExtractor.actor(request))));
    }

    private ApplicationStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            throw ValidationException.of("status", "El estado es obligatorio");
        }
        try {
            return ApplicationStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw ValidationException.of("status", "Estado no válido: " + status);
        }
    }
}
