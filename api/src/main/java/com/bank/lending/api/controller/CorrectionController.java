package com.bank.lending.api.controller;

import com.bank.lending.api.service.RequestContextExtractor;
import com.bank.lending.application.model.CorrectionOverview;
import com.bank.lending.application.model.CorrectionRequest;
import com.bank.lending.application.model.CorrectionResult;
import com.bank.lending.application.model.FieldVerificationView;
import com.bank.lending.application.service.CorrectionService;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the applicant's data corrections
 */
@RestController
@RequestMapping("/api/corrections")
public class CorrectionController {

    private static final Logger log = LoggerFactory.getLogger(CorrectionController.class);

    private final CorrectionService correctionService;
    private final RequestContextExtractor contextExtractor;

    public CorrectionController(CorrectionService correctionService, RequestContextExtractor contextExtractor) {
        this.correctionService = correctionService;
        this.contextExtractor = contextExtractor;
    }

    @GetMapping
    public ResponseEntity<CorrectionOverview> getOverview(HttpServletRequest request) {
        Long userId = contextExtractor.requireUserId(request);
        return ResponseEntity.ok(correctionService.overview(userId));
    }

    @GetMapping("/{fieldName}")
    public ResponseEntity<FieldVerificationView> getField(@PathVariable String fieldName, HttpServletRequest request) {
        Long userId = contextExtractor.requireUserId(request);
        return ResponseEntity.ok(correctionService.fieldDetail(userId, fieldName));
    }

    @PostMapping
    public ResponseEntity<CorrectionResult> submitCorrection(@RequestBody CorrectionRequest correction,
                                                             HttpServletRequest request) {
        CorrectionResult result = correctionService.submitCorrection(
                contextExtractor.requireUserId(request),
                contextExtractor.actor(request),
                correction,
                contextExtractor.metadata(request));
        log.info("Correction of {} accepted (verification {}, {} application(s) back to review)",
                result.getFieldName(), result.getVerificationId(), result.getApplicationsAdvanced().size());
        return ResponseEntity.ok(result);
    }
}
