package com.bank.lending.api.controller;

import com.bank.lending.api.dto.ApplicationResponse;
import com.bank.lending.api.dto.DocumentResponse;
import com.bank.lending.api.dto.DocumentUploadRequest;
import com.bank.lending.api.dto.ReasonRequest;
import com.bank.lending.api.dto.ReferenceResponse;
import com.bank.lending.api.service.RequestContextExtractor;
import com.bank.lending.application.model.NewApplicationRequest;
import com.bank.lending.application.model.ReferenceRequest;
import com.bank.lending.application.service.ApplicationService;
import com.bank.lending.application.service.DocumentService;
import com.bank.lending.application.service.ReferenceService;
import com.bank.lending.application.service.SubmissionService;
import com.bank.lending.domain.model.Actor;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for the applicant's own applications
 */
@RestController
@RequestMapping("/api/applications")
public class ApplicationController {

    private final ApplicationService applicationService;
    private final SubmissionService submissionService;
    private final DocumentService documentService;
    private final ReferenceService referenceService;
    private final RequestContextExtractor contextExtractor;

    public ApplicationController(ApplicationService applicationService,
                                 SubmissionService submissionService,
                                 DocumentService documentService,
                                 ReferenceService referenceService,
                                 RequestContextExtractor contextExtractor) {
        this.applicationService = applicationService;
        this.submissionService = submissionService;
        this.documentService = documentService;
        this.referenceService = referenceService;
        this.contextExtractor = contextExtractor;
    }

    @PostMapping
    public ResponseEntity<ApplicationResponse> createApplication(@RequestBody NewApplicationRequest body,
                                                                 HttpServletRequest request) {
        Actor actor = contextExtractor.actor(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApplicationResponse.from(applicationService.createDraft(actor.getId(), body, actor)));
    }

    @GetMapping
    public ResponseEntity<List<ApplicationResponse>> listApplications(HttpServletRequest request) {
        Long userId = contextExtractor.requireUserId(request);
        return ResponseEntity.ok(applicationService.listApplications(userId).stream()
                .map(ApplicationResponse::from)
                .collect(Collectors.toList()));
    }

    @GetMapping("/{applicationId}")
    public ResponseEntity<ApplicationResponse> getApplication(@PathVariable Long applicationId,
                                                              HttpServletRequest request) {
        Long userId = contextExtractor.requireUserId(request);
        return ResponseEntity.ok(ApplicationResponse.from(applicationService.getApplication(applicationId, userId)));
    }

    @PostMapping("/{applicationId}/submit")
    public ResponseEntity<ApplicationResponse> submit(@PathVariable Long applicationId, HttpServletRequest request) {
        Actor actor = contextExtractor.actor(request);
        return ResponseEntity.ok(ApplicationResponse.from(submissionService.submit(applicationId, actor.getId(), actor)));
    }

    @PostMapping("/{applicationId}/cancel")
    public ResponseEntity<ApplicationResponse> cancel(@PathVariable Long applicationId,
                                                      @RequestBody(required = false) ReasonRequest body,
                                                      HttpServletRequest request) {
        Actor actor = contextExtractor.actor(request);
        String reason = body != null ? body.getReason() : null;
        return ResponseEntity.ok(ApplicationResponse.from(
                submissionService.cancel(applicationId, actor.getId(), reason, actor)));
    }

    @GetMapping("/{applicationId}/documents")
    public ResponseEntity<List<DocumentResponse>> listDocuments(@PathVariable Long applicationId,
                                                                HttpServletRequest request) {
        Long userId = contextExtractor.requireUserId(request);
        return ResponseEntity.ok(documentService.listDocuments(applicationId, userId).stream()
                .map(DocumentResponse::from)
                .collect(Collectors.toList()));
    }

    @PostMapping("/{applicationId}/documents")
    public ResponseEntity<DocumentResponse> registerDocument(@PathVariable Long applicationId,
                                                             @RequestBody DocumentUploadRequest body,
                                                             HttpServletRequest request) {
        Actor actor = contextExtractor.actor(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.from(
                documentService.registerUpload(applicationId, actor.getId(), body.getType(), body.getFileName(), actor)));
    }

    @GetMapping("/{applicationId}/references")
    public ResponseEntity<List<ReferenceResponse>> listReferences(@PathVariable Long applicationId,
                                                                  HttpServletRequest request) {
        Long userId = contextExtractor.requireUserId(request);
        return ResponseEntity.ok(referenceService.listReferences(applicationId, userId).stream()
                .map(ReferenceResponse::from)
                .collect(Collectors.toList()));
    }

    @PostMapping("/{applicationId}/references")
    public ResponseEntity<ReferenceResponse> addReference(@PathVariable Long applicationId,
                                                          @RequestBody ReferenceRequest body,
                                                          HttpServletRequest request) {
        Actor actor = contextExtractor.actor(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ReferenceResponse.from(
                referenceService.addReference(applicationId, actor.getId(), body, actor)));
    }

    @DeleteMapping("/{applicationId}/references/{referenceId}")
    public ResponseEntity<Void> removeReference(@PathVariable Long applicationId,
                                                @PathVariable Long referenceId,
                                                HttpServletRequest request) {
        Long userId = contextExtractor.requireUserId(request);
        referenceService.removeReference(applicationId, referenceId, userId);
        return ResponseEntity.noContent().build();
    }
}
