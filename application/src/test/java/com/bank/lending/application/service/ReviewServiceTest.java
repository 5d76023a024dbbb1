package com.bank.lending.application.service;

import com.bank.lending.application.statemachine.ApplicationStateMachine;
import com.bank.lending.domain.audit.AuditSink;
import com.bank.lending.domain.enums.ApplicationStatus;
import com.bank.lending.domain.enums.AuditAction;
import com.bank.lending.domain.enums.DocumentStatus;
import com.bank.lending.domain.enums.DocumentType;
import com.bank.lending.domain.enums.VerifiableField;
import com.bank.lending.domain.enums.VerificationStatus;
import com.bank.lending.domain.exception.IllegalTransitionException;
import com.bank.lending.domain.exception.NotFoundException;
import com.bank.lending.domain.exception.ValidationException;
import com.bank.lending.domain.model.Actor;
import com.bank.lending.domain.model.TimelineEntry;
import com.bank.lending.domain.notification.RealtimeNotifier;
import com.bank.lending.infrastructure.persistence.entity.ApplicantEntity;
import com.bank.lending.infrastructure.persistence.entity.ApplicationEntity;
import com.bank.lending.infrastructure.persistence.entity.DataVerificationEntity;
import com.bank.lending.infrastructure.persistence.entity.DocumentEntity;
import com.bank.lending.infrastructure.persistence.repository.ApplicantRepository;
import com.bank.lending.infrastructure.persistence.repository.ApplicationRepository;
import com.bank.lending.infrastructure.persistence.repository.DocumentRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReviewServiceTest {

    @Mock
    private ApplicantRepository applicantRepository;

    @Mock
    private ApplicationRepository applicationRepository;

    @Mock
    private DocumentRepository documentRepository;

    @Mock
    private FieldVerificationStore verificationStore;

    @Mock
    private CorrectionCycleReconciler reconciler;

    @Mock
    private AuditSink auditSink;

    @Mock
    private RealtimeNotifier realtimeNotifier;

    private ReviewService service;
    private ApplicantEntity applicant;
    private ApplicationEntity application;
    private final Actor reviewer = Actor.of(7L, "Analista");

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);
        ApplicationStateMachine stateMachine = new ApplicationStateMachine(clock);
        ApplicationStatusService statusService = new ApplicationStatusService(applicationRepository, stateMachine,
                auditSink, new RealtimePublisher(realtimeNotifier), new MetricsService(new SimpleMeterRegistry()));
        service = new ReviewService(applicantRepository, applicationRepository, documentRepository, verificationStore,
                stateMachine, statusService, reconciler, auditSink, clock);

        applicant = ApplicantEntity.builder().id(10L).tenantId(1L).userId(100L).build();
        application = ApplicationEntity.builder()
                .id(1L).tenantId(1L).applicantId(10L).folio("SOL-20240301-ABC123")
                .status(ApplicationStatus.IN_REVIEW)
                .build();
    }

    @Test
    void testRejectFieldOpensCorrectionCycle() {
        // Given
        givenApplication();
        when(verificationStore.reject(applicant, VerifiableField.CURP, "CURP no coincide", reviewer))
                .thenReturn(verification(VerifiableField.CURP, VerificationStatus.REJECTED));

        // When
        service.rejectField(1L, "curp", "CURP no coincide", reviewer);

        // Then
        assertEquals(ApplicationStatus.CORRECTIONS_PENDING, application.getStatus());
        assertEquals("Dato rechazado: CURP", application.statusHistory().last().orElseThrow().getReason());
        List<TimelineEntry> timeline = application.timeline().entries();
        assertEquals("DATA_VERIFIED", timeline.get(0).getAction());
        assertEquals(false, timeline.get(0).getPayload().get("verified"));
        assertEquals("STATUS_CHANGED", timeline.get(1).getAction());
        verify(auditSink).emit(eq(AuditAction.DATA_REJECTED), eq(1L), anyMap());
        verify(auditSink).emit(eq(AuditAction.APPLICATION_STATUS_CHANGED), eq(1L), anyMap());
    }

    @Test
    void testRejectFieldWhileDraftKeepsStatus() {
        // Given
        application.setStatus(ApplicationStatus.DRAFT);
        givenApplication();
        when(verificationStore.reject(applicant, VerifiableField.PHONE, "No contesta", reviewer))
                .thenReturn(verification(VerifiableField.PHONE, VerificationStatus.REJECTED));

        // When
        service.rejectField(1L, "phone", "No contesta", reviewer);

        // Then
        assertEquals(ApplicationStatus.DRAFT, application.getStatus());
        assertTrue(application.statusHistory().isEmpty());
        verify(auditSink, never()).emit(eq(AuditAction.APPLICATION_STATUS_CHANGED), eq(1L), anyMap());
    }

    @Test
    void testRejectFieldRequiresReason() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> service.rejectField(1L, "curp", " ", reviewer));

        assertTrue(ex.getErrors().containsKey("rejection_reason"));
        verifyNoInteractions(applicationRepository, verificationStore);
    }

    @Test
    void testVerifyFieldAppendsTimeline() {
        // Given
        givenApplication();
        when(verificationStore.verify(applicant, VerifiableField.EMAIL, reviewer))
                .thenReturn(verification(VerifiableField.EMAIL, VerificationStatus.VERIFIED));

        // When
        service.verifyField(1L, "email", reviewer);

        // Then
        TimelineEntry entry = application.timeline().last().orElseThrow();
        assertEquals("DATA_VERIFIED", entry.getAction());
        assertEquals(true, entry.getPayload().get("verified"));
        assertEquals(ApplicationStatus.IN_REVIEW, application.getStatus());
        verify(auditSink).emit(eq(AuditAction.DATA_VERIFIED), eq(1L), anyMap());
    }

    @Test
    void testApprovedReplacementSupersedesRejectedAndReconciles() {
        // Given
        application.setStatus(ApplicationStatus.CORRECTIONS_PENDING);
        givenApplication();
        DocumentEntity rejectedLegacy = document(20L, DocumentType.RFC, DocumentStatus.REJECTED);
        DocumentEntity otherRejected = document(21L, DocumentType.PROOF_ADDRESS, DocumentStatus.REJECTED);
        DocumentEntity replacement = document(22L, DocumentType.RFC_CONSTANCIA, DocumentStatus.PENDING);
        when(documentRepository.findById(22L)).thenReturn(Optional.of(replacement));
        when(documentRepository.findByApplicationIdOrderByIdAsc(1L))
                .thenReturn(List.of(rejectedLegacy, otherRejected, replacement));

        // When
        DocumentEntity reviewed = service.reviewDocument(22L, true, null, reviewer);

        // Then
        assertEquals(DocumentStatus.APPROVED, reviewed.getStatus());
        assertEquals(7L, reviewed.getReviewedBy());
        verify(documentRepository).deleteAll(List.of(rejectedLegacy));
        verify(reconciler).reconcile(applicant, reviewer);
        verify(auditSink).emit(eq(AuditAction.DOCUMENT_REVIEWED), eq(1L), anyMap());
    }

    @Test
    void testRejectedDocumentOpensCorrectionCycle() {
        // Given
        givenApplication();
        DocumentEntity document = document(30L, DocumentType.PROOF_INCOME, DocumentStatus.PENDING);
        when(documentRepository.findById(30L)).thenReturn(Optional.of(document));

        // When
        service.reviewDocument(30L, false, "Ilegible", reviewer);

        // Then
        assertEquals(DocumentStatus.REJECTED, document.getStatus());
        assertEquals("Ilegible", document.getRejectionReason());
        assertEquals(ApplicationStatus.CORRECTIONS_PENDING, application.getStatus());
        assertEquals("Documento rechazado: Comprobante de ingresos",
                application.statusHistory().last().orElseThrow().getReason());
        verifyNoInteractions(reconciler);
    }

    @Test
    void testUnknownDocument() {
        when(documentRepository.findById(99L)).thenReturn(Optional.empty());

        NotFoundException ex = assertThrows(NotFoundException.class,
                () -> service.reviewDocument(99L, true, null, reviewer));

        assertEquals("Documento no encontrado", ex.getMessage());
    }

    @Test
    void testStaffCannotCloseCorrectionCycle() {
        // Given
        application.setStatus(ApplicationStatus.CORRECTIONS_PENDING);
        when(applicationRepository.findById(1L)).thenReturn(Optional.of(application));

        // When / Then
        assertThrows(IllegalTransitionException.class,
                () -> service.changeStatus(1L, ApplicationStatus.IN_REVIEW, "Listo", reviewer));
        assertEquals(ApplicationStatus.CORRECTIONS_PENDING, application.getStatus());
    }

    @Test
    void testStaffApproves() {
        when(applicationRepository.findById(1L)).thenReturn(Optional.of(application));

        service.changeStatus(1L, ApplicationStatus.APPROVED, "Cumple políticas", reviewer);

        assertEquals(ApplicationStatus.APPROVED, application.getStatus());
        assertNotNull(application.getApprovedAt());
    }

    private void givenApplication() {
        when(applicationRepository.findById(1L)).thenReturn(Optional.of(application));
        when(applicantRepository.findByIdForUpdate(10L)).thenReturn(Optional.of(applicant));
    }

    private static DataVerificationEntity verification(VerifiableField field, VerificationStatus status) {
        return DataVerificationEntity.builder().id(50L).tenantId(1L).applicantId(10L).fieldName(field).status(status).build();
    }

    private static DocumentEntity document(Long id, DocumentType type, DocumentStatus status) {
        return DocumentEntity.builder().id(id).applicationId(1L).type(type).status(status).fileName("doc.pdf").build();
    }
}
