package com.bank.lending.application.service;

import com.bank.lending.domain.audit.AuditSink;
import com.bank.lending.domain.enums.ApplicationStatus;
import com.bank.lending.domain.enums.AuditAction;
import com.bank.lending.domain.enums.DocumentStatus;
import com.bank.lending.domain.enums.DocumentType;
import com.bank.lending.domain.exception.ValidationException;
import com.bank.lending.domain.model.Actor;
import com.bank.lending.domain.model.TimelineEntry;
import com.bank.lending.infrastructure.persistence.entity.ApplicantEntity;
import com.bank.lending.infrastructure.persistence.entity.ApplicationEntity;
import com.bank.lending.infrastructure.persistence.entity.DocumentEntity;
import com.bank.lending.infrastructure.persistence.repository.ApplicantRepository;
import com.bank.lending.infrastructure.persistence.repository.ApplicationRepository;
import com.bank.lending.infrastructure.persistence.repository.DocumentRepository;
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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DocumentServiceTest {

    @Mock
    private ApplicantRepository applicantRepository;

    @Mock
    private ApplicationRepository applicationRepository;

    @Mock
    private DocumentRepository documentRepository;

    @Mock
    private CorrectionCycleReconciler reconciler;

    @Mock
    private AuditSink auditSink;

    private DocumentService service;
    private ApplicantEntity applicant;
    private ApplicationEntity application;
    private final Actor actor = Actor.of(100L, "Juan Perez");

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);
        service = new DocumentService(applicantRepository, applicationRepository, documentRepository,
                reconciler, auditSink, clock);
        applicant = ApplicantEntity.builder().id(10L).tenantId(1L).userId(100L).build();
        application = ApplicationEntity.builder().id(1L).tenantId(1L).applicantId(10L)
                .status(ApplicationStatus.DRAFT).build();
    }

    @Test
    void testUploadReplacesPendingOfSameType() {
        // Given
        givenApplication();
        DocumentEntity pending = document(5L, DocumentType.INE_FRONT, DocumentStatus.PENDING);
        when(documentRepository.findByApplicationIdOrderByIdAsc(1L)).thenReturn(List.of(pending));
        when(documentRepository.save(any(DocumentEntity.class))).thenAnswer(inv -> {
            DocumentEntity saved = inv.getArgument(0);
            saved.setId(6L);
            return saved;
        });

        // When
        DocumentEntity uploaded = service.registerUpload(1L, 100L, "ine_front", "ine.jpg", actor);

        // Then
        assertEquals(DocumentStatus.PENDING, uploaded.getStatus());
        assertEquals(DocumentType.INE_FRONT, uploaded.getType());
        verify(documentRepository).deleteAll(List.of(pending));
        TimelineEntry entry = application.timeline().last().orElseThrow();
        assertEquals("DOC_UPLOADED", entry.getAction());
        assertEquals(true, entry.getPayload().get("replaced"));
        verify(auditSink).emit(eq(AuditAction.DOCUMENT_UPLOADED), eq(1L), anyMap());
        verifyNoInteractions(reconciler);
    }

    @Test
    void testApprovedDocumentCannotBeReplaced() {
        // Given
        givenApplication();
        when(documentRepository.findByApplicationIdOrderByIdAsc(1L))
                .thenReturn(List.of(document(5L, DocumentType.RFC, DocumentStatus.APPROVED)));

        // When
        ValidationException ex = assertThrows(ValidationException.class,
                () -> service.registerUpload(1L, 100L, "RFC_CONSTANCIA", "rfc.pdf", actor));

        // Then
        assertTrue(ex.getErrors().containsKey("type"));
        verify(documentRepository, never()).save(any());
    }

    @Test
    void testUploadDuringCorrectionsReconciles() {
        // Given
        application.setStatus(ApplicationStatus.CORRECTIONS_PENDING);
        givenApplication();
        DocumentEntity rejected = document(5L, DocumentType.PROOF_ADDRESS, DocumentStatus.REJECTED);
        when(documentRepository.findByApplicationIdOrderByIdAsc(1L)).thenReturn(List.of(rejected));
        when(documentRepository.save(any(DocumentEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        service.registerUpload(1L, 100L, "PROOF_ADDRESS", "recibo.pdf", actor);

        // Then
        verify(documentRepository, never()).deleteAll(any());
        assertEquals(DocumentStatus.REJECTED, rejected.getStatus());
        verify(reconciler).reconcile(applicant, actor);
    }

    @Test
    void testUploadRefusedAfterApproval() {
        application.setStatus(ApplicationStatus.APPROVED);
        givenApplication();

        ValidationException ex = assertThrows(ValidationException.class,
                () -> service.registerUpload(1L, 100L, "PROOF_INCOME", "nomina.pdf", actor));

        assertTrue(ex.getErrors().containsKey("application"));
    }

    @Test
    void testUnknownTypeAndBlankFileName() {
        ValidationException badType = assertThrows(ValidationException.class,
                () -> service.registerUpload(1L, 100L, "PASSPORT_SCAN", "x.pdf", actor));
        ValidationException noFile = assertThrows(ValidationException.class,
                () -> service.registerUpload(1L, 100L, "SELFIE", " ", actor));

        assertTrue(badType.getErrors().containsKey("type"));
        assertTrue(noFile.getErrors().containsKey("file_name"));
        verifyNoInteractions(applicantRepository);
    }

    private void givenApplication() {
        when(applicantRepository.findByUserIdForUpdate(100L)).thenReturn(Optional.of(applicant));
        when(applicationRepository.findByIdAndApplicantId(1L, 10L)).thenReturn(Optional.of(application));
    }

    private static DocumentEntity document(Long id, DocumentType type, DocumentStatus status) {
        return DocumentEntity.builder().id(id).applicationId(1L).type(type).status(status).fileName("doc.pdf").build();
    }
}
