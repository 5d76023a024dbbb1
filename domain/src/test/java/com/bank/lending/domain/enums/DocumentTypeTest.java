package com.bank.lending.domain.enums;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTypeTest {

    @Test
    void testLegacyRfcDocumentIsEquivalent() {
        assertEquals(DocumentType.RFC_CONSTANCIA, DocumentType.RFC.canonical());
        assertTrue(DocumentType.RFC.isEquivalentTo(DocumentType.RFC_CONSTANCIA));
        assertFalse(DocumentType.RFC.isEquivalentTo(DocumentType.CURP));
        assertTrue(DocumentType.tryFrom("rfc_constancia").isPresent());
        assertTrue(DocumentType.tryFrom("PASSPORT").isEmpty());
    }

    @Test
    void testUnknownEmploymentTypeDefaultsToEmployee() {
        assertEquals(EmploymentType.SELF_EMPLOYED, EmploymentType.fromCode("self_employed"));
        assertEquals(EmploymentType.EMPLOYEE, EmploymentType.fromCode("astronaut"));
    }

    @Test
    void testTerminalStatuses() {
        assertTrue(ApplicationStatus.CANCELLED.isTerminal());
        assertTrue(ApplicationStatus.SYNCED.isTerminal());
        assertFalse(ApplicationStatus.CORRECTIONS_PENDING.isTerminal());
        assertTrue(ApplicationStatus.CORRECTIONS_PENDING.isEditable());
    }
}
