package com.bank.lending.domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HistoryLogTest {

    @Test
    void testAppendReturnsNewLog() {
        HistoryLog<String> empty = HistoryLog.empty();

        HistoryLog<String> one = empty.append("a");
        HistoryLog<String> two = one.append("b");

        assertTrue(empty.isEmpty());
        assertEquals(List.of("a"), one.entries());
        assertEquals(List.of("a", "b"), two.entries());
        assertEquals("b", two.last().orElseThrow());
    }

    @Test
    void testEntriesCannotBeModified() {
        HistoryLog<String> log = HistoryLog.<String>empty().append("a");

        assertThrows(UnsupportedOperationException.class, () -> log.entries().add("b"));
        assertThrows(UnsupportedOperationException.class, () -> log.entries().clear());
    }

    @Test
    void testOfCopiesSource() {
        List<String> source = new ArrayList<>(List.of("a", "b"));

        HistoryLog<String> log = HistoryLog.of(source);
        source.clear();

        assertEquals(2, log.size());
    }

    @Test
    void testNullEntryRejected() {
        assertThrows(IllegalArgumentException.class, () -> HistoryLog.<String>empty().append(null));
    }

    @Test
    void testEmptyLogHasNoLast() {
        assertTrue(HistoryLog.of(null).last().isEmpty());
    }
}
