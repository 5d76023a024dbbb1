package com.bank.lending.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Ordered, append-only log. Appending returns a new log; existing entries are never exposed mutably.
 *
 * @param <E> immutable entry type
 */
public final class HistoryLog<E> {

    private static final HistoryLog<?> EMPTY = new HistoryLog<>(Collections.emptyList());

    private final List<E> entries;

    private HistoryLog(List<E> entries) {
        this.entries = entries;
    }

    @SuppressWarnings("unchecked")
    public static <E> HistoryLog<E> empty() {
        return (HistoryLog<E>) EMPTY;
    }

    public static <E> HistoryLog<E> of(List<E> entries) {
        if (entries == null || entries.isEmpty()) {
            return empty();
        }
        return new HistoryLog<>(Collections.unmodifiableList(new ArrayList<>(entries)));
    }

    public HistoryLog<E> append(E entry) {
        if (entry == null) {
            throw new IllegalArgumentException("History entry cannot be null");
        }
        List<E> next = new ArrayList<>(entries.size() + 1);
        next.addAll(entries);
        next.add(entry);
        return new HistoryLog<>(Collections.unmodifiableList(next));
    }

    public List<E> entries() {
        return entries;
    }

    public Optional<E> last() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Stream<E> stream() {
        return entries.stream();
    }
}
