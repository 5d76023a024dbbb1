package com.bank.lending.application.model;

import lombok.Value;

/**
 * Outcome of routing a corrected value to its storage.
 * {@code applied} is false when there was no record to write to.
 */
@Value
public class RoutedCorrection {

    Object oldValue;
    boolean applied;

    public static RoutedCorrection applied(Object oldValue) {
        return new RoutedCorrection(oldValue, true);
    }

    public static RoutedCorrection notApplied(Object oldValue) {
        return new RoutedCorrection(oldValue, false);
    }
}
