package com.bank.lending.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * User (or process) responsible for a change
 */
@Value
@Builder
@Jacksonized
public class Actor {

    private static final Actor SYSTEM = new Actor(null, "Sistema");

    Long id;
    String name;

    public static Actor of(Long id, String name) {
        return new Actor(id, name);
    }

    public static Actor system() {
        return SYSTEM;
    }
}
