package com.geons.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Server-selection strategy requested by a lookup.
 */
public enum Policy {
    GEO("geo"),
    GEO_OPTIONS("geo_options"),
    METRO("metro"),
    COUNTRY("country"),
    RANDOM("random"),
    ALL("all");

    private final String wireName;

    Policy(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a policy from its request parameter value (any case). Empty when unrecognised.
     */
    public static Optional<Policy> fromString(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (Policy policy : values()) {
            if (policy.wireName.equals(normalized)) {
                return Optional.of(policy);
            }
        }
        return Optional.empty();
    }
}
