package com.connectfood.backend.global.common;

import java.util.Optional;
import java.util.UUID;

/**
 * Lenient parsing for ids that arrive as free text in query strings and bodies.
 */
public final class Uuids {

    private Uuids() {
    }

    /**
     * Empty for null, blank or malformed input.
     */
    public static Optional<UUID> tryParse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(value.trim()));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
