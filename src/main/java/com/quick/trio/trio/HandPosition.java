package com.quick.trio.trio;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Which end of a sorted hand a reveal takes from.
 */
public enum HandPosition {
    LOWEST,
    HIGHEST;

    public static Optional<HandPosition> parse(String value) {
        if ("lowest".equals(value)) {
            return Optional.of(LOWEST);
        }
        if ("highest".equals(value)) {
            return Optional.of(HIGHEST);
        }
        return Optional.empty();
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
