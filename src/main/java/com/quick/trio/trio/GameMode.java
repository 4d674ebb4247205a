package com.quick.trio.trio;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GameMode {
    SIMPLE,  // 3 trios of any numbers
    SPICY;   // 2 connected trios

    /**
     * Anything other than "spicy" falls back to SIMPLE.
     */
    public static GameMode from(String value) {
        return value != null && "spicy".equalsIgnoreCase(value.trim()) ? SPICY : SIMPLE;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
