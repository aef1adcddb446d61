package com.askbetter.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A minimal edit and an ideal rewrite of the question, each at most
 * {@value #MAX_LENGTH} characters (code points).
 */
public record Rewrites(
    @JsonProperty(value = "minimal", required = true) String minimal,
    @JsonProperty(value = "ideal", required = true) String ideal
) implements Serializable {

    public static final int MAX_LENGTH = 280;

    public Rewrites {
        requireWithinCap("minimal", minimal);
        requireWithinCap("ideal", ideal);
    }

    private static void requireWithinCap(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("rewrites." + name + " must not be blank");
        }
        if (value.codePointCount(0, value.length()) > MAX_LENGTH) {
            throw new IllegalArgumentException("rewrites." + name + " exceeds " + MAX_LENGTH + " characters");
        }
    }
}
