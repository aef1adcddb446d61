package com.askbetter.core.error;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User-visible failure: kind plus description, never a partial review.
 */
public record ReviewError(
    @JsonProperty("kind") ErrorKind kind,
    @JsonProperty("description") String description
) {

    public static ReviewError of(ReviewException e) {
        return new ReviewError(e.kind(), e.getMessage());
    }
}
