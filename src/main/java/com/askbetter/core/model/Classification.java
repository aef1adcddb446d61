package com.askbetter.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Short categorical tags for a question, e.g. domain "coding" and type "debug".
 */
public record Classification(
    @JsonProperty(value = "domain", required = true) String domain,
    @JsonProperty(value = "type", required = true) String type
) implements Serializable {

    public Classification {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("classification.domain must not be blank");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("classification.type must not be blank");
        }
    }
}
