package com.askbetter.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Serializable;

/**
 * Untrusted output of the generation step: a parsed JSON object whose fields may be
 * missing, out of range or of the wrong shape, together with the raw text it was
 * parsed from.
 */
public record CandidateRecord(JsonNode root, String rawText) implements Serializable {

    public CandidateRecord {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("candidate root must be a JSON object");
        }
    }

    public JsonNode field(String name) {
        return root.get(name);
    }
}
