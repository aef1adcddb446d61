package com.askbetter.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Quality scores, each an integer in [{@value #MIN}, {@value #MAX}].
 */
public record Scores(
    @JsonProperty(value = "clarity", required = true) int clarity,
    @JsonProperty(value = "specificity", required = true) int specificity,
    @JsonProperty(value = "answerability", required = true) int answerability,
    @JsonProperty(value = "safety", required = true) int safety
) implements Serializable {

    public static final int MIN = 0;
    public static final int MAX = 10;

    public Scores {
        requireInRange("clarity", clarity);
        requireInRange("specificity", specificity);
        requireInRange("answerability", answerability);
        requireInRange("safety", safety);
    }

    private static void requireInRange(String name, int value) {
        if (value < MIN || value > MAX) {
            throw new IllegalArgumentException("scores." + name + " out of range: " + value);
        }
    }
}
