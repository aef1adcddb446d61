package com.askbetter.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The structured review of a single question.
 * <p>
 * Every bound of the output contract is checked in the compact constructor, so an
 * instance that exists is an instance that machine consumers can rely on: scores in
 * range, rewrites within their cap, lists within their caps and free of duplicates,
 * and flags drawn from the {@link Flag} vocabulary without repeats.
 */
@JsonPropertyOrder({"original_question", "classification", "scores", "missing_info",
        "assumptions", "followups", "rewrites", "flags"})
public record QuestionReview(
    @JsonProperty(value = "original_question", required = true)
    String originalQuestion,

    @JsonProperty(value = "classification", required = true)
    Classification classification,

    @JsonProperty(value = "scores", required = true)
    Scores scores,

    @JsonProperty(value = "missing_info", required = true)
    @JsonPropertyDescription("Essentials needed to answer, most important first (max 6)")
    List<String> missingInfo,

    @JsonProperty(value = "assumptions", required = true)
    @JsonPropertyDescription("Reasonable defaults you would assume (max 6)")
    List<String> assumptions,

    @JsonProperty(value = "followups", required = true)
    @JsonPropertyDescription("Short, targeted follow-up questions (max 5)")
    List<String> followups,

    @JsonProperty(value = "rewrites", required = true)
    Rewrites rewrites,

    @JsonProperty(value = "flags", required = true)
    @JsonPropertyDescription("Subset of: email, phone, card-ish, vague, unsafe")
    List<String> flags
) implements Serializable {

    public static final int MAX_MISSING_INFO = 6;
    public static final int MAX_ASSUMPTIONS = 6;
    public static final int MAX_FOLLOWUPS = 5;

    public QuestionReview {
        if (originalQuestion == null || originalQuestion.isEmpty()) {
            throw new IllegalArgumentException("original_question must not be empty");
        }
        if (classification == null) {
            throw new IllegalArgumentException("classification is required");
        }
        if (scores == null) {
            throw new IllegalArgumentException("scores is required");
        }
        if (rewrites == null) {
            throw new IllegalArgumentException("rewrites is required");
        }
        missingInfo = boundedList("missing_info", missingInfo, MAX_MISSING_INFO);
        assumptions = boundedList("assumptions", assumptions, MAX_ASSUMPTIONS);
        followups = boundedList("followups", followups, MAX_FOLLOWUPS);
        flags = knownFlags(flags);
    }

    /**
     * Returns a copy of this review carrying the given flags in their given order.
     */
    public QuestionReview withFlags(List<Flag> mergedFlags) {
        return new QuestionReview(originalQuestion, classification, scores,
                missingInfo, assumptions, followups, rewrites,
                mergedFlags.stream().map(Flag::tag).toList());
    }

    private static List<String> boundedList(String field, List<String> items, int cap) {
        if (items == null) {
            return List.of();
        }
        if (items.size() > cap) {
            throw new IllegalArgumentException(field + " exceeds " + cap + " entries");
        }
        Set<String> seen = new HashSet<>();
        for (String item : items) {
            if (item == null || item.isBlank()) {
                throw new IllegalArgumentException(field + " contains a blank entry");
            }
            if (!seen.add(item.toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException(field + " contains a duplicate entry: " + item);
            }
        }
        return List.copyOf(items);
    }

    private static List<String> knownFlags(List<String> flags) {
        if (flags == null) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        for (String tag : flags) {
            if (Flag.fromTag(tag).filter(f -> f.tag().equals(tag)).isEmpty()) {
                throw new IllegalArgumentException("unknown flag: " + tag);
            }
            if (!seen.add(tag)) {
                throw new IllegalArgumentException("duplicate flag: " + tag);
            }
        }
        return List.copyOf(flags);
    }
}
