package com.askbetter.core.validation;

import com.askbetter.core.error.ValidationException;
import com.askbetter.core.model.CandidateRecord;
import com.askbetter.core.model.Classification;
import com.askbetter.core.model.Flag;
import com.askbetter.core.model.QuestionReview;
import com.askbetter.core.model.Rewrites;
import com.askbetter.core.model.Scores;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Coerces an untrusted {@link CandidateRecord} into a {@link QuestionReview}.
 * <p>
 * Repairable problems are repaired: scores are clamped, over-long rewrites are cut at
 * a word boundary, lists are de-duplicated and capped, unknown flags are dropped.
 * Anything that cannot be coerced is collected as a defect, and a candidate with at
 * least one defect is rejected with a {@link ValidationException} naming every
 * offending field. Whitespace is stripped with {@link String#strip()}, the same
 * notion of blank the model records apply.
 */
@Component
public class SchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    private static final List<String> SCORE_FIELDS =
            List.of("clarity", "specificity", "answerability", "safety");

    /** Collects defects for one validation run. */
    private static final class Defects {
        private final Set<String> fields = new LinkedHashSet<>();
        private final List<String> problems = new ArrayList<>();

        void add(String field, String problem) {
            fields.add(field);
            problems.add(field + ": " + problem);
        }

        boolean isEmpty() {
            return fields.isEmpty();
        }

        /**
         * Runs a record constructor, recording its rejection as a defect of
         * {@code field} instead of letting it escape.
         */
        <T> T construct(String field, Supplier<T> constructor) {
            try {
                return constructor.get();
            } catch (IllegalArgumentException e) {
                add(field, e.getMessage());
                return null;
            }
        }
    }

    /**
     * Validates and normalizes a candidate.
     *
     * @param candidate        untrusted generation output
     * @param originalQuestion the caller's question; always replaces whatever the
     *                         candidate echoed back
     * @return the normalized review; its flags are the generated flags only
     * @throws ValidationException if any field cannot be coerced
     */
    public QuestionReview validate(CandidateRecord candidate, String originalQuestion) {
        var defects = new Defects();

        Classification classification = classification(candidate.field("classification"), defects);
        Scores scores = scores(candidate.field("scores"), defects);
        Rewrites rewrites = rewrites(candidate.field("rewrites"), defects);
        List<String> missingInfo = list("missing_info", candidate.field("missing_info"),
                QuestionReview.MAX_MISSING_INFO, defects);
        List<String> assumptions = list("assumptions", candidate.field("assumptions"),
                QuestionReview.MAX_ASSUMPTIONS, defects);
        List<String> followups = list("followups", candidate.field("followups"),
                QuestionReview.MAX_FOLLOWUPS, defects);
        List<String> flags = flags(candidate.field("flags")).stream().map(Flag::tag).toList();

        if (defects.isEmpty()) {
            QuestionReview review = defects.construct("review", () -> new QuestionReview(originalQuestion,
                    classification, scores, missingInfo, assumptions, followups, rewrites, flags));
            if (review != null) {
                return review;
            }
        }
        log.debug("Candidate rejected, defective fields: {}", defects.fields);
        throw new ValidationException(List.copyOf(defects.fields), defects.problems);
    }

    /**
     * Normalizes the candidate's flags: lower-cased, de-duplicated and restricted to
     * the known vocabulary. A missing or non-array value yields no flags.
     */
    public Set<Flag> flags(JsonNode node) {
        EnumSet<Flag> flags = EnumSet.noneOf(Flag.class);
        if (node == null || !node.isArray()) {
            return flags;
        }
        for (JsonNode entry : node) {
            if (entry.isTextual()) {
                Flag.fromTag(entry.asText()).ifPresent(flags::add);
            }
        }
        return flags;
    }

    private Classification classification(JsonNode node, Defects defects) {
        if (node == null || node.isNull() || !node.isObject()) {
            defects.add("classification", "missing or not an object");
            return null;
        }
        String domain = tag(node.get("domain"));
        String type = tag(node.get("type"));
        if (domain == null) {
            defects.add("classification.domain", "missing or empty");
        }
        if (type == null) {
            defects.add("classification.type", "missing or empty");
        }
        if (domain == null || type == null) {
            return null;
        }
        return defects.construct("classification", () -> new Classification(domain, type));
    }

    private static String tag(JsonNode node) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText().strip().toLowerCase(Locale.ROOT);
    }

    private Scores scores(JsonNode node, Defects defects) {
        if (node == null || node.isNull() || !node.isObject()) {
            defects.add("scores", "missing or not an object");
            return null;
        }
        int[] values = new int[SCORE_FIELDS.size()];
        boolean complete = true;
        for (int i = 0; i < SCORE_FIELDS.size(); i++) {
            String name = SCORE_FIELDS.get(i);
            Integer value = score(node.get(name));
            if (value == null) {
                defects.add("scores." + name, "missing or not numeric");
                complete = false;
            } else {
                values[i] = value;
            }
        }
        if (!complete) {
            return null;
        }
        return defects.construct("scores", () -> new Scores(values[0], values[1], values[2], values[3]));
    }

    static Integer score(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        double raw;
        if (node.isNumber()) {
            raw = node.asDouble();
        } else if (node.isTextual()) {
            try {
                raw = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        if (Double.isNaN(raw)) {
            return null;
        }
        long rounded = Math.round(raw);
        return (int) Math.max(Scores.MIN, Math.min(Scores.MAX, rounded));
    }

    private Rewrites rewrites(JsonNode node, Defects defects) {
        if (node == null || node.isNull() || !node.isObject()) {
            defects.add("rewrites", "missing or not an object");
            return null;
        }
        String minimal = rewrite("rewrites.minimal", node.get("minimal"), defects);
        String ideal = rewrite("rewrites.ideal", node.get("ideal"), defects);
        if (minimal == null || ideal == null) {
            return null;
        }
        return defects.construct("rewrites", () -> new Rewrites(minimal, ideal));
    }

    private String rewrite(String field, JsonNode node, Defects defects) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            defects.add(field, "missing or empty");
            return null;
        }
        String truncated = truncateAtWordBoundary(node.asText().strip(), Rewrites.MAX_LENGTH);
        if (truncated == null) {
            defects.add(field, "cannot be shortened to " + Rewrites.MAX_LENGTH
                    + " characters without splitting a word");
        }
        return truncated;
    }

    /**
     * Cuts {@code text} to at most {@code max} code points at the last whitespace that
     * keeps the result within the cap. Returns null when the first word alone is
     * longer than the cap.
     */
    static String truncateAtWordBoundary(String text, int max) {
        if (text.codePointCount(0, text.length()) <= max) {
            return text;
        }
        // End offset (exclusive) of the first max code points; the char at that
        // offset is the first one that no longer fits.
        int limit = text.offsetByCodePoints(0, max);
        for (int i = limit; i > 0; i--) {
            if (Character.isWhitespace(text.charAt(i))) {
                String head = text.substring(0, i).stripTrailing();
                return head.isEmpty() ? null : head;
            }
        }
        return null;
    }

    private List<String> list(String field, JsonNode node, int cap, Defects defects) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        List<String> raw = new ArrayList<>();
        if (node.isTextual()) {
            raw.add(node.asText());
        } else if (node.isArray()) {
            for (JsonNode entry : node) {
                if (entry.isNull()) {
                    continue;
                }
                if (!entry.isValueNode()) {
                    defects.add(field, "entries must be plain text");
                    return List.of();
                }
                raw.add(entry.asText());
            }
        } else {
            defects.add(field, "not a list");
            return List.of();
        }

        var kept = new ArrayList<String>();
        var seen = new HashSet<String>();
        for (String entry : raw) {
            String stripped = entry.strip();
            if (stripped.isEmpty() || !seen.add(stripped.toLowerCase(Locale.ROOT))) {
                continue;
            }
            kept.add(stripped);
            if (kept.size() == cap) {
                break;
            }
        }
        return kept;
    }
}
