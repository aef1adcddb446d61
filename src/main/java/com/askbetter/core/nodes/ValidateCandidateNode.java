package com.askbetter.core.nodes;

import com.askbetter.core.error.ValidationException;
import com.askbetter.core.metrics.ReviewMetrics;
import com.askbetter.core.model.CandidateRecord;
import com.askbetter.core.model.QuestionReview;
import com.askbetter.core.model.ReviewStatus;
import com.askbetter.core.state.ReviewState;
import com.askbetter.core.validation.SchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Checks the latest candidate against the output contract.
 * <p>
 * A rejected candidate does not fail the run here: the node records the offending
 * fields as corrective feedback and marks the state {@code RETRY}, leaving the
 * retry-or-fail decision to the graph's router.
 */
@Component
public class ValidateCandidateNode {

    private static final Logger log = LoggerFactory.getLogger(ValidateCandidateNode.class);

    private final SchemaValidator validator;
    private final ReviewMetrics metrics;

    public ValidateCandidateNode(SchemaValidator validator, ReviewMetrics metrics) {
        this.validator = validator;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(ReviewState state) {
        CandidateRecord candidate = state.candidate()
                .orElseThrow(() -> new IllegalStateException("No candidate to validate"));
        int attempt = state.attempts();

        try {
            QuestionReview validated = validator.validate(candidate, state.question());
            metrics.recordGenerationAttempt("valid");
            log.info("Attempt {} produced a valid candidate", attempt);
            return Map.of(
                    "validated", validated,
                    "status", ReviewStatus.MERGE.name()
            );
        } catch (ValidationException e) {
            metrics.recordGenerationAttempt("invalid");
            metrics.recordValidationDefects(e.fields());
            log.warn("Attempt {} rejected: {}", attempt, e.getMessage());
            String correction = String.format(
                    "Attempt %d: your response was rejected because these fields were missing or invalid: %s (%s). "
                            + "Return every field of the schema with valid values.",
                    attempt, String.join(", ", e.fields()), e.getMessage());
            return Map.of(
                    "status", ReviewStatus.RETRY.name(),
                    "lastError", e,
                    "feedback", List.of(correction),
                    "errors", List.of("Attempt " + attempt + ": " + e.getMessage())
            );
        }
    }
}
