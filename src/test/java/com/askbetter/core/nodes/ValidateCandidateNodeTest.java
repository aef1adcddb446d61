package com.askbetter.core.nodes;

import com.askbetter.core.error.ValidationException;
import com.askbetter.core.llm.CandidateFixtures;
import com.askbetter.core.metrics.ReviewMetrics;
import com.askbetter.core.model.CandidateRecord;
import com.askbetter.core.model.QuestionReview;
import com.askbetter.core.model.ReviewStatus;
import com.askbetter.core.state.ReviewState;
import com.askbetter.core.validation.SchemaValidator;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValidateCandidateNodeTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ValidateCandidateNode node =
            new ValidateCandidateNode(new SchemaValidator(), new ReviewMetrics(registry));

    private static ReviewState state(ObjectNode candidate) {
        return new ReviewState(Map.of(
                "question", "Fix this SQL?",
                "attempts", 1,
                "candidate", new CandidateRecord(candidate, candidate.toString())));
    }

    @Test
    @DisplayName("valid candidate moves to MERGE")
    void validCandidate() {
        Map<String, Object> result = node.apply(state(CandidateFixtures.validSqlReview()));

        assertEquals(ReviewStatus.MERGE.name(), result.get("status"));
        assertInstanceOf(QuestionReview.class, result.get("validated"));
    }

    @Test
    @DisplayName("missing classification becomes feedback naming the field")
    void missingClassification() {
        ObjectNode candidate = CandidateFixtures.validSqlReview();
        candidate.remove("classification");

        Map<String, Object> result = node.apply(state(candidate));

        assertEquals(ReviewStatus.RETRY.name(), result.get("status"));
        var error = assertInstanceOf(ValidationException.class, result.get("lastError"));
        assertEquals(List.of("classification"), error.fields());
        @SuppressWarnings("unchecked")
        List<String> feedback = (List<String>) result.get("feedback");
        assertTrue(feedback.get(0).startsWith("Attempt 1:"));
        assertTrue(feedback.get(0).contains("classification"));
        assertEquals(1.0, registry.get("askbetter.validation.defects")
                .tag("field", "classification").counter().count());
    }
}
