package com.askbetter.core.graph;

import com.askbetter.core.engine.ReviewProperties;
import com.askbetter.core.error.ConfigurationException;
import com.askbetter.core.error.GenerationException;
import com.askbetter.core.error.ToolException;
import com.askbetter.core.error.ValidationException;
import com.askbetter.core.model.ReviewStatus;
import com.askbetter.core.nodes.GenerateCandidateNode;
import com.askbetter.core.nodes.MergeFlagsNode;
import com.askbetter.core.nodes.ScanQuestionNode;
import com.askbetter.core.nodes.ValidateCandidateNode;
import com.askbetter.core.state.ReviewState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Routing tests for the review {@link org.bsc.langgraph4j.StateGraph}.
 */
class ReviewGraphTest {

    private ReviewGraph graph;

    @BeforeEach
    void setUp() throws Exception {
        graph = new ReviewGraph(
                mock(ScanQuestionNode.class),
                mock(GenerateCandidateNode.class),
                mock(ValidateCandidateNode.class),
                mock(MergeFlagsNode.class),
                new ReviewProperties());
    }

    private static ReviewState state(ReviewStatus status, int attempts, Object lastError) {
        return lastError == null
                ? new ReviewState(Map.of("status", status.name(), "attempts", attempts))
                : new ReviewState(Map.of("status", status.name(), "attempts", attempts, "lastError", lastError));
    }

    @Test
    @DisplayName("graph compiles")
    void graphCompiles() {
        assertNotNull(graph.getCompiledGraph());
    }

    @Test
    @DisplayName("an out-of-range retry budget fails at construction")
    void invalidBudget() {
        var properties = new ReviewProperties();
        properties.setRetryBudget(ReviewProperties.MAX_RETRY_BUDGET + 1);

        assertThrows(ConfigurationException.class, () -> new ReviewGraph(
                mock(ScanQuestionNode.class), mock(GenerateCandidateNode.class),
                mock(ValidateCandidateNode.class), mock(MergeFlagsNode.class), properties));
    }

    @Nested
    @DisplayName("routeAfterGenerate")
    class AfterGenerate {

        @Test
        @DisplayName("a candidate goes to validation")
        void candidateToValidate() {
            assertEquals("validate_candidate", graph.routeAfterGenerate(state(ReviewStatus.VALIDATE, 1, null)));
        }

        @Test
        @DisplayName("a retryable failure within budget goes back to generation")
        void retryWithinBudget() {
            var error = new GenerationException("timeout");
            assertEquals("generate_candidate", graph.routeAfterGenerate(state(ReviewStatus.RETRY, 1, error)));
            assertEquals("generate_candidate", graph.routeAfterGenerate(state(ReviewStatus.RETRY, 2, error)));
        }

        @Test
        @DisplayName("the budget+1-th failure ends the run")
        void budgetSpent() {
            var error = new GenerationException("timeout");
            assertEquals("review_failed", graph.routeAfterGenerate(state(ReviewStatus.RETRY, 3, error)));
        }

        @Test
        @DisplayName("a cancelled attempt is never retried")
        void cancelledNotRetried() {
            var error = GenerationException.cancelled("deadline");
            assertEquals("review_failed", graph.routeAfterGenerate(state(ReviewStatus.RETRY, 1, error)));
        }

        @Test
        @DisplayName("a non-retryable error is never retried")
        void toolErrorNotRetried() {
            var error = new ToolException("scanner", new IllegalStateException());
            assertEquals("review_failed", graph.routeAfterGenerate(state(ReviewStatus.RETRY, 1, error)));
        }
    }

    @Nested
    @DisplayName("routeAfterValidate")
    class AfterValidate {

        @Test
        @DisplayName("a valid candidate goes to merge")
        void validToMerge() {
            assertEquals("merge_flags", graph.routeAfterValidate(state(ReviewStatus.MERGE, 1, null)));
        }

        @Test
        @DisplayName("an invalid candidate is retried within budget")
        void invalidRetried() {
            var error = new ValidationException(List.of("classification"), List.of("classification: missing"));
            assertEquals("generate_candidate", graph.routeAfterValidate(state(ReviewStatus.RETRY, 1, error)));
            assertEquals("review_failed", graph.routeAfterValidate(state(ReviewStatus.RETRY, 3, error)));
        }
    }
}
