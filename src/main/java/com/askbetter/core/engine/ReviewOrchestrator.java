package com.askbetter.core.engine;

import com.askbetter.core.error.GenerationException;
import com.askbetter.core.error.InternalException;
import com.askbetter.core.error.InvalidQuestionException;
import com.askbetter.core.error.ReviewException;
import com.askbetter.core.graph.ReviewGraph;
import com.askbetter.core.llm.LlmProperties;
import com.askbetter.core.logging.MdcContext;
import com.askbetter.core.metrics.ReviewMetrics;
import com.askbetter.core.model.GenerationSettings;
import com.askbetter.core.model.QuestionReview;
import com.askbetter.core.model.ReviewStatus;
import com.askbetter.core.state.ReviewState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs review requests by bridging callers to the LangGraph4j review graph.
 * <p>
 * Checks the question, creates the initial state with a fresh review ID and request
 * deadline, invokes the compiled graph and turns its final state into either a
 * {@link QuestionReview} or the {@link ReviewException} that ended the run.
 */
@Service
public class ReviewOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ReviewOrchestrator.class);
    private static final AtomicInteger REVIEW_COUNTER = new AtomicInteger(0);

    private final ReviewGraph reviewGraph;
    private final LlmProperties llmProperties;
    private final ReviewProperties reviewProperties;
    private final ReviewMetrics metrics;
    private final Clock clock;

    @Autowired
    public ReviewOrchestrator(ReviewGraph reviewGraph, LlmProperties llmProperties,
                              ReviewProperties reviewProperties, ReviewMetrics metrics) {
        this(reviewGraph, llmProperties, reviewProperties, metrics, Clock.systemUTC());
    }

    ReviewOrchestrator(ReviewGraph reviewGraph, LlmProperties llmProperties,
                       ReviewProperties reviewProperties, ReviewMetrics metrics, Clock clock) {
        this.reviewGraph = reviewGraph;
        this.llmProperties = llmProperties;
        this.reviewProperties = reviewProperties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Reviews a question with the configured default settings.
     */
    public QuestionReview review(String question) {
        return review(question, llmProperties.defaultSettings());
    }

    /**
     * Reviews a question.
     *
     * @return the finalized review; never a partial one
     * @throws ReviewException the error that ended the run: the last generation or
     *                         validation failure once the retry budget is spent, a
     *                         cancellation, a scanner failure, or invalid input
     */
    public QuestionReview review(String question, GenerationSettings settings) {
        ReviewState state = run(question, settings);
        if (state.status() == ReviewStatus.DONE) {
            return state.review().orElseThrow(() ->
                    new IllegalStateException("Review " + state.reviewId() + " finished without a result"));
        }
        throw state.lastError().orElseGet(() -> new GenerationException(
                "Review " + state.reviewId() + " ended " + state.status() + " without a result"));
    }

    /**
     * Runs the review graph and returns its final state, including the status,
     * attempt count and accumulated errors.
     *
     * @throws InvalidQuestionException if the question is blank or too long
     * @throws ReviewException          if a node aborted the run, e.g. a scanner failure
     */
    public ReviewState run(String question, GenerationSettings settings) {
        requireValidQuestion(question);
        String reviewId = generateReviewId();
        MdcContext.setReview(reviewId);
        long start = clock.millis();
        try {
            log.info("Starting review {} (model {}, temperature {}, seed {}): {} chars",
                    reviewId, settings.model(), settings.temperature(), settings.seed(), question.length());

            var stateMap = new HashMap<String, Object>();
            stateMap.put("reviewId", reviewId);
            stateMap.put("question", question);
            stateMap.put("settings", settings);
            stateMap.put("deadlineMs", start + reviewProperties.getRequestTimeout().toMillis());
            stateMap.put("status", ReviewStatus.SCAN.name());

            ReviewState state = invoke(reviewId, Map.copyOf(stateMap));
            metrics.recordReviewResult(state.status().name());
            log.info("Review {} finished {} after {} attempt(s)", reviewId, state.status(), state.attempts());
            return state;
        } catch (ReviewException e) {
            metrics.recordReviewResult(ReviewStatus.FAILED.name());
            throw e;
        } finally {
            metrics.recordReviewDuration(clock.millis() - start);
            MdcContext.clear();
        }
    }

    /**
     * Generates a unique review ID in the format ASKB-YYYY-NNNN.
     */
    public String generateReviewId() {
        int count = REVIEW_COUNTER.incrementAndGet();
        int year = Instant.now(clock).atZone(ZoneOffset.UTC).getYear();
        return String.format("ASKB-%d-%04d", year, count);
    }

    private ReviewState invoke(String reviewId, Map<String, Object> initialState) {
        Optional<ReviewState> result;
        try {
            result = reviewGraph.getCompiledGraph().invoke(initialState);
        } catch (Exception e) {
            ReviewException cause = findReviewException(e);
            if (cause != null) {
                log.error("Review {} aborted: {}", reviewId, cause.getMessage());
                throw cause;
            }
            log.error("Review {} failed unexpectedly", reviewId, e);
            throw new InternalException("Review graph failed: " + e.getMessage(), e);
        }
        return result.orElseThrow(() ->
                new InternalException("Graph execution returned empty state for review " + reviewId, null));
    }

    private void requireValidQuestion(String question) {
        if (question == null || question.isBlank()) {
            throw new InvalidQuestionException("No question provided.");
        }
        int max = reviewProperties.getMaxQuestionLength();
        if (question.length() > max) {
            throw new InvalidQuestionException("Question is " + question.length()
                    + " characters long; the maximum is " + max);
        }
    }

    private static ReviewException findReviewException(Throwable t) {
        Throwable cause = t;
        while (cause != null) {
            if (cause instanceof ReviewException reviewException) {
                return reviewException;
            }
            if (cause.getCause() == cause) {
                break;
            }
            cause = cause.getCause();
        }
        return null;
    }
}
