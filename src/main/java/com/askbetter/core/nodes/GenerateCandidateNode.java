package com.askbetter.core.nodes;

import com.askbetter.core.engine.ReviewProperties;
import com.askbetter.core.error.GenerationException;
import com.askbetter.core.llm.GenerationExchange;
import com.askbetter.core.llm.GenerationGateway;
import com.askbetter.core.llm.GenerationTurn;
import com.askbetter.core.llm.GenerationTurn.FinalCandidate;
import com.askbetter.core.llm.GenerationTurn.ToolInvocation;
import com.askbetter.core.logging.MdcContext;
import com.askbetter.core.metrics.ReviewMetrics;
import com.askbetter.core.model.CandidateRecord;
import com.askbetter.core.model.GenerationSettings;
import com.askbetter.core.model.ReviewStatus;
import com.askbetter.core.state.ReviewState;
import com.askbetter.core.tools.ToolDispatcher;
import com.askbetter.core.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Runs one generation attempt: opens an exchange with the rubric (plus corrections
 * gathered from earlier attempts), answers any tool invocations through the
 * {@link ToolDispatcher}, and stores the resulting candidate.
 * <p>
 * A {@link GenerationException} ends the attempt with status {@code RETRY}; the
 * graph router decides whether another attempt is allowed. A
 * {@link com.askbetter.core.error.ToolException} is not caught and aborts the run.
 */
@Component
public class GenerateCandidateNode {

    private static final Logger log = LoggerFactory.getLogger(GenerateCandidateNode.class);

    static final String SYSTEM_PROMPT = """
            You are AskBetter, a reviewer of questions. You do not answer the question.
            Evaluate the user's question and return a single QuestionReview JSON object.
            1. Fill "classification" with a short lowercase "domain" (e.g. "software", "finance")
               and "type" (e.g. "debugging", "how-to", "explanation", "opinion").
            2. Fill "scores" with integers from 0 to 10 for "clarity", "specificity",
               "answerability" and "safety" (10 = perfectly safe to answer).
            3. Fill "missing_info" with the essentials needed to answer, most important first (max 6).
            4. Fill "assumptions" with reasonable defaults you would make (max 6).
            5. Fill "followups" with short, targeted questions to ask the user (max 5).
            6. Fill "rewrites" with a "minimal" rewrite that fixes only the worst gap and an
               "ideal" rewrite that is fully specified (max 280 characters each).
            7. Call pii_scan(text=original_question) and copy the result into "flags".
               You may add "vague" when the question lacks the detail to answer it, and
               "unsafe" when answering could cause harm. Use no other flag values.
            Copy the question verbatim into "original_question".
            Respond with JSON only, matching the schema provided.
            """;

    private final GenerationGateway gateway;
    private final ToolDispatcher toolDispatcher;
    private final ReviewProperties properties;
    private final ReviewMetrics metrics;
    private final Clock clock;

    @Autowired
    public GenerateCandidateNode(GenerationGateway gateway, ToolDispatcher toolDispatcher,
                                 ReviewProperties properties, ReviewMetrics metrics) {
        this(gateway, toolDispatcher, properties, metrics, Clock.systemUTC());
    }

    GenerateCandidateNode(GenerationGateway gateway, ToolDispatcher toolDispatcher,
                          ReviewProperties properties, ReviewMetrics metrics, Clock clock) {
        this.gateway = gateway;
        this.toolDispatcher = toolDispatcher;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Map<String, Object> apply(ReviewState state) {
        int attempt = state.attempts() + 1;
        MdcContext.setAttempt(state.reviewId(), attempt);
        GenerationSettings settings = state.settings()
                .orElseThrow(() -> new IllegalStateException("No generation settings in review state"));

        log.info("Generation attempt {} (model {}, {} correction(s))",
                attempt, settings.model(), state.feedback().size());
        try {
            CandidateRecord candidate = generate(state, settings);
            return Map.of(
                    "candidate", candidate,
                    "attempts", attempt,
                    "status", ReviewStatus.VALIDATE.name()
            );
        } catch (GenerationException e) {
            metrics.recordGenerationAttempt(e.cancelled() ? "cancelled" : "generation_error");
            log.warn("Generation attempt {} failed{}: {}", attempt, e.cancelled() ? " (cancelled)" : "", e.getMessage());
            return Map.of(
                    "attempts", attempt,
                    "status", ReviewStatus.RETRY.name(),
                    "lastError", e,
                    "feedback", List.of("Attempt " + attempt + ": your previous response could not be used ("
                            + e.getMessage() + "). Return exactly one JSON object matching the schema."),
                    "errors", List.of("Attempt " + attempt + ": " + e.getMessage())
            );
        }
    }

    /**
     * Builds the instructions for an attempt: the rubric, followed by every correction
     * recorded by earlier attempts, oldest first.
     */
    static String instructions(List<String> feedback) {
        if (feedback.isEmpty()) {
            return SYSTEM_PROMPT;
        }
        var sb = new StringBuilder(SYSTEM_PROMPT);
        sb.append("\n## Corrections from previous attempts\n");
        for (String note : feedback) {
            sb.append("- ").append(note).append('\n');
        }
        return sb.toString();
    }

    private CandidateRecord generate(ReviewState state, GenerationSettings settings) {
        checkDeadline(state);
        GenerationExchange exchange = gateway.open(state.question(), instructions(state.feedback()), settings);
        GenerationTurn turn = exchange.next();

        int rounds = 0;
        while (turn instanceof ToolInvocation invocation) {
            checkDeadline(state);
            if (++rounds > properties.getMaxToolRounds()) {
                throw new GenerationException("Generation exceeded " + properties.getMaxToolRounds()
                        + " tool round(s) without producing a candidate");
            }
            ToolResult result = toolDispatcher.dispatch(invocation);
            metrics.recordToolInvocation(invocation.toolName());
            turn = exchange.submitToolResult(result);
        }
        checkDeadline(state);
        return ((FinalCandidate) turn).candidate();
    }

    private void checkDeadline(ReviewState state) {
        if (clock.millis() > state.deadlineMs()) {
            throw GenerationException.cancelled("Review " + state.reviewId() + " exceeded its request deadline");
        }
    }
}
