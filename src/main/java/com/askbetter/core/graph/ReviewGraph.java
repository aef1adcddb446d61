package com.askbetter.core.graph;

import com.askbetter.core.engine.ReviewProperties;
import com.askbetter.core.error.ReviewException;
import com.askbetter.core.model.ReviewStatus;
import com.askbetter.core.nodes.GenerateCandidateNode;
import com.askbetter.core.nodes.MergeFlagsNode;
import com.askbetter.core.nodes.ScanQuestionNode;
import com.askbetter.core.nodes.ValidateCandidateNode;
import com.askbetter.core.state.ReviewState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives a review.
 * <p>
 * Topology:
 * <pre>
 *   START -> scan_question -> generate_candidate -> [routeAfterGenerate]
 *            -> validate_candidate -> [routeAfterValidate]
 *               -> merge_flags -> END
 *               -> generate_candidate  (retry with corrections)
 *               -> review_failed -> END
 *            -> generate_candidate     (retry after a generation failure)
 *            -> review_failed -> END   (budget spent, cancelled)
 * </pre>
 */
@Component
public class ReviewGraph {

    private static final Logger log = LoggerFactory.getLogger(ReviewGraph.class);

    private final CompiledGraph<ReviewState> compiledGraph;
    private final ReviewProperties properties;

    public ReviewGraph(ScanQuestionNode scanNode,
                       GenerateCandidateNode generateNode,
                       ValidateCandidateNode validateNode,
                       MergeFlagsNode mergeNode,
                       ReviewProperties properties) throws Exception {
        properties.requireValid();
        this.properties = properties;

        var graph = new StateGraph<>(ReviewState.SCHEMA, ReviewState::new)
                .addNode("scan_question", node_async(scanNode::apply))
                .addNode("generate_candidate", node_async(generateNode::apply))
                .addNode("validate_candidate", node_async(validateNode::apply))
                .addNode("merge_flags", node_async(mergeNode::apply))
                .addNode("review_failed", node_async(
                        state -> Map.of("status", ReviewStatus.FAILED.name())))
                .addEdge(START, "scan_question")
                .addEdge("scan_question", "generate_candidate")
                .addConditionalEdges("generate_candidate",
                        edge_async(this::routeAfterGenerate),
                        Map.of("validate_candidate", "validate_candidate",
                                "generate_candidate", "generate_candidate",
                                "review_failed", "review_failed"))
                .addConditionalEdges("validate_candidate",
                        edge_async(this::routeAfterValidate),
                        Map.of("merge_flags", "merge_flags",
                                "generate_candidate", "generate_candidate",
                                "review_failed", "review_failed"))
                .addEdge("merge_flags", END)
                .addEdge("review_failed", END);

        this.compiledGraph = graph.compile();
        log.info("Review graph compiled (retry budget {}, max tool rounds {})",
                properties.getRetryBudget(), properties.getMaxToolRounds());
    }

    String routeAfterGenerate(ReviewState state) {
        if (state.status() == ReviewStatus.VALIDATE) {
            return "validate_candidate";
        }
        return retryOrFail(state);
    }

    String routeAfterValidate(ReviewState state) {
        if (state.status() == ReviewStatus.MERGE) {
            return "merge_flags";
        }
        return retryOrFail(state);
    }

    /**
     * Retries while the last error allows it and fewer than {@code budget + 1}
     * attempts have been made.
     */
    private String retryOrFail(ReviewState state) {
        boolean retryable = state.lastError().map(ReviewException::retryable).orElse(false);
        if (retryable && state.attempts() <= properties.getRetryBudget()) {
            log.info("Retrying generation ({} of {} retries)", state.attempts(), properties.getRetryBudget());
            return "generate_candidate";
        }
        log.warn("Review failed after {} attempt(s)", state.attempts());
        return "review_failed";
    }

    public CompiledGraph<ReviewState> getCompiledGraph() {
        return compiledGraph;
    }
}
