package com.askbetter.core.state;

import com.askbetter.core.error.ReviewException;
import com.askbetter.core.model.CandidateRecord;
import com.askbetter.core.model.Flag;
import com.askbetter.core.model.GenerationSettings;
import com.askbetter.core.model.QuestionReview;
import com.askbetter.core.model.ReviewStatus;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for a single review request.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. {@code feedback}
 * and {@code errors} use appender channels so that each failed attempt adds to what
 * earlier attempts recorded; every other channel is last-write-wins.
 */
public class ReviewState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Request inputs ───────────────────────────────────────────
        Map.entry("reviewId",      Channels.base(() -> "")),
        Map.entry("question",      Channels.base(() -> "")),
        Map.entry("settings",      Channels.base((Reducer<GenerationSettings>) null)),
        Map.entry("deadlineMs",    Channels.base(() -> Long.MAX_VALUE)),

        // ── Pipeline progress ────────────────────────────────────────
        Map.entry("status",        Channels.base(() -> ReviewStatus.INIT.name())),
        Map.entry("attempts",      Channels.base(() -> 0)),
        Map.entry("localFlags",    Channels.base((Supplier<List<Flag>>) List::of)),
        Map.entry("candidate",     Channels.base((Reducer<CandidateRecord>) null)),
        Map.entry("validated",     Channels.base((Reducer<QuestionReview>) null)),
        Map.entry("review",        Channels.base((Reducer<QuestionReview>) null)),
        Map.entry("lastError",     Channels.base((Reducer<ReviewException>) null)),

        // ── Appender channels ────────────────────────────────────────
        Map.entry("feedback",      Channels.appender(ArrayList::new)),
        Map.entry("errors",        Channels.appender(ArrayList::new))
    );

    public ReviewState(Map<String, Object> initData) {
        super(initData);
    }

    public String reviewId() {
        return this.<String>value("reviewId").orElse("");
    }

    public String question() {
        return this.<String>value("question").orElse("");
    }

    public Optional<GenerationSettings> settings() {
        return value("settings");
    }

    public long deadlineMs() {
        return this.<Long>value("deadlineMs").orElse(Long.MAX_VALUE);
    }

    public ReviewStatus status() {
        String raw = this.<String>value("status").orElse(ReviewStatus.INIT.name());
        return ReviewStatus.valueOf(raw);
    }

    public int attempts() {
        return this.<Integer>value("attempts").orElse(0);
    }

    public List<Flag> localFlags() {
        return this.<List<Flag>>value("localFlags").orElse(List.of());
    }

    public Optional<CandidateRecord> candidate() {
        return value("candidate");
    }

    public Optional<QuestionReview> validated() {
        return value("validated");
    }

    public Optional<QuestionReview> review() {
        return value("review");
    }

    public Optional<ReviewException> lastError() {
        return value("lastError");
    }

    /**
     * Corrective notes accumulated from failed attempts, oldest first.
     */
    public List<String> feedback() {
        return this.<List<String>>value("feedback").orElse(List.of());
    }

    public List<String> errors() {
        return this.<List<String>>value("errors").orElse(List.of());
    }
}
