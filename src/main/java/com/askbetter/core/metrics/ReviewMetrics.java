package com.askbetter.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Centralised Micrometer metrics for review requests.
 */
@Service
public class ReviewMetrics {

    private final MeterRegistry registry;

    public ReviewMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordReviewResult(String status) {
        Counter.builder("askbetter.reviews.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordReviewDuration(long ms) {
        Timer.builder("askbetter.review.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "valid", "invalid", "generation_error" or "cancelled"
     */
    public void recordGenerationAttempt(String outcome) {
        Counter.builder("askbetter.generation.attempts")
                .description("Generation attempts by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordToolInvocation(String toolName) {
        Counter.builder("askbetter.tool.invocations")
                .tag("tool", toolName)
                .register(registry)
                .increment();
    }

    /**
     * Counts each field a rejected candidate failed on.
     */
    public void recordValidationDefects(List<String> fields) {
        for (String field : fields) {
            Counter.builder("askbetter.validation.defects")
                    .description("Candidate fields that could not be coerced")
                    .tag("field", field)
                    .register(registry)
                    .increment();
        }
    }
}
