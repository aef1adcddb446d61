package com.askbetter.core.engine;

import com.askbetter.core.error.ConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "askbetter.review")
public class ReviewProperties {

    /** Upper bound on retries; keeps a failing run inside the graph's step limit. */
    public static final int MAX_RETRY_BUDGET = 10;

    private int retryBudget = 2;
    private int maxToolRounds = 4;
    private int maxQuestionLength = 4000;
    private Duration requestTimeout = Duration.ofSeconds(120);

    public int getRetryBudget() {
        return retryBudget;
    }

    public void setRetryBudget(int retryBudget) {
        this.retryBudget = retryBudget;
    }

    public int getMaxToolRounds() {
        return maxToolRounds;
    }

    public void setMaxToolRounds(int maxToolRounds) {
        this.maxToolRounds = maxToolRounds;
    }

    public int getMaxQuestionLength() {
        return maxQuestionLength;
    }

    public void setMaxQuestionLength(int maxQuestionLength) {
        this.maxQuestionLength = maxQuestionLength;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    /**
     * @throws ConfigurationException if any bound is out of range
     */
    public void requireValid() {
        if (retryBudget < 0 || retryBudget > MAX_RETRY_BUDGET) {
            throw new ConfigurationException("askbetter.review.retry-budget must be within [0, "
                    + MAX_RETRY_BUDGET + "]: " + retryBudget);
        }
        if (maxToolRounds < 0) {
            throw new ConfigurationException("askbetter.review.max-tool-rounds must not be negative");
        }
        if (maxQuestionLength <= 0) {
            throw new ConfigurationException("askbetter.review.max-question-length must be positive");
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new ConfigurationException("askbetter.review.request-timeout must be positive");
        }
    }
}
