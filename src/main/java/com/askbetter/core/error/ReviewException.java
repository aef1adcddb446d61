package com.askbetter.core.error;

/**
 * Base of every failure the review pipeline raises. Each subclass carries a fixed
 * {@link ErrorKind} so callers can report a structured error without inspecting types.
 */
public abstract class ReviewException extends RuntimeException {

    protected ReviewException(String message) {
        super(message);
    }

    protected ReviewException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();

    /**
     * Whether the orchestrator may retry the generation step after this failure.
     */
    public boolean retryable() {
        return false;
    }
}
