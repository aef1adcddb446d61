package com.askbetter.core.error;

/**
 * The generation step failed outright: transport error, timeout, rate limit, or a
 * response that is not a JSON object at all. A cancelled attempt is never retried.
 */
public class GenerationException extends ReviewException {

    private final boolean cancelled;

    public GenerationException(String message) {
        this(message, null, false);
    }

    public GenerationException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private GenerationException(String message, Throwable cause, boolean cancelled) {
        super(message, cause);
        this.cancelled = cancelled;
    }

    public static GenerationException cancelled(String message) {
        return new GenerationException(message, null, true);
    }

    public boolean cancelled() {
        return cancelled;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.GENERATION;
    }

    @Override
    public boolean retryable() {
        return !cancelled;
    }
}
