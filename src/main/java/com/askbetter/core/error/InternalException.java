package com.askbetter.core.error;

/**
 * The review graph failed with something other than a {@link ReviewException}:
 * a defect in the pipeline itself. Never retried.
 */
public class InternalException extends ReviewException {

    public InternalException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INTERNAL;
    }
}
