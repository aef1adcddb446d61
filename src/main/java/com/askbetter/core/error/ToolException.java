package com.askbetter.core.error;

/**
 * The deterministic scanner failed. This indicates a defect in the scanner rather
 * than a transient condition, so it is never retried.
 */
public class ToolException extends ReviewException {

    public ToolException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TOOL;
    }
}
