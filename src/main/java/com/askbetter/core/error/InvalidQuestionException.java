package com.askbetter.core.error;

/**
 * The question is blank or longer than the configured maximum.
 */
public class InvalidQuestionException extends ReviewException {

    public InvalidQuestionException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INPUT;
    }
}
