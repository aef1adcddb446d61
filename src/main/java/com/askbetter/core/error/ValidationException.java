package com.askbetter.core.error;

import java.util.List;

/**
 * A parseable candidate could not be coerced into the output contract.
 * {@link #fields()} names every offending field, e.g. {@code classification} or
 * {@code scores.clarity}.
 */
public class ValidationException extends ReviewException {

    private final List<String> fields;

    public ValidationException(List<String> fields, List<String> problems) {
        super("Candidate failed validation: " + String.join("; ", problems));
        this.fields = List.copyOf(fields);
    }

    public List<String> fields() {
        return fields;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
