package com.askbetter.core.error;

/**
 * Failure categories surfaced to callers.
 */
public enum ErrorKind {
    CONFIGURATION,
    GENERATION,
    VALIDATION,
    TOOL,
    INPUT,
    INTERNAL
}
