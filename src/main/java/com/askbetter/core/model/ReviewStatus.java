package com.askbetter.core.model;

/**
 * Lifecycle of one review request through the pipeline.
 */
public enum ReviewStatus {
    INIT,
    SCAN,
    GENERATE,
    VALIDATE,
    RETRY,
    MERGE,
    DONE,
    FAILED
}
