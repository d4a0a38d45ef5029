package com.largomodo.romaudit.core.domain;

/**
 * A problem attached to a machine's report instead of aborting the run.
 */
public record Issue(IssueKind kind, String message) {
    public Issue {
        if (kind == null || message == null) {
            throw new IllegalArgumentException("kind and message must not be null");
        }
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
