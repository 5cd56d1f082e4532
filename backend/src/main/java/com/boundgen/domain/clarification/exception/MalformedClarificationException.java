package com.boundgen.domain.clarification.exception;

/**
 * A clarification or invariant is missing a required field. Never retried.
 */
public class MalformedClarificationException extends RuntimeException {

    private final String clarificationId;

    public MalformedClarificationException(String clarificationId, String message) {
        super(message);
        this.clarificationId = clarificationId;
    }

    public String getClarificationId() {
        return clarificationId;
    }
}
