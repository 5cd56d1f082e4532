package com.boundgen.infrastructure.ai;

import com.boundgen.domain.generation.model.FailureKind;

/**
 * The text-generation service failed, timed out or was cancelled.
 */
public class GenerationServiceException extends RuntimeException {

    public enum Kind {
        FAILURE(FailureKind.GENERATION_SERVICE_FAILURE, true),
        TIMEOUT(FailureKind.GENERATION_TIMEOUT, true),
        CANCELLED(FailureKind.GENERATION_CANCELLED, false);

        private final FailureKind failureKind;
        private final boolean retryable;

        Kind(FailureKind failureKind, boolean retryable) {
            this.failureKind = failureKind;
            this.retryable = retryable;
        }

        public FailureKind failureKind() {
            return failureKind;
        }

        public boolean retryable() {
            return retryable;
        }
    }

    private final Kind kind;

    public GenerationServiceException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GenerationServiceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.retryable();
    }
}
