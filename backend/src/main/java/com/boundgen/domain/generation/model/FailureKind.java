package com.boundgen.domain.generation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why a generation ended in the failed state.
 */
public enum FailureKind {
    VALIDATION_FAILURE,
    GENERATION_SERVICE_FAILURE,
    GENERATION_TIMEOUT,
    GENERATION_CANCELLED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
