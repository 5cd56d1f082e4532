package com.boundgen.domain.execution.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AttemptState {
    BUILDING_CONTEXT,
    GENERATING,
    RECONCILING,
    VALIDATING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
