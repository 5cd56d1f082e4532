package com.boundgen.domain.clarification.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum InvariantKind {
    REQUIREMENT,
    EXCLUSION;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
