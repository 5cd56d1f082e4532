package com.boundgen.domain.validation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Outcome {
    SUCCESS,
    FAILED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
