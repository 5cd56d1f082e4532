package com.boundgen.domain.validation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    FATAL,
    ERROR,
    WARNING;

    /** FATAL and ERROR fail the attempt, WARNING is logged only. */
    public boolean isBlocking() {
        return this != WARNING;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return "WARN".equals(normalized) ? WARNING : Severity.valueOf(normalized);
    }
}
