package com.boundgen.domain.clarification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Priority {
    MUST,
    SHOULD,
    COULD;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Priority fromWire(String value) {
        return value == null ? null : Priority.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
