package com.boundgen.domain.clarification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AnswerType {
    FREE_TEXT,
    SINGLE_CHOICE,
    MULTI_CHOICE,
    YES_NO;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AnswerType fromWire(String value) {
        return value == null ? null : AnswerType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
