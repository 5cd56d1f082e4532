package com.boundgen.domain.clarification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a clarification constrains generation, as declared by the question set.
 * SELECTION is the question-set default for single-choice questions that carry no explicit kind.
 */
public enum ConstraintKind {
    REQUIREMENT,
    EXCLUSION,
    PREFERENCE,
    SELECTION,
    NONE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConstraintKind fromWire(String value) {
        return value == null ? null : ConstraintKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
