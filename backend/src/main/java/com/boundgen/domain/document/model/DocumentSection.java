package com.boundgen.domain.document.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Named list sections of a generated document, with the JSON keys they are read from.
 * The first key is the one written back.
 */
public enum DocumentSection {
    KNOWN_CONSTRAINTS("known_constraints"),
    ASSUMPTIONS("assumptions"),
    RECOMMENDATIONS("recommendations"),
    UNKNOWNS("unknowns", "open_questions", "stakeholder_questions"),
    EARLY_DECISION_POINTS("early_decision_points"),
    GUARDRAILS("guardrails", "mvp_guardrails");

    private final List<String> keys;

    DocumentSection(String... keys) {
        this.keys = List.of(keys);
    }

    public String key() {
        return keys.get(0);
    }

    public List<String> keys() {
        return keys;
    }

    /** JSON pointer to one entry, e.g. {@code /known_constraints/0}. */
    public String pointer(int index) {
        return "/" + key() + "/" + index;
    }

    public static Optional<DocumentSection> fromKey(String key) {
        return Arrays.stream(values()).filter(s -> s.keys.contains(key)).findFirst();
    }
}
