package com.boundgen.domain.clarification.model;

/**
 * A clarification together with its derived binding decision.
 */
public record MergedClarification(
        Clarification clarification,
        BindingDecision decision
) {
    public String id() {
        return clarification.id();
    }

    public boolean binding() {
        return decision.binding();
    }
}
