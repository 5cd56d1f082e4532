package com.boundgen.domain.clarification.model;

/**
 * Output of the constraint deriver for a single clarification.
 *
 * @param binding        true if the decision must not be reopened by generation
 * @param invariantKind  requirement or exclusion (null when not binding)
 * @param normalizedText canonical sentence form of the decision
 * @param reason         why the binding rule matched, for audit
 */
public record BindingDecision(
        boolean binding,
        InvariantKind invariantKind,
        String normalizedText,
        String reason
) {
    public static BindingDecision notBinding(String normalizedText, String reason) {
        return new BindingDecision(false, null, normalizedText, reason);
    }

    public static BindingDecision binding(InvariantKind kind, String normalizedText, String reason) {
        return new BindingDecision(true, kind, normalizedText, reason);
    }
}
