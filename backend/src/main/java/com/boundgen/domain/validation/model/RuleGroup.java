package com.boundgen.domain.validation.model;

import java.util.Locale;

/**
 * The ordered validation rule groups with their default table entries.
 * Enablement and severity can be overridden per deployment, see {@link RuleGroupSettings}.
 */
public enum RuleGroup {
    CONTRADICTION(1, "contradiction", true, Severity.FATAL, true),
    REOPENED_DECISION(2, "reopened-decision", false, Severity.ERROR, false),
    CONSTRAINT_STATED(3, "constraint-stated", true, Severity.WARNING, false),
    TRACEABILITY(4, "traceability", true, Severity.WARNING, false),
    PROMOTION_VALIDITY(5, "promotion-validity", true, Severity.WARNING, false),
    INTERNAL_CONTRADICTION(6, "internal-contradiction", true, Severity.ERROR, false),
    POLICY_CONFORMANCE(7, "policy-conformance", true, Severity.WARNING, false),
    GROUNDING(8, "grounding", true, Severity.WARNING, false),
    SCHEMA(9, "schema", true, Severity.FATAL, true),
    // severity comes from the judge; the table value applies to consistency findings
    SEMANTIC_QA(10, "semantic-qa", true, Severity.ERROR, false);

    private final int order;
    private final String key;
    private final boolean enabledByDefault;
    private final Severity defaultSeverity;
    private final boolean failFast;

    RuleGroup(int order, String key, boolean enabledByDefault, Severity defaultSeverity, boolean failFast) {
        this.order = order;
        this.key = key;
        this.enabledByDefault = enabledByDefault;
        this.defaultSeverity = defaultSeverity;
        this.failFast = failFast;
    }

    public int order() {
        return order;
    }

    public String key() {
        return key;
    }

    public boolean enabledByDefault() {
        return enabledByDefault;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }

    public boolean failFast() {
        return failFast;
    }

    public RuleGroupSettings defaults() {
        return new RuleGroupSettings(enabledByDefault, defaultSeverity, failFast);
    }

    public static RuleGroup fromKey(String key) {
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (RuleGroup group : values()) {
            if (group.key.equals(normalized)) {
                return group;
            }
        }
        throw new IllegalArgumentException("Unknown rule group: " + key);
    }
}
