package com.boundgen.domain.validation.model;

/**
 * One row of the rule-group table.
 */
public record RuleGroupSettings(boolean enabled, Severity severity, boolean failFast) {

    public RuleGroupSettings withEnabled(boolean value) {
        return new RuleGroupSettings(value, severity, failFast);
    }

    public RuleGroupSettings withSeverity(Severity value) {
        return new RuleGroupSettings(enabled, value, failFast);
    }
}
