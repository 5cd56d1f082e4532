package com.boundgen.infrastructure.ai.validation;

import com.boundgen.domain.validation.model.Finding;
import com.boundgen.domain.validation.model.RuleGroupSettings;
import com.boundgen.domain.validation.model.Severity;

import java.util.List;

/**
 * Findings of one rule group and whether the engine must stop after it.
 */
public record RuleGroupOutcome(List<Finding> findings, boolean halt) {

    public RuleGroupOutcome {
        findings = List.copyOf(findings);
    }

    public static RuleGroupOutcome none() {
        return new RuleGroupOutcome(List.of(), false);
    }

    /** Halts only when the group is fail-fast and produced an actual fatal finding. */
    public static RuleGroupOutcome of(List<Finding> findings, RuleGroupSettings settings) {
        boolean fatal = findings.stream().anyMatch(f -> f.severity() == Severity.FATAL);
        return new RuleGroupOutcome(findings, settings.failFast() && fatal);
    }
}
