package com.boundgen.domain.validation.model;

import java.util.List;

/**
 * Result of validating one attempt's document.
 *
 * @param attempt  1-based attempt number
 * @param findings all findings in rule-group order
 * @param haltedAt rule group that stopped the pipeline early (nullable)
 */
public record ValidationResult(
        int attempt,
        List<Finding> findings,
        RuleGroup haltedAt
) {
    public ValidationResult {
        findings = List.copyOf(findings);
    }

    public Outcome outcome() {
        return findings.stream().anyMatch(Finding::isBlocking) ? Outcome.FAILED : Outcome.SUCCESS;
    }

    public boolean passed() {
        return outcome() == Outcome.SUCCESS;
    }

    public boolean halted() {
        return haltedAt != null;
    }

    public List<Finding> blocking() {
        return findings.stream().filter(Finding::isBlocking).toList();
    }

    public List<Finding> warnings() {
        return findings.stream().filter(f -> f.severity() == Severity.WARNING).toList();
    }

    public long count(Severity severity) {
        return findings.stream().filter(f -> f.severity() == severity).count();
    }
}
