package com.boundgen.infrastructure.ai.validation;

import com.boundgen.domain.validation.model.Finding;
import com.boundgen.domain.validation.model.RuleGroup;
import com.boundgen.domain.validation.model.RuleGroupSettings;
import com.boundgen.domain.validation.model.Severity;
import com.boundgen.domain.validation.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs the enabled rule groups in order and accumulates their findings.
 * Stops after a group that asks to halt; findings gathered so far are kept.
 */
@Slf4j
@Component
public class ValidationEngine {

    private final List<RuleGroupCheck> checks;
    private final RuleGroupTable table;

    public ValidationEngine(List<RuleGroupCheck> checks, RuleGroupTable table) {
        this.checks = checks.stream()
                .sorted(Comparator.comparingInt(c -> c.group().order()))
                .toList();
        this.table = table;
    }

    public ValidationResult validate(ValidationInput input) {
        List<Finding> findings = new ArrayList<>();
        RuleGroup haltedAt = null;

        for (RuleGroupCheck check : checks) {
            RuleGroupSettings settings = table.settings(check.group());
            if (!settings.enabled()) {
                log.debug("Rule group {} disabled, skipping", check.group().key());
                continue;
            }

            RuleGroupOutcome outcome = check.evaluate(input, settings);
            findings.addAll(outcome.findings());

            if (outcome.halt()) {
                haltedAt = check.group();
                log.warn("Validation halted at rule group {} ({} fatal findings)",
                        check.group().key(),
                        outcome.findings().stream().filter(f -> f.severity() == Severity.FATAL).count());
                break;
            }
        }

        ValidationResult result = new ValidationResult(input.attempt(), findings, haltedAt);
        logResult(result);
        return result;
    }

    private void logResult(ValidationResult result) {
        log.info("Validation attempt {} {} - fatal: {}, error: {}, warning: {}",
                result.attempt(), result.outcome().wireValue(),
                result.count(Severity.FATAL), result.count(Severity.ERROR), result.count(Severity.WARNING));
        if (!result.passed()) {
            log.warn("Blocking findings: {}",
                    result.blocking().stream().map(f -> f.ruleId() + " " + f.location() + ": " + f.message()).toList());
        } else if (!result.warnings().isEmpty()) {
            log.info("Warnings: {}", result.warnings().stream().map(Finding::message).toList());
        }
    }
}
