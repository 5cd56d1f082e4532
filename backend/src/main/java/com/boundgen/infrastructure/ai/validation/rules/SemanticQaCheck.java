package com.boundgen.infrastructure.ai.validation.rules;

import com.boundgen.domain.clarification.model.Invariant;
import com.boundgen.domain.generation.model.JudgeVerdict;
import com.boundgen.domain.generation.service.SemanticQaJudge;
import com.boundgen.domain.validation.model.Finding;
import com.boundgen.domain.validation.model.RuleGroup;
import com.boundgen.domain.validation.model.RuleGroupSettings;
import com.boundgen.domain.validation.model.Severity;
import com.boundgen.infrastructure.ai.JudgeUnavailableException;
import com.boundgen.infrastructure.ai.validation.RuleGroupCheck;
import com.boundgen.infrastructure.ai.validation.RuleGroupOutcome;
import com.boundgen.infrastructure.ai.validation.ValidationInput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rule group 10. Delegates to the semantic QA judge when one is configured.
 * <p>
 * Violations keep the judge's severity. The verdict is checked for consistency so a failure
 * is never left without a finding. When the judge is unreachable, the {@code on-unavailable}
 * policy decides between a warning (skip) and a fatal finding (fail).
 * </p>
 */
@Slf4j
@Component
public class SemanticQaCheck implements RuleGroupCheck {

    static final String VIOLATION_PREFIX = "SEMANTIC-QA-";
    static final String UNAVAILABLE_RULE = "SEMANTIC-QA-UNAVAILABLE";
    static final String NO_POLICY_RULE = "SEMANTIC-QA-NO-POLICY";
    static final String UNEXPLAINED_RULE = "SEMANTIC-QA-UNEXPLAINED";
    static final String COVERAGE_RULE = "SEMANTIC-QA-COVERAGE";
    static final String UNKNOWN_BINDING_RULE = "SEMANTIC-QA-UNKNOWN-BINDING";

    public enum OnUnavailable {
        SKIP,
        FAIL
    }

    private final Optional<SemanticQaJudge> judge;
    private final OnUnavailable onUnavailable;

    @Autowired
    public SemanticQaCheck(Optional<SemanticQaJudge> judge,
                           @Value("${semantic-qa.on-unavailable:skip}") String onUnavailable) {
        this(judge, OnUnavailable.valueOf(onUnavailable.trim().toUpperCase(Locale.ROOT)));
    }

    public SemanticQaCheck(Optional<SemanticQaJudge> judge, OnUnavailable onUnavailable) {
        this.judge = judge;
        this.onUnavailable = onUnavailable;
    }

    @Override
    public RuleGroup group() {
        return RuleGroup.SEMANTIC_QA;
    }

    @Override
    public RuleGroupOutcome evaluate(ValidationInput input, RuleGroupSettings settings) {
        if (judge.isEmpty()) {
            return RuleGroupOutcome.none();
        }
        String policyText = input.task().policyText();
        if (policyText == null || policyText.isBlank()) {
            return RuleGroupOutcome.of(List.of(Finding.of(NO_POLICY_RULE, Severity.WARNING, "",
                    "Semantic QA skipped, no policy text supplied")), settings);
        }

        JudgeVerdict verdict;
        try {
            verdict = judge.get().judge(input.clarifications(), input.document(), policyText);
        } catch (JudgeUnavailableException e) {
            log.warn("Semantic QA judge unavailable, policy {}: {}", onUnavailable, e.getMessage());
            Severity severity = onUnavailable == OnUnavailable.FAIL ? Severity.FATAL : Severity.WARNING;
            return RuleGroupOutcome.of(List.of(Finding.of(UNAVAILABLE_RULE, severity, "",
                    "Semantic QA judge unavailable: " + e.getMessage())), settings);
        }

        return RuleGroupOutcome.of(toFindings(verdict, input.invariants(), settings), settings);
    }

    private List<Finding> toFindings(JudgeVerdict verdict, List<Invariant> invariants, RuleGroupSettings settings) {
        List<Finding> findings = new ArrayList<>();
        for (JudgeVerdict.Violation violation : verdict.violations()) {
            Severity severity = violation.severity() == null ? settings.severity() : violation.severity();
            findings.add(new Finding(VIOLATION_PREFIX + violation.code(), severity,
                    violation.location(), violation.explanation(), violation.suggestedFix()));
        }

        Set<String> invariantIds = invariants.stream().map(Invariant::id).collect(Collectors.toSet());
        for (JudgeVerdict.Coverage coverage : verdict.coverage()) {
            if (!invariantIds.contains(coverage.bindingId())) {
                findings.add(Finding.of(UNKNOWN_BINDING_RULE, Severity.WARNING, "",
                        "Judge reported coverage for unknown constraint " + coverage.bindingId()));
            } else if (verdict.pass() && coverage.breaksBinding()) {
                findings.add(new Finding(COVERAGE_RULE, settings.severity(), "",
                        "Judge passed the document but reports " + coverage.bindingId() + " as "
                                + coverage.status().toLowerCase(Locale.ROOT) + ": " + coverage.evidence(),
                        "Restore the bound decision " + coverage.bindingId() + "."));
            }
        }

        boolean explained = findings.stream().anyMatch(Finding::isBlocking);
        if (!verdict.pass() && !explained) {
            findings.add(Finding.of(UNEXPLAINED_RULE, settings.severity(), "",
                    "Judge failed the document without a blocking violation"));
        }
        return findings;
    }
}
