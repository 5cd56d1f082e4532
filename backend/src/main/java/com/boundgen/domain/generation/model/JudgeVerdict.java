package com.boundgen.domain.generation.model;

import com.boundgen.domain.validation.model.Severity;

import java.util.List;

/**
 * Output of the semantic QA judge.
 */
public record JudgeVerdict(
        boolean pass,
        List<Violation> violations,
        List<Coverage> coverage
) {
    public JudgeVerdict {
        violations = violations == null ? List.of() : List.copyOf(violations);
        coverage = coverage == null ? List.of() : List.copyOf(coverage);
    }

    public record Violation(
            String code,
            Severity severity,
            String location,
            String explanation,
            String suggestedFix
    ) {}

    /**
     * @param status one of satisfied, missing, contradicted, reopened
     */
    public record Coverage(String bindingId, String status, String evidence) {

        public boolean breaksBinding() {
            return "contradicted".equalsIgnoreCase(status) || "reopened".equalsIgnoreCase(status);
        }
    }
}
