package com.boundgen.domain.validation.model;

import java.util.List;

/**
 * Blocking findings of a failed attempt, rendered into the next attempt's context.
 *
 * @param sourceAttempt attempt the findings came from
 * @param findings      FATAL and ERROR findings only
 */
public record QaFeedbackRecord(int sourceAttempt, List<Finding> findings) {

    public QaFeedbackRecord {
        findings = List.copyOf(findings);
    }

    public static QaFeedbackRecord from(ValidationResult result) {
        return new QaFeedbackRecord(result.attempt(), result.blocking());
    }

    public boolean isEmpty() {
        return findings.isEmpty();
    }
}
