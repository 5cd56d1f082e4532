package com.boundgen.domain.generation.model;

import com.boundgen.domain.document.model.GeneratedDocument;
import com.boundgen.domain.document.model.ReconciliationReport;
import com.boundgen.domain.validation.model.Outcome;
import com.boundgen.domain.validation.model.QaFeedbackRecord;
import com.boundgen.domain.validation.model.ValidationResult;

import java.util.List;

/**
 * Terminal result of the generation loop.
 *
 * @param executionId      execution this result belongs to
 * @param outcome          success or failed
 * @param failureKind      why it failed (null on success)
 * @param failureMessage   generation service error message (nullable)
 * @param document         last reconciled document (null if no attempt produced one)
 * @param validationResult last validation result (null if no attempt reached validation)
 * @param attempts         attempts started
 * @param history          validation results of every attempt, in order
 * @param qaFeedback       live feedback record; null after success
 * @param reconciliation   reconciliation counts of the last attempt
 */
public record GenerationResult(
        String executionId,
        Outcome outcome,
        FailureKind failureKind,
        String failureMessage,
        GeneratedDocument document,
        ValidationResult validationResult,
        int attempts,
        List<ValidationResult> history,
        QaFeedbackRecord qaFeedback,
        ReconciliationReport reconciliation
) {
    public GenerationResult {
        history = List.copyOf(history);
    }

    public boolean succeeded() {
        return outcome == Outcome.SUCCESS;
    }
}
