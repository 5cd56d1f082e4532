package com.boundgen.domain.execution.model;

import com.boundgen.domain.clarification.model.MergedClarifications;
import com.boundgen.domain.document.model.GeneratedDocument;
import com.boundgen.domain.document.model.ReconciliationReport;
import com.boundgen.domain.generation.model.FailureKind;
import com.boundgen.domain.generation.model.GenerationResult;
import com.boundgen.domain.validation.model.Outcome;
import com.boundgen.domain.validation.model.QaFeedbackRecord;
import com.boundgen.domain.validation.model.ValidationResult;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one generation workflow execution.
 * Owned by a single pipeline run. Stores keep {@link #snapshot()} copies, never the live instance.
 */
@Data
public class ExecutionState {

    private final String executionId;
    private final MergedClarifications clarifications;
    private final Instant createdAt;

    private AttemptState state = AttemptState.BUILDING_CONTEXT;
    private int attempt;
    private GeneratedDocument document;
    private ReconciliationReport reconciliation = ReconciliationReport.empty();
    private List<ValidationResult> history = new ArrayList<>();
    private QaFeedbackRecord qaFeedback;
    private FailureKind failureKind;
    private String failureMessage;
    private Instant updatedAt;

    public void recordValidation(ValidationResult result) {
        history.add(result);
    }

    public ValidationResult lastValidation() {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    public void clearQaFeedback() {
        qaFeedback = null;
    }

    /** Point-in-time copy whose history is unmodifiable. */
    public ExecutionState snapshot() {
        ExecutionState copy = new ExecutionState(executionId, clarifications, createdAt);
        copy.state = state;
        copy.attempt = attempt;
        copy.document = document;
        copy.reconciliation = reconciliation;
        copy.history = List.copyOf(history);
        copy.qaFeedback = qaFeedback;
        copy.failureKind = failureKind;
        copy.failureMessage = failureMessage;
        copy.updatedAt = updatedAt;
        return copy;
    }

    public GenerationResult toResult() {
        return new GenerationResult(
                executionId,
                state == AttemptState.SUCCESS ? Outcome.SUCCESS : Outcome.FAILED,
                failureKind,
                failureMessage,
                document,
                lastValidation(),
                attempt,
                history,
                qaFeedback,
                reconciliation);
    }
}
