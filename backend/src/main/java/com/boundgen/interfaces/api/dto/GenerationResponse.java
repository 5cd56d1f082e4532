package com.boundgen.interfaces.api.dto;

import com.boundgen.domain.document.model.DocumentItem;
import com.boundgen.domain.document.model.DocumentSection;
import com.boundgen.domain.document.model.GeneratedDocument;
import com.boundgen.domain.document.model.ReconciliationReport;
import com.boundgen.domain.execution.model.AttemptState;
import com.boundgen.domain.execution.model.ExecutionState;
import com.boundgen.domain.generation.model.FailureKind;
import com.boundgen.domain.generation.model.GenerationResult;
import com.boundgen.domain.validation.model.Outcome;
import com.boundgen.domain.validation.model.QaFeedbackRecord;
import com.boundgen.domain.validation.model.ValidationResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record GenerationResponse(
        String executionId,
        AttemptState state,
        Outcome outcome,
        FailureKind failureKind,
        String failureMessage,
        int attempts,
        Map<String, List<DocumentItem>> document,
        ValidationResult validation,
        List<ValidationResult> history,
        QaFeedbackRecord qaFeedback,
        ReconciliationReport reconciliation
) {
    public static GenerationResponse from(ExecutionState state) {
        GenerationResult result = state.toResult();
        // an in-flight execution has no outcome yet
        Outcome outcome = state.getState().isTerminal() ? result.outcome() : null;
        return new GenerationResponse(
                result.executionId(),
                state.getState(),
                outcome,
                result.failureKind(),
                result.failureMessage(),
                result.attempts(),
                sections(result.document()),
                result.validationResult(),
                result.history(),
                result.qaFeedback(),
                result.reconciliation());
    }

    private static Map<String, List<DocumentItem>> sections(GeneratedDocument document) {
        if (document == null) {
            return null;
        }
        Map<String, List<DocumentItem>> sections = new LinkedHashMap<>();
        for (DocumentSection section : DocumentSection.values()) {
            sections.put(section.key(), document.section(section));
        }
        return sections;
    }
}
