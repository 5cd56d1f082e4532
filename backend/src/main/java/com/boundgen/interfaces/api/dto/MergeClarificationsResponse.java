package com.boundgen.interfaces.api.dto;

import com.boundgen.domain.clarification.model.Invariant;
import com.boundgen.domain.clarification.model.InvariantKind;
import com.boundgen.domain.clarification.model.MergedClarification;
import com.boundgen.domain.clarification.model.MergedClarifications;

import java.util.List;

public record MergeClarificationsResponse(
        List<MergedClarificationView> clarifications,
        List<Invariant> invariants
) {
    public static MergeClarificationsResponse from(MergedClarifications merged) {
        return new MergeClarificationsResponse(
                merged.clarifications().stream().map(MergedClarificationView::from).toList(),
                merged.invariants());
    }

    public record MergedClarificationView(
            String id,
            String answerLabel,
            boolean resolved,
            boolean binding,
            InvariantKind invariantKind,
            String normalizedText,
            String bindingReason
    ) {
        static MergedClarificationView from(MergedClarification merged) {
            return new MergedClarificationView(
                    merged.id(),
                    merged.clarification().answerLabel(),
                    merged.clarification().resolved(),
                    merged.binding(),
                    merged.decision().invariantKind(),
                    merged.decision().normalizedText(),
                    merged.decision().reason());
        }
    }
}
