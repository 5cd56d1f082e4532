package com.boundgen.interfaces.api.dto;

import com.boundgen.application.generation.ClarificationInput;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.Map;

/**
 * Either clarifications carrying their own answers, or a question set plus an answer map.
 */
public record MergeClarificationsRequest(
        @NotEmpty(message = "At least one clarification is required")
        List<@Valid ClarificationRequest> clarifications,

        Map<String, Object> answers
) {
    public List<ClarificationInput> toInputs() {
        return clarifications.stream().map(ClarificationRequest::toInput).toList();
    }
}
