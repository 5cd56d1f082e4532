package com.boundgen.interfaces.api.dto;

import com.boundgen.application.generation.ClarificationInput;
import com.boundgen.domain.clarification.model.AnswerType;
import com.boundgen.domain.clarification.model.Choice;
import com.boundgen.domain.clarification.model.Clarification;
import com.boundgen.domain.clarification.model.ConstraintKind;
import com.boundgen.domain.clarification.model.Priority;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record ClarificationRequest(
        @NotBlank(message = "Clarification id is required")
        String id,

        @Size(max = 1000, message = "Question text must not exceed 1000 characters")
        String questionText,

        @NotNull(message = "Priority is required")
        Priority priority,

        ConstraintKind constraintKind,

        AnswerType answerType,

        List<Choice> choices,

        Object answer,

        String answerLabel,

        Boolean resolved,

        List<String> canonicalTags
) {
    public ClarificationInput toInput() {
        Clarification clarification = Clarification.builder()
                .id(id)
                .questionText(questionText)
                .priority(priority)
                .constraintKind(constraintKind)
                .answerType(answerType)
                .choices(choices)
                .answer(answer)
                .answerLabel(answerLabel)
                .canonicalTags(canonicalTags)
                .build();
        return new ClarificationInput(clarification, resolved);
    }
}
