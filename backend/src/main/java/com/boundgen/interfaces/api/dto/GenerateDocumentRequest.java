package com.boundgen.interfaces.api.dto;

import com.boundgen.application.generation.ClarificationInput;
import com.boundgen.domain.generation.model.TaskParameters;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

public record GenerateDocumentRequest(
        @NotNull(message = "Clarifications are required")
        List<@Valid ClarificationRequest> clarifications,

        Map<String, Object> answers,

        @Size(max = 100, message = "Document type must not exceed 100 characters")
        String documentType,

        @NotBlank(message = "Task prompt is required")
        @Size(max = 10000, message = "Task prompt must not exceed 10000 characters")
        String taskPrompt,

        String schemaRef,

        @Size(max = 20000, message = "System prompt must not exceed 20000 characters")
        String systemPrompt,

        @Size(max = 20000, message = "User input must not exceed 20000 characters")
        String userInput,

        Map<String, Object> extractedContext,

        @Size(max = 20000, message = "Policy text must not exceed 20000 characters")
        String policyText,

        @Min(value = 1, message = "Max attempts must be at least 1")
        @Max(value = 10, message = "Max attempts must not exceed 10")
        Integer maxAttempts
) {
    public List<ClarificationInput> toInputs() {
        return clarifications.stream().map(ClarificationRequest::toInput).toList();
    }

    public TaskParameters toTask() {
        return TaskParameters.builder()
                .documentType(documentType)
                .taskPrompt(taskPrompt)
                .schemaRef(schemaRef)
                .systemPrompt(systemPrompt)
                .userInput(userInput)
                .extractedContext(extractedContext)
                .policyText(policyText)
                .maxAttempts(maxAttempts)
                .build();
    }
}
