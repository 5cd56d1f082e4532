package com.boundgen.domain.generation.model;

import lombok.Builder;

import java.util.Map;

/**
 * Caller-supplied parameters for one document generation.
 *
 * @param documentType     free-form document kind, used in logs only
 * @param taskPrompt       task instructions rendered into the Task section
 * @param schemaRef        output schema reference (null selects the configured default)
 * @param systemPrompt     system prompt override (null selects the built-in one)
 * @param userInput        raw user request (nullable)
 * @param extractedContext opaque context passed through as JSON (nullable)
 * @param policyText       policy text for the semantic QA judge (nullable)
 * @param maxAttempts      attempt bound override (null or non-positive selects the configured one)
 */
@Builder(toBuilder = true)
public record TaskParameters(
        String documentType,
        String taskPrompt,
        String schemaRef,
        String systemPrompt,
        String userInput,
        Map<String, Object> extractedContext,
        String policyText,
        Integer maxAttempts
) {
    public TaskParameters {
        extractedContext = extractedContext == null ? Map.of() : extractedContext;
    }
}
