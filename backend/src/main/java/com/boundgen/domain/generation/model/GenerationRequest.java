package com.boundgen.domain.generation.model;

/**
 * Payload handed to the text-generation service.
 *
 * @param systemPrompt role/system context
 * @param userMessage  rendered context sections
 * @param schemaRef    target output schema reference
 */
public record GenerationRequest(String systemPrompt, String userMessage, String schemaRef) {}
