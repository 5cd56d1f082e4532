package com.boundgen.domain.generation.service;

import com.boundgen.domain.document.model.GeneratedDocument;
import com.boundgen.domain.generation.model.GenerationRequest;

/**
 * Text-generation service producing a structured document.
 * Implementations throw {@code GenerationServiceException} on failure, timeout or cancellation.
 */
public interface DocumentGenerator {

    GeneratedDocument generate(GenerationRequest request);
}
