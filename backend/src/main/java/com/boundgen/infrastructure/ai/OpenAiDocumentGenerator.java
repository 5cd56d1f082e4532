package com.boundgen.infrastructure.ai;

import com.boundgen.domain.document.model.GeneratedDocument;
import com.boundgen.domain.generation.model.GenerationRequest;
import com.boundgen.domain.generation.service.DocumentGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiDocumentGenerator implements DocumentGenerator {

    private final OpenAiChatClient chatClient;
    private final DocumentJsonMapper documentMapper;

    @Value("${openai.model}")
    private String model;

    @Value("${openai.temperature}")
    private double temperature;

    @Value("${openai.max-tokens}")
    private int maxTokens;

    @Override
    public GeneratedDocument generate(GenerationRequest request) {
        log.info("Generating document - schema: {}, systemPrompt: {} chars, userMessage: {} chars",
                request.schemaRef(), request.systemPrompt().length(), request.userMessage().length());

        LlmCallResult result = chatClient.completeJson("generation", model, temperature, maxTokens,
                request.systemPrompt(), request.userMessage());
        return documentMapper.parse(result.content());
    }
}
