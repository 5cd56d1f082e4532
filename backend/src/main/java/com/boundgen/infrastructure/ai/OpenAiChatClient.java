package com.boundgen.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.InterruptedIOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Raw JSON-mode chat completion call. Every failure surfaces as a
 * {@link GenerationServiceException} whose kind tells timeouts and cancellation apart.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiChatClient {

    private final OpenAIClient openAIClient;
    private final TokenUsageTracker usageTracker;

    public LlmCallResult completeJson(String caller, String model, double temperature, int maxTokens,
                                      String systemPrompt, String userMessage) {
        try {
            ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(temperature)
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(systemPrompt)
                    .addUserMessage(userMessage)
                    .responseFormat(ResponseFormatJsonObject.builder().build())
                    .build();

            ChatCompletion completion = openAIClient.chat().completions().create(params);

            long promptTokens = completion.usage().map(u -> u.promptTokens()).orElse(0L);
            long completionTokens = completion.usage().map(u -> u.completionTokens()).orElse(0L);
            long cachedTokens = completion.usage()
                    .flatMap(u -> u.promptTokensDetails())
                    .flatMap(d -> d.cachedTokens())
                    .orElse(0L);
            usageTracker.recordUsage(caller, promptTokens, completionTokens, cachedTokens);

            String content = completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .orElseThrow(() -> new GenerationServiceException(
                            GenerationServiceException.Kind.FAILURE, "Completion returned no content"));

            return new LlmCallResult(content.trim(), promptTokens, completionTokens);
        } catch (GenerationServiceException e) {
            throw e;
        } catch (Exception e) {
            GenerationServiceException.Kind kind = classify(e);
            log.error("OpenAI call [{}] failed ({})", caller, kind, e);
            throw new GenerationServiceException(kind, "Generation service call failed: " + e.getMessage(), e);
        }
    }

    static GenerationServiceException.Kind classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof CancellationException || t instanceof InterruptedException) {
                return GenerationServiceException.Kind.CANCELLED;
            }
            if (t instanceof InterruptedIOException || t instanceof TimeoutException) {
                return Thread.currentThread().isInterrupted()
                        ? GenerationServiceException.Kind.CANCELLED
                        : GenerationServiceException.Kind.TIMEOUT;
            }
        }
        return GenerationServiceException.Kind.FAILURE;
    }
}
