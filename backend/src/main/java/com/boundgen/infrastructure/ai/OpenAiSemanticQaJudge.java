package com.boundgen.infrastructure.ai;

import com.boundgen.domain.clarification.model.Invariant;
import com.boundgen.domain.clarification.model.MergedClarification;
import com.boundgen.domain.clarification.model.MergedClarifications;
import com.boundgen.domain.document.model.GeneratedDocument;
import com.boundgen.domain.generation.model.JudgeVerdict;
import com.boundgen.domain.generation.service.SemanticQaJudge;
import com.boundgen.domain.validation.model.Severity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Semantic QA judge backed by a JSON-mode chat completion.
 * Only registered when {@code semantic-qa.enabled=true}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "semantic-qa.enabled", havingValue = "true")
public class OpenAiSemanticQaJudge implements SemanticQaJudge {

    static final String SYSTEM_PROMPT = """
            You are a QA reviewer. Check the document against the bound constraints and the policy below.

            A bound constraint is violated when the document contradicts it, or when it presents the
            decided question as still open. A follow-up question that keeps the decision is fine.

            Respond with a single JSON object:
            {
              "pass": true | false,
              "violations": [{"code", "severity": "fatal|error|warning", "location": "<json pointer>", "explanation", "suggested_fix"}],
              "coverage": [{"binding_id", "status": "satisfied|missing|contradicted|reopened", "evidence"}]
            }
            Report one coverage entry per bound constraint.
            """;

    private final OpenAiChatClient chatClient;
    private final DocumentJsonMapper documentMapper;
    private final ObjectMapper objectMapper;

    @Value("${semantic-qa.model:gpt-4o-mini}")
    private String model;

    @Value("${semantic-qa.max-tokens:2048}")
    private int maxTokens;

    @Override
    public JudgeVerdict judge(MergedClarifications clarifications, GeneratedDocument document, String policyText) {
        String userMessage = buildUserMessage(clarifications, document, policyText);
        LlmCallResult result;
        try {
            result = chatClient.completeJson("semantic-qa", model, 0.0, maxTokens, SYSTEM_PROMPT, userMessage);
        } catch (GenerationServiceException e) {
            throw new JudgeUnavailableException("Semantic QA judge unavailable: " + e.getMessage(), e);
        }
        return parseVerdict(result.content());
    }

    String buildUserMessage(MergedClarifications clarifications, GeneratedDocument document, String policyText) {
        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode bindings = payload.putArray("bound_constraints");
        for (Invariant invariant : clarifications.invariants()) {
            ObjectNode node = bindings.addObject();
            node.put("id", invariant.id());
            node.put("kind", invariant.invariantKind().wireValue());
            node.put("text", invariant.normalizedText());
        }
        ArrayNode answers = payload.putArray("clarifications");
        for (MergedClarification merged : clarifications.clarifications()) {
            ObjectNode node = answers.addObject();
            node.put("id", merged.id());
            node.put("question", merged.clarification().questionText());
            node.put("answer", merged.clarification().answerLabel());
            node.put("binding", merged.binding());
        }
        payload.set("document", documentMapper.toJson(document));

        return "## Policy\n" + policyText.strip() + "\n\n## Input\n" + payload.toPrettyString();
    }

    JudgeVerdict parseVerdict(String content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new JudgeUnavailableException("Semantic QA judge returned invalid JSON", e);
        }
        if (root == null || !root.isObject() || !root.has("pass")) {
            throw new JudgeUnavailableException("Semantic QA verdict has no pass field");
        }

        List<JudgeVerdict.Violation> violations = new ArrayList<>();
        for (JsonNode v : root.path("violations")) {
            violations.add(new JudgeVerdict.Violation(
                    v.path("code").asText("UNSPECIFIED"),
                    severityOf(v.path("severity").asText("")),
                    v.path("location").asText(""),
                    v.path("explanation").asText(""),
                    v.hasNonNull("suggested_fix") ? v.get("suggested_fix").asText() : null));
        }
        List<JudgeVerdict.Coverage> coverage = new ArrayList<>();
        for (JsonNode c : root.path("coverage")) {
            coverage.add(new JudgeVerdict.Coverage(
                    c.path("binding_id").asText(""),
                    c.path("status").asText(""),
                    c.path("evidence").asText("")));
        }

        JudgeVerdict verdict = new JudgeVerdict(root.get("pass").asBoolean(), violations, coverage);
        log.info("Semantic QA verdict - pass: {}, violations: {}, coverage: {}",
                verdict.pass(), violations.size(), coverage.size());
        return verdict;
    }

    static Severity severityOf(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "fatal", "critical" -> Severity.FATAL;
            case "error", "high" -> Severity.ERROR;
            default -> Severity.WARNING;
        };
    }
}
