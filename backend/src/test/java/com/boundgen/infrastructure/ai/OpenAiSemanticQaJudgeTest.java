package com.boundgen.infrastructure.ai;

import com.boundgen.domain.clarification.model.MergedClarifications;
import com.boundgen.domain.document.model.GeneratedDocument;
import com.boundgen.domain.generation.model.JudgeVerdict;
import com.boundgen.domain.validation.model.Severity;
import com.boundgen.support.Fixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.boundgen.domain.document.model.DocumentSection.UNKNOWNS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OpenAiSemanticQaJudgeTest {

    @Mock
    private OpenAiChatClient chatClient;

    private OpenAiSemanticQaJudge judge;
    private MergedClarifications merged;
    private GeneratedDocument document;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        judge = new OpenAiSemanticQaJudge(chatClient, new DocumentJsonMapper(objectMapper), objectMapper);
        merged = Fixtures.merged(Fixtures.deploymentContext(), Fixtures.offlineSupport());
        document = Fixtures.document().with(UNKNOWNS, "Is this for a business?").build();
    }

    @Test
    @DisplayName("verdict JSON: violations, severities and coverage")
    void parsesVerdict() {
        JudgeVerdict verdict = judge.parseVerdict("""
                {
                  "pass": false,
                  "violations": [
                    {"code": "REOPENED", "severity": "critical", "location": "/unknowns/0",
                     "explanation": "Asks about deployment again", "suggested_fix": "Drop the question"},
                    {"code": "TONE", "severity": "low", "explanation": "Informal"}
                  ],
                  "coverage": [{"binding_id": "DEPLOYMENT_CONTEXT", "status": "reopened", "evidence": "unknowns[0]"}]
                }
                """);

        assertThat(verdict.pass()).isFalse();
        assertThat(verdict.violations()).extracting(JudgeVerdict.Violation::severity)
                .containsExactly(Severity.FATAL, Severity.WARNING);
        assertThat(verdict.violations().get(0).suggestedFix()).isEqualTo("Drop the question");
        assertThat(verdict.violations().get(1).suggestedFix()).isNull();
        assertThat(verdict.coverage()).singleElement().satisfies(c -> assertThat(c.breaksBinding()).isTrue());
    }

    @Test
    void verdictWithoutPassFieldMeansJudgeUnavailable() {
        assertThatThrownBy(() -> judge.parseVerdict("{\"violations\": []}"))
                .isInstanceOf(JudgeUnavailableException.class);
        assertThatThrownBy(() -> judge.parseVerdict("I think it is fine"))
                .isInstanceOf(JudgeUnavailableException.class);
    }

    @Test
    void userMessageCarriesPolicyBindingsAndDocument() {
        String message = judge.buildUserMessage(merged, document, "  No reopening.  ");

        assertThat(message).startsWith("## Policy\nNo reopening.\n");
        assertThat(message)
                .contains("\"id\" : \"DEPLOYMENT_CONTEXT\"")
                .contains("\"id\" : \"OFFLINE_SUPPORT\"")
                .contains("Is this for a business?");
    }

    @Test
    void serviceFailureSurfacesAsUnavailableJudge() {
        when(chatClient.completeJson(eq("semantic-qa"), any(), anyDouble(), anyInt(), anyString(), anyString()))
                .thenThrow(new GenerationServiceException(GenerationServiceException.Kind.TIMEOUT, "timed out"));

        assertThatThrownBy(() -> judge.judge(merged, document, "policy"))
                .isInstanceOf(JudgeUnavailableException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    void judgeParsesCompletionContent() {
        when(chatClient.completeJson(eq("semantic-qa"), any(), anyDouble(), anyInt(), anyString(), anyString()))
                .thenReturn(new LlmCallResult("{\"pass\": true, \"violations\": [], \"coverage\": []}", 100, 20));

        assertThat(judge.judge(merged, document, "policy").pass()).isTrue();
    }

    @Test
    void mapsSeverityWords() {
        assertThat(OpenAiSemanticQaJudge.severityOf("FATAL")).isEqualTo(Severity.FATAL);
        assertThat(OpenAiSemanticQaJudge.severityOf(" high ")).isEqualTo(Severity.ERROR);
        assertThat(OpenAiSemanticQaJudge.severityOf("")).isEqualTo(Severity.WARNING);
    }
}
