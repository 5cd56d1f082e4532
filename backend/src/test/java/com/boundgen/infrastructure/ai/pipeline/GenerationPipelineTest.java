package com.boundgen.infrastructure.ai.pipeline;

import com.boundgen.domain.clarification.model.MergedClarifications;
import com.boundgen.domain.document.model.DocumentItem;
import com.boundgen.domain.document.model.GeneratedDocument;
import com.boundgen.domain.execution.model.AttemptState;
import com.boundgen.domain.execution.model.ExecutionState;
import com.boundgen.domain.generation.model.FailureKind;
import com.boundgen.domain.generation.model.GenerationRequest;
import com.boundgen.domain.generation.model.GenerationResult;
import com.boundgen.domain.generation.service.DocumentGenerator;
import com.boundgen.domain.validation.model.Finding;
import com.boundgen.domain.validation.model.Outcome;
import com.boundgen.domain.validation.model.Severity;
import com.boundgen.domain.validation.model.ValidationResult;
import com.boundgen.infrastructure.ai.DocumentJsonMapper;
import com.boundgen.infrastructure.ai.GenerationServiceException;
import com.boundgen.infrastructure.ai.context.ContextBuilder;
import com.boundgen.infrastructure.ai.reconciliation.ExclusionFilter;
import com.boundgen.infrastructure.ai.reconciliation.InvariantPinner;
import com.boundgen.infrastructure.ai.reconciliation.ReconciliationStage;
import com.boundgen.infrastructure.ai.text.KeywordOverlapMatcher;
import com.boundgen.infrastructure.ai.validation.RuleGroupCheck;
import com.boundgen.infrastructure.ai.validation.RuleGroupTable;
import com.boundgen.infrastructure.ai.validation.ValidationEngine;
import com.boundgen.infrastructure.ai.validation.rules.ConstraintStatedCheck;
import com.boundgen.infrastructure.ai.validation.rules.ContradictionCheck;
import com.boundgen.infrastructure.ai.validation.rules.GroundingCheck;
import com.boundgen.infrastructure.ai.validation.rules.InternalContradictionCheck;
import com.boundgen.infrastructure.ai.validation.rules.PolicyConformanceCheck;
import com.boundgen.infrastructure.ai.validation.rules.PromotionValidityCheck;
import com.boundgen.infrastructure.ai.validation.rules.ReopenedDecisionCheck;
import com.boundgen.infrastructure.ai.validation.rules.SchemaConformanceCheck;
import com.boundgen.infrastructure.ai.validation.rules.SemanticQaCheck;
import com.boundgen.infrastructure.ai.validation.rules.TraceabilityCheck;
import com.boundgen.infrastructure.persistence.InMemoryExecutionStateStore;
import com.boundgen.support.Fixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerationPipelineTest {

    private static final String FEEDBACK_HEADER = "## Previous QA Feedback";

    @Mock
    private DocumentGenerator documentGenerator;

    private DocumentJsonMapper documentMapper;
    private InMemoryExecutionStateStore stateStore;
    private GenerationPipeline pipeline;
    private ExecutionState state;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        KeywordOverlapMatcher matcher = Fixtures.matcher();
        documentMapper = new DocumentJsonMapper(objectMapper);

        List<RuleGroupCheck> checks = List.of(
                new ContradictionCheck(matcher),
                new ReopenedDecisionCheck(matcher, 1),
                new ConstraintStatedCheck(matcher),
                new TraceabilityCheck(),
                new PromotionValidityCheck(matcher),
                new InternalContradictionCheck(matcher),
                new PolicyConformanceCheck(),
                new GroundingCheck(matcher),
                new SchemaConformanceCheck(documentMapper),
                new SemanticQaCheck(Optional.empty(), SemanticQaCheck.OnUnavailable.SKIP));

        Retry retry = Retry.of("test", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryOnException(GenerationRetryConfig::isRetryable)
                .build());

        stateStore = new InMemoryExecutionStateStore();
        pipeline = new GenerationPipeline(
                new ContextBuilder(objectMapper),
                documentGenerator,
                new ReconciliationStage(new InvariantPinner(matcher, 2, true), new ExclusionFilter(matcher, 1)),
                new ValidationEngine(checks, RuleGroupTable.defaults()),
                stateStore,
                retry,
                3,
                Fixtures.SCHEMA_REF);

        MergedClarifications merged = Fixtures.merged(Fixtures.deploymentContext());
        state = new ExecutionState("exec-1", merged, Instant.now());
    }

    private GeneratedDocument passing() {
        return documentMapper.parse("""
                {
                  "known_constraints": [{"id": "KC-1", "text": "Personal use only"}],
                  "assumptions": [{"id": "A-1", "text": "Household members share one list"}],
                  "recommendations": [{"id": "R-1", "text": "Start with a shared shopping list"}]
                }
                """);
    }

    private GeneratedDocument selfContradicting() {
        return documentMapper.parse("""
                {
                  "known_constraints": [{"id": "KC-1", "text": "uses PostgreSQL"}],
                  "assumptions": [{"id": "A-1", "text": "the app uses PostgreSQL for storage"}],
                  "recommendations": []
                }
                """);
    }

    private GeneratedDocument missingRecommendations() {
        return documentMapper.parse("""
                {"known_constraints": [{"text": "Personal use only"}], "assumptions": []}
                """);
    }

    private static GenerationServiceException serviceError(GenerationServiceException.Kind kind) {
        return new GenerationServiceException(kind, "service " + kind.name().toLowerCase(Locale.ROOT));
    }

    @Nested
    @DisplayName("validation loop")
    class ValidationLoop {

        @Test
        @DisplayName("first attempt passes with the pinned constraint in place")
        void firstAttemptPasses() {
            when(documentGenerator.generate(any())).thenReturn(passing());

            GenerationResult result = pipeline.run(state, Fixtures.task());

            assertThat(result.outcome()).isEqualTo(Outcome.SUCCESS);
            assertThat(result.attempts()).isEqualTo(1);
            assertThat(result.qaFeedback()).isNull();
            assertThat(result.failureKind()).isNull();
            assertThat(result.document().knownConstraints()).extracting(DocumentItem::text)
                    .containsExactly("Personal use (family/home)");
            assertThat(result.reconciliation().duplicatesRemoved()).isEqualTo(1);
            assertThat(stateStore.findById("exec-1")).get()
                    .extracting(ExecutionState::getState)
                    .isEqualTo(AttemptState.SUCCESS);
        }

        @Test
        @DisplayName("three failed attempts keep only the last attempt's feedback")
        void exhaustsAttemptsWithFeedbackFromLastAttemptOnly() {
            when(documentGenerator.generate(any()))
                    .thenReturn(missingRecommendations(), missingRecommendations(), selfContradicting());

            GenerationResult result = pipeline.run(state, Fixtures.task());

            assertThat(result.outcome()).isEqualTo(Outcome.FAILED);
            assertThat(result.failureKind()).isEqualTo(FailureKind.VALIDATION_FAILURE);
            assertThat(result.attempts()).isEqualTo(3);
            assertThat(result.history()).hasSize(3);
            assertThat(result.history()).allSatisfy(v -> assertThat(v.passed()).isFalse());
            assertThat(result.qaFeedback().sourceAttempt()).isEqualTo(3);
            assertThat(result.qaFeedback().findings()).extracting(Finding::ruleId)
                    .containsExactly("INTERNAL-CONTRADICTION-001");

            ArgumentCaptor<GenerationRequest> requests = ArgumentCaptor.forClass(GenerationRequest.class);
            verify(documentGenerator, times(3)).generate(requests.capture());
            List<GenerationRequest> sent = requests.getAllValues();
            assertThat(sent.get(0).userMessage()).doesNotContain(FEEDBACK_HEADER);
            assertThat(sent.get(1).userMessage()).contains(FEEDBACK_HEADER).contains("Attempt 1 failed").contains("SCHEMA-001");
            assertThat(sent.get(2).userMessage()).contains("Attempt 2 failed").doesNotContain("Attempt 1 failed");
        }

        @Test
        void successAfterFailureClearsFeedback() {
            when(documentGenerator.generate(any())).thenReturn(selfContradicting(), passing());

            GenerationResult result = pipeline.run(state, Fixtures.task());

            assertThat(result.succeeded()).isTrue();
            assertThat(result.attempts()).isEqualTo(2);
            assertThat(result.history()).extracting(ValidationResult::outcome)
                    .containsExactly(Outcome.FAILED, Outcome.SUCCESS);
            assertThat(result.qaFeedback()).isNull();
            assertThat(state.getQaFeedback()).isNull();

            ArgumentCaptor<GenerationRequest> requests = ArgumentCaptor.forClass(GenerationRequest.class);
            verify(documentGenerator, times(2)).generate(requests.capture());
            assertThat(requests.getAllValues().get(1).userMessage()).contains("INTERNAL-CONTRADICTION-001");
        }

        @Test
        void taskCanLowerTheAttemptBound() {
            when(documentGenerator.generate(any())).thenReturn(selfContradicting());

            GenerationResult result = pipeline.run(state, Fixtures.task().toBuilder().maxAttempts(1).build());

            assertThat(result.attempts()).isEqualTo(1);
            assertThat(result.failureKind()).isEqualTo(FailureKind.VALIDATION_FAILURE);
            verify(documentGenerator, times(1)).generate(any());
        }

        @Test
        void requestsUseDefaultSchemaRefWhenTaskHasNone() {
            when(documentGenerator.generate(any())).thenReturn(passing());

            pipeline.run(state, Fixtures.task());

            ArgumentCaptor<GenerationRequest> request = ArgumentCaptor.forClass(GenerationRequest.class);
            verify(documentGenerator).generate(request.capture());
            assertThat(request.getValue().schemaRef()).isEqualTo(Fixtures.SCHEMA_REF);
            assertThat(request.getValue().userMessage()).contains("- DEPLOYMENT_CONTEXT [requirement]");
        }
    }

    @Nested
    @DisplayName("generation service failures")
    class ServiceFailures {

        @Test
        void transientFailuresAreRetriedWithinTheAttempt() {
            when(documentGenerator.generate(any()))
                    .thenThrow(serviceError(GenerationServiceException.Kind.FAILURE))
                    .thenThrow(serviceError(GenerationServiceException.Kind.TIMEOUT))
                    .thenReturn(passing());

            GenerationResult result = pipeline.run(state, Fixtures.task());

            assertThat(result.succeeded()).isTrue();
            assertThat(result.attempts()).isEqualTo(1);
            verify(documentGenerator, times(3)).generate(any());
        }

        @Test
        void exhaustedRetriesEndWithServiceFailure() {
            when(documentGenerator.generate(any())).thenThrow(serviceError(GenerationServiceException.Kind.FAILURE));

            GenerationResult result = pipeline.run(state, Fixtures.task());

            assertThat(result.outcome()).isEqualTo(Outcome.FAILED);
            assertThat(result.failureKind()).isEqualTo(FailureKind.GENERATION_SERVICE_FAILURE);
            assertThat(result.failureMessage()).isEqualTo("service failure");
            assertThat(result.history()).hasSize(1);
            assertThat(result.validationResult().attempt()).isEqualTo(1);
            assertThat(result.validationResult().findings()).singleElement().satisfies(f -> {
                assertThat(f.ruleId()).isEqualTo("GENERATION-SERVICE-FAILURE");
                assertThat(f.severity()).isEqualTo(Severity.FATAL);
                assertThat(f.message()).isEqualTo("service failure");
            });
            verify(documentGenerator, times(3)).generate(any());
        }

        @Test
        void timeoutsEndWithTimeoutKind() {
            when(documentGenerator.generate(any())).thenThrow(serviceError(GenerationServiceException.Kind.TIMEOUT));

            GenerationResult result = pipeline.run(state, Fixtures.task());

            assertThat(result.failureKind()).isEqualTo(FailureKind.GENERATION_TIMEOUT);
            assertThat(result.validationResult().findings()).extracting(Finding::ruleId)
                    .containsExactly("GENERATION-TIMEOUT");
        }

        @Test
        void cancellationIsNeverRetried() {
            when(documentGenerator.generate(any())).thenThrow(serviceError(GenerationServiceException.Kind.CANCELLED));

            GenerationResult result = pipeline.run(state, Fixtures.task());

            assertThat(result.failureKind()).isEqualTo(FailureKind.GENERATION_CANCELLED);
            verify(documentGenerator, times(1)).generate(any());
            assertThat(stateStore.findById("exec-1")).get()
                    .extracting(ExecutionState::getState)
                    .isEqualTo(AttemptState.FAILED);
        }

        @Test
        void serviceFailureAfterValidationFailureKeepsEarlierHistory() {
            when(documentGenerator.generate(any()))
                    .thenReturn(selfContradicting())
                    .thenThrow(serviceError(GenerationServiceException.Kind.CANCELLED));

            GenerationResult result = pipeline.run(state, Fixtures.task());

            assertThat(result.failureKind()).isEqualTo(FailureKind.GENERATION_CANCELLED);
            assertThat(result.attempts()).isEqualTo(2);
            assertThat(result.history()).extracting(ValidationResult::attempt).containsExactly(1, 2);
            assertThat(result.validationResult().findings()).extracting(Finding::ruleId)
                    .containsExactly("GENERATION-CANCELLED");
            assertThat(result.qaFeedback().sourceAttempt()).isEqualTo(1);
        }

        @Test
        @DisplayName("an interrupt during retry backoff is reported as cancellation")
        void interruptDuringRetryIsCancellation() {
            when(documentGenerator.generate(any())).thenAnswer(invocation -> {
                Thread.currentThread().interrupt();
                throw serviceError(GenerationServiceException.Kind.FAILURE);
            });

            GenerationResult result;
            try {
                result = pipeline.run(state, Fixtures.task());
            } finally {
                Thread.interrupted();
            }

            assertThat(result.failureKind()).isEqualTo(FailureKind.GENERATION_CANCELLED);
            assertThat(result.attempts()).isEqualTo(1);
            assertThat(result.validationResult().findings()).extracting(Finding::ruleId)
                    .containsExactly("GENERATION-CANCELLED");
        }

        @Test
        void interruptedRunStopsBeforeTheNextAttempt() {
            when(documentGenerator.generate(any())).thenAnswer(invocation -> {
                Thread.currentThread().interrupt();
                return selfContradicting();
            });

            GenerationResult result;
            try {
                result = pipeline.run(state, Fixtures.task());
            } finally {
                Thread.interrupted();
            }

            assertThat(result.failureKind()).isEqualTo(FailureKind.GENERATION_CANCELLED);
            assertThat(result.attempts()).isEqualTo(2);
            assertThat(result.history()).hasSize(2);
            assertThat(result.validationResult().findings()).singleElement()
                    .satisfies(f -> assertThat(f.message()).contains("before attempt 2"));
            verify(documentGenerator, times(1)).generate(any());
        }
    }

    @Nested
    @DisplayName("provenance")
    class Provenance {

        @Test
        @DisplayName("generator output cannot mark its own entries as user-pinned")
        void selfDeclaredPinsDoNotEscapeContradictionCheck() {
            ExecutionState excluding = new ExecutionState("exec-2",
                    Fixtures.merged(Fixtures.existingSystems()), Instant.now());
            when(documentGenerator.generate(any())).thenReturn(documentMapper.parse("""
                    {
                      "known_constraints": [],
                      "assumptions": [{"id": "A-1", "text": "We use integrations with Google Calendar",
                                       "source": "user_clarification", "constraint_id": "EXISTING_SYSTEMS"}],
                      "recommendations": []
                    }
                    """));

            GenerationResult result = pipeline.run(excluding, Fixtures.task().toBuilder().maxAttempts(1).build());

            assertThat(result.outcome()).isEqualTo(Outcome.FAILED);
            assertThat(result.validationResult().blocking())
                    .anySatisfy(f -> {
                        assertThat(f.ruleId()).isEqualTo("CONTRADICTION-001");
                        assertThat(f.location()).isEqualTo("/assumptions/0");
                    });
            assertThat(result.document().assumptions()).singleElement()
                    .satisfies(item -> assertThat(item.isPinned()).isFalse());
        }
    }
}
