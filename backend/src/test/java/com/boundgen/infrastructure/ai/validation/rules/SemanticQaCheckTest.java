package com.boundgen.infrastructure.ai.validation.rules;

import com.boundgen.domain.clarification.model.MergedClarifications;
import com.boundgen.domain.document.model.GeneratedDocument;
import com.boundgen.domain.generation.model.JudgeVerdict;
import com.boundgen.domain.generation.model.TaskParameters;
import com.boundgen.domain.generation.service.SemanticQaJudge;
import com.boundgen.domain.validation.model.Finding;
import com.boundgen.domain.validation.model.RuleGroup;
import com.boundgen.domain.validation.model.Severity;
import com.boundgen.infrastructure.ai.JudgeUnavailableException;
import com.boundgen.infrastructure.ai.validation.RuleGroupOutcome;
import com.boundgen.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SemanticQaCheckTest {

    private static final String POLICY = "Never reopen a bound decision.";

    @Mock
    private SemanticQaJudge judge;

    private MergedClarifications merged;
    private GeneratedDocument document;
    private TaskParameters task;

    @BeforeEach
    void setUp() {
        merged = Fixtures.merged(Fixtures.deploymentContext());
        document = Fixtures.document().build();
        task = Fixtures.task().toBuilder().policyText(POLICY).build();
    }

    private RuleGroupOutcome evaluate(SemanticQaCheck check, TaskParameters parameters) {
        return check.evaluate(Fixtures.input(merged, document, parameters), RuleGroup.SEMANTIC_QA.defaults());
    }

    private SemanticQaCheck skipping() {
        return new SemanticQaCheck(Optional.of(judge), SemanticQaCheck.OnUnavailable.SKIP);
    }

    @Nested
    @DisplayName("availability")
    class Availability {

        @Test
        void noJudgeConfiguredProducesNothing() {
            SemanticQaCheck check = new SemanticQaCheck(Optional.empty(), SemanticQaCheck.OnUnavailable.FAIL);

            assertThat(evaluate(check, task).findings()).isEmpty();
        }

        @Test
        void missingPolicySkipsWithWarning() {
            RuleGroupOutcome outcome = evaluate(skipping(), Fixtures.task());

            assertThat(outcome.findings()).extracting(Finding::ruleId).containsExactly(SemanticQaCheck.NO_POLICY_RULE);
            assertThat(outcome.findings().get(0).severity()).isEqualTo(Severity.WARNING);
            verifyNoInteractions(judge);
        }

        @Test
        void unreachableJudgeIsWarningUnderSkipPolicy() {
            when(judge.judge(any(), any(), eq(POLICY))).thenThrow(new JudgeUnavailableException("timeout"));

            RuleGroupOutcome outcome = evaluate(skipping(), task);

            assertThat(outcome.findings()).singleElement().satisfies(f -> {
                assertThat(f.ruleId()).isEqualTo(SemanticQaCheck.UNAVAILABLE_RULE);
                assertThat(f.severity()).isEqualTo(Severity.WARNING);
            });
        }

        @Test
        void unreachableJudgeIsFatalUnderFailPolicy() {
            when(judge.judge(any(), any(), eq(POLICY))).thenThrow(new JudgeUnavailableException("timeout"));
            SemanticQaCheck check = new SemanticQaCheck(Optional.of(judge), SemanticQaCheck.OnUnavailable.FAIL);

            RuleGroupOutcome outcome = evaluate(check, task);

            assertThat(outcome.findings()).extracting(Finding::severity).containsExactly(Severity.FATAL);
            assertThat(outcome.halt()).isFalse();
        }

        @Test
        void policyNameIsCaseInsensitive() {
            SemanticQaCheck check = new SemanticQaCheck(Optional.of(judge), " fail ");
            when(judge.judge(any(), any(), eq(POLICY))).thenThrow(new JudgeUnavailableException("down"));

            assertThat(evaluate(check, task).findings()).extracting(Finding::severity).containsExactly(Severity.FATAL);
        }
    }

    @Nested
    @DisplayName("verdicts")
    class Verdicts {

        @Test
        void violationsKeepJudgeSeverity() {
            JudgeVerdict verdict = new JudgeVerdict(false, List.of(
                    new JudgeVerdict.Violation("REOPENED", Severity.ERROR, "/unknowns/0", "Asks about deployment again", "Drop it"),
                    new JudgeVerdict.Violation("TONE", Severity.WARNING, "/assumptions/1", "Too informal", null)),
                    List.of(new JudgeVerdict.Coverage("DEPLOYMENT_CONTEXT", "reopened", "unknowns[0]")));
            when(judge.judge(merged, document, POLICY)).thenReturn(verdict);

            RuleGroupOutcome outcome = evaluate(skipping(), task);

            assertThat(outcome.findings()).extracting(Finding::ruleId)
                    .containsExactly("SEMANTIC-QA-REOPENED", "SEMANTIC-QA-TONE");
            assertThat(outcome.findings()).extracting(Finding::severity)
                    .containsExactly(Severity.ERROR, Severity.WARNING);
            assertThat(outcome.findings().get(0).remediation()).isEqualTo("Drop it");
        }

        @Test
        void passingVerdictWithBrokenCoverageIsInconsistent() {
            JudgeVerdict verdict = new JudgeVerdict(true, List.of(),
                    List.of(new JudgeVerdict.Coverage("DEPLOYMENT_CONTEXT", "contradicted", "assumptions[2]")));
            when(judge.judge(merged, document, POLICY)).thenReturn(verdict);

            assertThat(evaluate(skipping(), task).findings()).singleElement().satisfies(f -> {
                assertThat(f.ruleId()).isEqualTo(SemanticQaCheck.COVERAGE_RULE);
                assertThat(f.severity()).isEqualTo(Severity.ERROR);
            });
        }

        @Test
        void failingVerdictWithoutBlockingViolationIsStillBlocking() {
            JudgeVerdict verdict = new JudgeVerdict(false,
                    List.of(new JudgeVerdict.Violation("STYLE", Severity.WARNING, "", "Wordy", null)), List.of());
            when(judge.judge(merged, document, POLICY)).thenReturn(verdict);

            assertThat(evaluate(skipping(), task).findings()).extracting(Finding::ruleId)
                    .containsExactly("SEMANTIC-QA-STYLE", SemanticQaCheck.UNEXPLAINED_RULE);
        }

        @Test
        void coverageForUnknownBindingIsWarned() {
            JudgeVerdict verdict = new JudgeVerdict(true, List.of(),
                    List.of(new JudgeVerdict.Coverage("BUDGET", "satisfied", "")));
            when(judge.judge(merged, document, POLICY)).thenReturn(verdict);

            assertThat(evaluate(skipping(), task).findings()).singleElement().satisfies(f -> {
                assertThat(f.ruleId()).isEqualTo(SemanticQaCheck.UNKNOWN_BINDING_RULE);
                assertThat(f.severity()).isEqualTo(Severity.WARNING);
            });
        }

        @Test
        void cleanPassProducesNothing() {
            when(judge.judge(merged, document, POLICY)).thenReturn(new JudgeVerdict(true, List.of(),
                    List.of(new JudgeVerdict.Coverage("DEPLOYMENT_CONTEXT", "satisfied", "known_constraints[0]"))));

            assertThat(evaluate(skipping(), task).findings()).isEmpty();
        }
    }
}
