package com.boundgen.infrastructure.ai.pipeline;

import com.boundgen.domain.clarification.model.Invariant;
import com.boundgen.domain.document.model.GeneratedDocument;
import com.boundgen.domain.execution.model.AttemptState;
import com.boundgen.domain.execution.model.ExecutionState;
import com.boundgen.domain.execution.repository.ExecutionStateStore;
import com.boundgen.domain.generation.model.FailureKind;
import com.boundgen.domain.generation.model.GenerationRequest;
import com.boundgen.domain.generation.model.GenerationResult;
import com.boundgen.domain.generation.model.TaskParameters;
import com.boundgen.domain.generation.service.DocumentGenerator;
import com.boundgen.domain.validation.model.Finding;
import com.boundgen.domain.validation.model.QaFeedbackRecord;
import com.boundgen.domain.validation.model.Severity;
import com.boundgen.domain.validation.model.ValidationResult;
import com.boundgen.infrastructure.ai.GenerationServiceException;
import com.boundgen.infrastructure.ai.context.ContextBuilder;
import com.boundgen.infrastructure.ai.reconciliation.ReconciliationStage;
import com.boundgen.infrastructure.ai.validation.ValidationEngine;
import com.boundgen.infrastructure.ai.validation.ValidationInput;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Runs the generation loop for one execution:
 * <p>
 * build context → generate → reconcile → validate → success, or feedback → next attempt
 * </p>
 * Attempts are strictly sequential. A failed attempt replaces the execution's QA feedback
 * record with its own blocking findings; success clears it.
 */
@Slf4j
@Component
public class GenerationPipeline {

    private final ContextBuilder contextBuilder;
    private final DocumentGenerator documentGenerator;
    private final ReconciliationStage reconciliationStage;
    private final ValidationEngine validationEngine;
    private final ExecutionStateStore stateStore;
    private final Retry generationRetry;
    private final int defaultMaxAttempts;
    private final String defaultSchemaRef;

    public GenerationPipeline(ContextBuilder contextBuilder,
                              DocumentGenerator documentGenerator,
                              ReconciliationStage reconciliationStage,
                              ValidationEngine validationEngine,
                              ExecutionStateStore stateStore,
                              Retry generationRetry,
                              @Value("${generation.max-attempts:3}") int defaultMaxAttempts,
                              @Value("${validation.schema.default-ref:generated_document.v1}") String defaultSchemaRef) {
        this.contextBuilder = contextBuilder;
        this.documentGenerator = documentGenerator;
        this.reconciliationStage = reconciliationStage;
        this.validationEngine = validationEngine;
        this.stateStore = stateStore;
        this.generationRetry = generationRetry;
        this.defaultMaxAttempts = defaultMaxAttempts;
        this.defaultSchemaRef = defaultSchemaRef;
    }

    public GenerationResult run(ExecutionState state, TaskParameters task) {
        int maxAttempts = task.maxAttempts() != null && task.maxAttempts() > 0 ? task.maxAttempts() : defaultMaxAttempts;
        String schemaRef = task.schemaRef() != null && !task.schemaRef().isBlank() ? task.schemaRef() : defaultSchemaRef;
        List<Invariant> invariants = state.getClarifications().invariants();

        log.info("Generation started - execution: {}, documentType: {}, invariants: {}, maxAttempts: {}",
                state.getExecutionId(), task.documentType(), invariants.size(), maxAttempts);

        while (state.getAttempt() < maxAttempts) {
            state.setAttempt(state.getAttempt() + 1);
            int attempt = state.getAttempt();
            if (Thread.currentThread().isInterrupted()) {
                return fail(state, FailureKind.GENERATION_CANCELLED, "Generation interrupted before attempt " + attempt + " started");
            }

            transition(state, AttemptState.BUILDING_CONTEXT);
            GenerationRequest request = contextBuilder.build(invariants, state.getQaFeedback(), task, schemaRef);

            transition(state, AttemptState.GENERATING);
            GeneratedDocument generated;
            try {
                generated = generate(request);
            } catch (GenerationServiceException e) {
                // an interrupt during retry backoff surfaces as the last transient failure
                FailureKind kind = Thread.currentThread().isInterrupted()
                        ? FailureKind.GENERATION_CANCELLED
                        : e.getKind().failureKind();
                log.error("Attempt {} generation failed ({}): {}", attempt, kind, e.getMessage());
                return fail(state, kind, e.getMessage());
            }

            transition(state, AttemptState.RECONCILING);
            ReconciliationStage.ReconciledDocument reconciled = reconciliationStage.reconcile(generated, invariants);
            state.setDocument(reconciled.document());
            state.setReconciliation(reconciled.report());

            transition(state, AttemptState.VALIDATING);
            ValidationResult result = validationEngine.validate(new ValidationInput(
                    state.getClarifications(), reconciled.document(), task, schemaRef, attempt));
            state.recordValidation(result);

            if (result.passed()) {
                state.clearQaFeedback();
                transition(state, AttemptState.SUCCESS);
                log.info("Generation succeeded - execution: {}, attempts: {}, warnings: {}",
                        state.getExecutionId(), attempt, result.warnings().size());
                return state.toResult();
            }

            state.setQaFeedback(QaFeedbackRecord.from(result));
            stateStore.save(state);
            log.info("Attempt {}/{} failed with {} blocking findings{}", attempt, maxAttempts, result.blocking().size(),
                    attempt < maxAttempts ? ", retrying with feedback" : "");
        }

        state.setFailureKind(FailureKind.VALIDATION_FAILURE);
        transition(state, AttemptState.FAILED);
        log.warn("Generation failed - execution: {}, attempts exhausted: {}", state.getExecutionId(), state.getAttempt());
        return state.toResult();
    }

    private GeneratedDocument generate(GenerationRequest request) {
        return Retry.decorateSupplier(generationRetry, () -> documentGenerator.generate(request)).get();
    }

    /**
     * Ends the execution on a generation service problem or cancellation. The attempt is
     * recorded with one fatal finding naming the failure kind.
     */
    private GenerationResult fail(ExecutionState state, FailureKind kind, String message) {
        String detail = message != null ? message : kind.wireValue();
        state.recordValidation(new ValidationResult(state.getAttempt(),
                List.of(Finding.of(serviceRuleId(kind), Severity.FATAL, "", detail)), null));
        state.setFailureKind(kind);
        state.setFailureMessage(message);
        transition(state, AttemptState.FAILED);
        return state.toResult();
    }

    static String serviceRuleId(FailureKind kind) {
        return kind.name().replace('_', '-');
    }

    private void transition(ExecutionState state, AttemptState next) {
        log.debug("Execution {} attempt {}: {} -> {}", state.getExecutionId(), state.getAttempt(), state.getState(), next);
        state.setState(next);
        state.setUpdatedAt(Instant.now());
        stateStore.save(state);
    }
}
