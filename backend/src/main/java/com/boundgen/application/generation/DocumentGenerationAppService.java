package com.boundgen.application.generation;

import com.boundgen.application.generation.exception.ExecutionNotFoundException;
import com.boundgen.domain.clarification.model.Clarification;
import com.boundgen.domain.clarification.model.MergedClarifications;
import com.boundgen.domain.execution.model.ExecutionState;
import com.boundgen.domain.execution.repository.ExecutionStateStore;
import com.boundgen.domain.generation.model.GenerationResult;
import com.boundgen.domain.generation.model.TaskParameters;
import com.boundgen.infrastructure.ai.clarification.AnswerLabelResolver;
import com.boundgen.infrastructure.ai.clarification.ClarificationMerger;
import com.boundgen.infrastructure.ai.pipeline.GenerationPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Caller-facing entry point: merge the clarification round, then run the generation loop
 * in a fresh execution.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentGenerationAppService {

    private final ClarificationMerger clarificationMerger;
    private final AnswerLabelResolver labelResolver;
    private final GenerationPipeline generationPipeline;
    private final ExecutionStateStore stateStore;

    /**
     * @param answers answers keyed by question id; when non-null the inputs are treated as
     *                a question set and their own answers are replaced
     */
    public MergedClarifications merge(List<ClarificationInput> inputs, Map<String, Object> answers) {
        if (answers != null) {
            List<Clarification> questions = inputs.stream().map(ClarificationInput::clarification).toList();
            return clarificationMerger.merge(questions, answers);
        }
        List<Clarification> completed = inputs.stream()
                .map(input -> labelResolver.complete(input.clarification(), input.resolved()))
                .toList();
        return clarificationMerger.merge(completed);
    }

    public GenerationResult generate(List<ClarificationInput> inputs, Map<String, Object> answers, TaskParameters task) {
        MergedClarifications merged = merge(inputs, answers);

        ExecutionState state = new ExecutionState(UUID.randomUUID().toString(), merged, Instant.now());
        state.setUpdatedAt(state.getCreatedAt());
        stateStore.save(state);

        return generationPipeline.run(state, task);
    }

    public ExecutionState getExecution(String executionId) {
        return stateStore.findById(executionId)
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));
    }
}
