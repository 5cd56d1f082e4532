package com.boundgen.infrastructure.persistence;

import com.boundgen.domain.execution.model.ExecutionState;
import com.boundgen.domain.execution.repository.ExecutionStateStore;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps a snapshot per save, so readers on request threads never see the pipeline's live state.
 */
@Repository
public class InMemoryExecutionStateStore implements ExecutionStateStore {

    private final Map<String, ExecutionState> executions = new ConcurrentHashMap<>();

    @Override
    public void save(ExecutionState state) {
        executions.put(state.getExecutionId(), state.snapshot());
    }

    @Override
    public Optional<ExecutionState> findById(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public int deleteUpdatedBefore(Instant cutoff) {
        int before = executions.size();
        executions.values().removeIf(state -> lastTouched(state).isBefore(cutoff));
        return before - executions.size();
    }

    private static Instant lastTouched(ExecutionState state) {
        return state.getUpdatedAt() != null ? state.getUpdatedAt() : state.getCreatedAt();
    }
}
