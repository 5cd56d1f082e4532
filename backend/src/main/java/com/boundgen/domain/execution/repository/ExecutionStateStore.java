package com.boundgen.domain.execution.repository;

import com.boundgen.domain.execution.model.ExecutionState;

import java.time.Instant;
import java.util.Optional;

public interface ExecutionStateStore {

    /** Stores a copy of the current state; later changes to {@code state} are not visible until saved again. */
    void save(ExecutionState state);

    Optional<ExecutionState> findById(String executionId);

    /** Removes executions last updated before the cutoff and returns how many were removed. */
    int deleteUpdatedBefore(Instant cutoff);
}
