package com.boundgen.application.generation.exception;

public class ExecutionNotFoundException extends RuntimeException {

    public ExecutionNotFoundException(String executionId) {
        super("Execution not found: " + executionId);
    }
}
