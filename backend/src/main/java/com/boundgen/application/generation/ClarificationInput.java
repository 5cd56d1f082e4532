package com.boundgen.application.generation;

import com.boundgen.domain.clarification.model.Clarification;

/**
 * A clarification as submitted by a caller.
 *
 * @param clarification clarification fields; its resolved flag is ignored
 * @param resolved      caller-stated resolved flag, null to derive it from the answer
 */
public record ClarificationInput(Clarification clarification, Boolean resolved) {}
