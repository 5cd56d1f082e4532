package com.boundgen.domain.clarification.model;

/**
 * One selectable option of a choice-type clarification question.
 */
public record Choice(String id, String label) {}
