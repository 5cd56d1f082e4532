package com.boundgen.domain.clarification.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * A binding clarification. Derived deterministically, never mutated.
 *
 * @param id             same id as the source clarification
 * @param normalizedText canonical sentence form of the decision
 * @param invariantKind  requirement or exclusion
 * @param canonicalTags  lowercase keyword tokens used for overlap matching
 * @param bindingReason  which binding rule matched
 * @param clarification  the source clarification
 */
public record Invariant(
        String id,
        String normalizedText,
        InvariantKind invariantKind,
        List<String> canonicalTags,
        String bindingReason,
        @JsonIgnore Clarification clarification
) {
    public Invariant {
        canonicalTags = canonicalTags == null ? List.of() : List.copyOf(canonicalTags);
    }

    public boolean isExclusion() {
        return invariantKind == InvariantKind.EXCLUSION;
    }
}
