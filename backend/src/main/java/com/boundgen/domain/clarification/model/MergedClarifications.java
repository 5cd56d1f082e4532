package com.boundgen.domain.clarification.model;

import java.util.List;
import java.util.Optional;

/**
 * Result of merging a clarification round: every clarification in input order,
 * plus the binding subset as invariants (same relative order).
 */
public record MergedClarifications(
        List<MergedClarification> clarifications,
        List<Invariant> invariants
) {
    public MergedClarifications {
        clarifications = List.copyOf(clarifications);
        invariants = List.copyOf(invariants);
    }

    public static MergedClarifications empty() {
        return new MergedClarifications(List.of(), List.of());
    }

    public Optional<MergedClarification> find(String id) {
        return clarifications.stream().filter(c -> c.id().equals(id)).findFirst();
    }

    public List<Invariant> exclusions() {
        return invariants.stream().filter(Invariant::isExclusion).toList();
    }
}
