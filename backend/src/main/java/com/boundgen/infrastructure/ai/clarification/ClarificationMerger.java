package com.boundgen.infrastructure.ai.clarification;

import com.boundgen.domain.clarification.exception.MalformedClarificationException;
import com.boundgen.domain.clarification.model.BindingDecision;
import com.boundgen.domain.clarification.model.Clarification;
import com.boundgen.domain.clarification.model.Invariant;
import com.boundgen.domain.clarification.model.MergedClarification;
import com.boundgen.domain.clarification.model.MergedClarifications;
import com.boundgen.infrastructure.ai.text.TextOverlapMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges a clarification round into all clarifications plus the binding subset.
 * Deterministic and order preserving, so re-merging the same input yields equal output.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClarificationMerger {

    private final ConstraintDeriver constraintDeriver;
    private final AnswerLabelResolver labelResolver;
    private final TextOverlapMatcher overlapMatcher;

    public MergedClarifications merge(List<Clarification> clarifications) {
        Set<String> seenIds = new HashSet<>();
        List<MergedClarification> merged = new ArrayList<>(clarifications.size());
        List<Invariant> invariants = new ArrayList<>();

        for (Clarification clarification : clarifications) {
            requireWellFormed(clarification, seenIds);

            BindingDecision decision = constraintDeriver.derive(clarification);
            merged.add(new MergedClarification(clarification, decision));

            if (decision.binding()) {
                invariants.add(toInvariant(clarification, decision));
            }
        }

        log.info("Merged {} clarifications, {} binding invariants", merged.size(), invariants.size());
        return new MergedClarifications(merged, invariants);
    }

    /**
     * Merges a question set with an answer map keyed by question id. Questions without
     * an answer stay unresolved; labels and resolved flags are derived from the answers.
     */
    public MergedClarifications merge(List<Clarification> questions, Map<String, Object> answers) {
        List<Clarification> answered = new ArrayList<>(questions.size());
        for (Clarification question : questions) {
            Object answer = question.id() == null ? null : answers.get(question.id());
            Clarification withAnswer = question.toBuilder()
                    .answer(answer)
                    .answerLabel(null)
                    .build();
            answered.add(labelResolver.complete(withAnswer, null));
        }
        return merge(answered);
    }

    /**
     * Explicit tags from the question set win; otherwise the tags are the keywords of
     * the normalized text.
     */
    List<String> canonicalTags(Clarification clarification, String normalizedText) {
        Set<String> tags = new LinkedHashSet<>();
        if (!clarification.canonicalTags().isEmpty()) {
            for (String tag : clarification.canonicalTags()) {
                tags.addAll(overlapMatcher.keywords(tag));
            }
        } else {
            tags.addAll(overlapMatcher.keywords(normalizedText));
        }
        return List.copyOf(tags);
    }

    private Invariant toInvariant(Clarification clarification, BindingDecision decision) {
        if (decision.normalizedText() == null || decision.normalizedText().isBlank()) {
            throw new MalformedClarificationException(clarification.id(),
                    "Binding clarification " + clarification.id() + " has no answer text");
        }
        return new Invariant(
                clarification.id(),
                decision.normalizedText(),
                decision.invariantKind(),
                canonicalTags(clarification, decision.normalizedText()),
                decision.reason(),
                clarification);
    }

    private void requireWellFormed(Clarification clarification, Set<String> seenIds) {
        if (clarification.id() == null || clarification.id().isBlank()) {
            throw new MalformedClarificationException(null, "Clarification id is required");
        }
        if (clarification.priority() == null) {
            throw new MalformedClarificationException(clarification.id(),
                    "Clarification " + clarification.id() + " has no priority");
        }
        if (!seenIds.add(clarification.id())) {
            throw new MalformedClarificationException(clarification.id(),
                    "Duplicate clarification id: " + clarification.id());
        }
    }
}
