package com.boundgen.domain.clarification.model;

import lombok.Builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One answered question from the pre-generation clarification round.
 *
 * @param id            stable question id (e.g. DEPLOYMENT_CONTEXT)
 * @param questionText  the question as asked
 * @param priority      must / should / could
 * @param constraintKind declared constraint kind (nullable, treated as NONE)
 * @param answerType    how the answer is shaped (nullable, treated as FREE_TEXT)
 * @param choices       options for choice questions (may be empty)
 * @param answer        raw answer: scalar, boolean or list (nullable)
 * @param answerLabel   human-readable rendering of the answer (nullable)
 * @param resolved      whether the question was actually answered
 * @param canonicalTags explicit topic tags from the question set (may be empty)
 */
@Builder(toBuilder = true)
public record Clarification(
        String id,
        String questionText,
        Priority priority,
        ConstraintKind constraintKind,
        AnswerType answerType,
        List<Choice> choices,
        Object answer,
        String answerLabel,
        boolean resolved,
        List<String> canonicalTags
) {
    public Clarification {
        choices = choices == null ? List.of() : List.copyOf(choices);
        canonicalTags = canonicalTags == null ? List.of() : List.copyOf(canonicalTags);
        if (answer instanceof List<?> list) {
            answer = Collections.unmodifiableList(new ArrayList<>(list));
        }
    }

    public boolean hasChoices() {
        return !choices.isEmpty();
    }
}
