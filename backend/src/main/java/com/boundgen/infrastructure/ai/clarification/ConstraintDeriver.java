package com.boundgen.infrastructure.ai.clarification;

import com.boundgen.domain.clarification.model.BindingDecision;
import com.boundgen.domain.clarification.model.Clarification;
import com.boundgen.domain.clarification.model.ConstraintKind;
import com.boundgen.domain.clarification.model.InvariantKind;
import com.boundgen.domain.clarification.model.Priority;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decides whether a clarification binds later generation.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>unresolved: not binding</li>
 *   <li>exclusion: binding exclusion</li>
 *   <li>requirement: binding requirement</li>
 *   <li>must priority: binding requirement</li>
 *   <li>otherwise not binding</li>
 * </ol>
 * Missing enums are read as NONE / COULD so every combination yields a decision.
 */
@Component
@RequiredArgsConstructor
public class ConstraintDeriver {

    private final AnswerLabelResolver labelResolver;

    public BindingDecision derive(Clarification clarification) {
        String normalizedText = normalizedText(clarification);
        ConstraintKind kind = clarification.constraintKind() == null ? ConstraintKind.NONE : clarification.constraintKind();
        Priority priority = clarification.priority() == null ? Priority.COULD : clarification.priority();

        if (!clarification.resolved()) {
            return BindingDecision.notBinding(normalizedText, "not resolved");
        }
        if (kind == ConstraintKind.EXCLUSION) {
            return BindingDecision.binding(InvariantKind.EXCLUSION, normalizedText, "explicit exclusion constraint");
        }
        if (kind == ConstraintKind.REQUIREMENT) {
            return BindingDecision.binding(InvariantKind.REQUIREMENT, normalizedText, "explicit requirement constraint");
        }
        if (priority == Priority.MUST) {
            return BindingDecision.binding(InvariantKind.REQUIREMENT, normalizedText,
                    "must-priority question with resolved answer");
        }
        return BindingDecision.notBinding(normalizedText, priority.wireValue() + "-priority is informational only");
    }

    String normalizedText(Clarification clarification) {
        String label = clarification.answerLabel();
        if (label != null && !label.isBlank()) {
            return label.strip();
        }
        return labelResolver.render(clarification.answer()).strip();
    }
}
