package com.boundgen.infrastructure.ai.validation.rules;

import com.boundgen.domain.clarification.model.Invariant;
import com.boundgen.domain.clarification.model.Priority;
import com.boundgen.domain.document.model.DocumentSection;
import com.boundgen.domain.document.model.LocatedItem;
import com.boundgen.domain.validation.model.Finding;
import com.boundgen.domain.validation.model.RuleGroup;
import com.boundgen.domain.validation.model.RuleGroupSettings;
import com.boundgen.infrastructure.ai.text.TextOverlapMatcher;
import com.boundgen.infrastructure.ai.validation.RuleGroupCheck;
import com.boundgen.infrastructure.ai.validation.RuleGroupOutcome;
import com.boundgen.infrastructure.ai.validation.ValidationInput;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rule group 5. Generator-authored constraints must trace to a must-priority answer,
 * a binding invariant or the user's input. A constraint matching only a should/could answer
 * was promoted without authority; one matching nothing is untraceable.
 */
@Component
@RequiredArgsConstructor
public class PromotionValidityCheck implements RuleGroupCheck {

    static final String UNTRACEABLE_RULE = "PROMOTION-001";
    static final String PROMOTED_RULE = "PROMOTION-002";

    private static final double MATCH_THRESHOLD = 0.5;

    private final TextOverlapMatcher overlapMatcher;

    @Override
    public RuleGroup group() {
        return RuleGroup.PROMOTION_VALIDITY;
    }

    @Override
    public RuleGroupOutcome evaluate(ValidationInput input, RuleGroupSettings settings) {
        List<Set<String>> validSources = new ArrayList<>(AnswerSources.answerKeywords(
                overlapMatcher, input.clarifications().clarifications(), Set.of(Priority.MUST)));
        for (Invariant invariant : input.invariants()) {
            validSources.add(overlapMatcher.keywords(invariant.normalizedText()));
        }
        Set<String> inputKeywords = overlapMatcher.keywords(AnswerSources.inputText(input.task()));
        if (!inputKeywords.isEmpty()) {
            validSources.add(inputKeywords);
        }
        List<Set<String>> optionalSources = AnswerSources.answerKeywords(
                overlapMatcher, input.clarifications().clarifications(), Set.of(Priority.SHOULD, Priority.COULD));

        List<Finding> findings = new ArrayList<>();
        for (LocatedItem entry : input.document().located(DocumentSection.KNOWN_CONSTRAINTS)) {
            if (input.isUserPinned(entry)) {
                continue;
            }
            Set<String> keywords = overlapMatcher.keywords(entry.text());
            if (keywords.isEmpty()) {
                continue;
            }

            double bestValid = bestMatch(validSources, keywords);
            if (bestValid >= MATCH_THRESHOLD) {
                continue;
            }
            double bestOptional = bestMatch(optionalSources, keywords);
            if (bestOptional >= MATCH_THRESHOLD) {
                findings.add(new Finding(PROMOTED_RULE, settings.severity(), entry.location(),
                        "Constraint appears derived from a should/could-priority answer ("
                                + percent(bestOptional) + "% match), not a must-priority one",
                        "Move it to assumptions or recommendations, or ask the user to make the question must-priority."));
            } else {
                findings.add(new Finding(UNTRACEABLE_RULE, settings.severity(), entry.location(),
                        "Constraint has no traceable source in the input or must-priority answers (best match "
                                + percent(Math.max(bestValid, bestOptional)) + "%)",
                        "Remove the constraint or restate it as an assumption."));
            }
        }
        return RuleGroupOutcome.of(findings, settings);
    }

    private double bestMatch(List<Set<String>> sources, Set<String> keywords) {
        double best = 0.0;
        for (Set<String> source : sources) {
            best = Math.max(best, overlapMatcher.coverage(source, keywords));
        }
        return best;
    }

    private static long percent(double ratio) {
        return Math.round(ratio * 100);
    }
}
