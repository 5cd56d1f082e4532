package com.boundgen.infrastructure.ai.validation.rules;

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
 * Rule group 8. Guardrails must trace to must/should answers or the original input.
 */
@Component
@RequiredArgsConstructor
public class GroundingCheck implements RuleGroupCheck {

    static final String RULE_ID = "GROUNDING-001";

    private static final double MATCH_THRESHOLD = 0.5;

    private final TextOverlapMatcher overlapMatcher;

    @Override
    public RuleGroup group() {
        return RuleGroup.GROUNDING;
    }

    @Override
    public RuleGroupOutcome evaluate(ValidationInput input, RuleGroupSettings settings) {
        List<LocatedItem> guardrails = input.document().located(DocumentSection.GUARDRAILS);
        if (guardrails.isEmpty()) {
            return RuleGroupOutcome.none();
        }

        List<Set<String>> sources = new ArrayList<>(AnswerSources.answerKeywords(
                overlapMatcher, input.clarifications().clarifications(), Set.of(Priority.MUST, Priority.SHOULD)));
        Set<String> inputKeywords = overlapMatcher.keywords(AnswerSources.inputText(input.task()));
        if (!inputKeywords.isEmpty()) {
            sources.add(inputKeywords);
        }

        List<Finding> findings = new ArrayList<>();
        for (LocatedItem guardrail : guardrails) {
            Set<String> keywords = overlapMatcher.keywords(guardrail.text());
            if (keywords.isEmpty()) {
                continue;
            }
            double best = 0.0;
            for (Set<String> source : sources) {
                best = Math.max(best, overlapMatcher.coverage(source, keywords));
            }
            if (best < MATCH_THRESHOLD) {
                findings.add(new Finding(RULE_ID, settings.severity(), guardrail.location(),
                        String.format("Guardrail appears inferred rather than stated in the input (best match %.2f)", best),
                        "Ground the guardrail in a user answer or drop it."));
            }
        }
        return RuleGroupOutcome.of(findings, settings);
    }
}
