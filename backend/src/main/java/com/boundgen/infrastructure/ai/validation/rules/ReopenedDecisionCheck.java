package com.boundgen.infrastructure.ai.validation.rules;

import com.boundgen.domain.clarification.model.Invariant;
import com.boundgen.domain.document.model.DocumentSection;
import com.boundgen.domain.document.model.LocatedItem;
import com.boundgen.domain.validation.model.Finding;
import com.boundgen.domain.validation.model.RuleGroup;
import com.boundgen.domain.validation.model.RuleGroupSettings;
import com.boundgen.infrastructure.ai.text.TextOverlapMatcher;
import com.boundgen.infrastructure.ai.validation.RuleGroupCheck;
import com.boundgen.infrastructure.ai.validation.RuleGroupOutcome;
import com.boundgen.infrastructure.ai.validation.ValidationInput;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rule group 2. An open question sharing a canonical tag with an invariant is reported as
 * reopening it. Keyword overlap cannot tell a follow-up from a reopened decision, so the
 * group ships disabled.
 */
@Component
public class ReopenedDecisionCheck implements RuleGroupCheck {

    static final String RULE_ID = "REOPENED-001";

    private final TextOverlapMatcher overlapMatcher;
    private final int minOverlap;

    public ReopenedDecisionCheck(TextOverlapMatcher overlapMatcher,
                                 @Value("${validation.reopened-decision.min-overlap:1}") int minOverlap) {
        this.overlapMatcher = overlapMatcher;
        this.minOverlap = minOverlap;
    }

    @Override
    public RuleGroup group() {
        return RuleGroup.REOPENED_DECISION;
    }

    @Override
    public RuleGroupOutcome evaluate(ValidationInput input, RuleGroupSettings settings) {
        List<Finding> findings = new ArrayList<>();
        for (LocatedItem entry : input.document().located(DocumentSection.UNKNOWNS)) {
            Set<String> keywords = overlapMatcher.keywords(entry.text());
            for (Invariant invariant : input.invariants()) {
                if (overlapMatcher.overlap(keywords, Set.copyOf(invariant.canonicalTags())) >= minOverlap) {
                    findings.add(new Finding(RULE_ID, settings.severity(), entry.location(),
                            "Open question reopens " + invariant.id() + " (" + invariant.normalizedText() + ")",
                            "Remove the question or rephrase it as a follow-up that keeps the decision."));
                    break;
                }
            }
        }
        return RuleGroupOutcome.of(findings, settings);
    }
}
