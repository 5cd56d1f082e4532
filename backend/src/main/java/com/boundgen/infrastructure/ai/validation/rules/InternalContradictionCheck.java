package com.boundgen.infrastructure.ai.validation.rules;

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
 * Rule group 6. The same concept must not be both a known constraint and an assumption.
 */
@Component
@RequiredArgsConstructor
public class InternalContradictionCheck implements RuleGroupCheck {

    static final String RULE_ID = "INTERNAL-CONTRADICTION-001";

    private static final double SIMILARITY_THRESHOLD = 0.5;

    private final TextOverlapMatcher overlapMatcher;

    @Override
    public RuleGroup group() {
        return RuleGroup.INTERNAL_CONTRADICTION;
    }

    @Override
    public RuleGroupOutcome evaluate(ValidationInput input, RuleGroupSettings settings) {
        List<LocatedItem> assumptions = input.document().located(DocumentSection.ASSUMPTIONS);
        List<Finding> findings = new ArrayList<>();

        for (LocatedItem constraint : input.document().located(DocumentSection.KNOWN_CONSTRAINTS)) {
            Set<String> constraintKeywords = overlapMatcher.keywords(constraint.text());
            for (LocatedItem assumption : assumptions) {
                double similarity = overlapMatcher.jaccard(constraintKeywords, overlapMatcher.keywords(assumption.text()));
                if (similarity > SIMILARITY_THRESHOLD) {
                    findings.add(new Finding(RULE_ID, settings.severity(), constraint.location(),
                            String.format("Same concept appears as constraint and as assumption %s (similarity %.2f)",
                                    assumption.location(), similarity),
                            "Keep \"" + constraint.text() + "\" as a constraint and drop the matching assumption."));
                }
            }
        }
        return RuleGroupOutcome.of(findings, settings);
    }
}
