package com.boundgen.infrastructure.ai.validation.rules;

import com.boundgen.domain.clarification.model.Invariant;
import com.boundgen.domain.document.model.DocumentItem;
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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rule group 3. Each invariant's text, or enough of its keywords, must appear in known_constraints.
 */
@Component
@RequiredArgsConstructor
public class ConstraintStatedCheck implements RuleGroupCheck {

    static final String RULE_ID = "CONSTRAINT-STATED-001";

    private static final int REQUIRED_OVERLAP = 2;

    private final TextOverlapMatcher overlapMatcher;

    @Override
    public RuleGroup group() {
        return RuleGroup.CONSTRAINT_STATED;
    }

    @Override
    public RuleGroupOutcome evaluate(ValidationInput input, RuleGroupSettings settings) {
        String constraintsText = input.document().knownConstraints().stream()
                .map(DocumentItem::text)
                .collect(Collectors.joining("\n"))
                .toLowerCase(Locale.ROOT);
        Set<String> constraintKeywords = overlapMatcher.keywords(constraintsText);

        List<Finding> findings = new ArrayList<>();
        for (Invariant invariant : input.invariants()) {
            if (isStated(invariant, constraintsText, constraintKeywords)) {
                continue;
            }
            findings.add(new Finding(RULE_ID, settings.severity(), "/known_constraints",
                    "Bound constraint " + invariant.id() + " (" + invariant.normalizedText() + ") is not stated",
                    "State this constraint in known_constraints."));
        }
        return RuleGroupOutcome.of(findings, settings);
    }

    private boolean isStated(Invariant invariant, String constraintsText, Set<String> constraintKeywords) {
        if (constraintsText.contains(invariant.normalizedText().toLowerCase(Locale.ROOT))) {
            return true;
        }
        Set<String> keywords = new LinkedHashSet<>(overlapMatcher.keywords(invariant.normalizedText()));
        keywords.addAll(invariant.canonicalTags());
        if (keywords.isEmpty()) {
            return false;
        }
        int required = Math.min(REQUIRED_OVERLAP, keywords.size());
        return overlapMatcher.overlap(keywords, constraintKeywords) >= required;
    }
}
