package com.boundgen.infrastructure.ai.validation.rules;

import com.boundgen.domain.clarification.model.Invariant;
import com.boundgen.domain.document.model.DocumentItem;
import com.boundgen.domain.validation.model.Finding;
import com.boundgen.domain.validation.model.RuleGroup;
import com.boundgen.domain.validation.model.RuleGroupSettings;
import com.boundgen.infrastructure.ai.validation.RuleGroupCheck;
import com.boundgen.infrastructure.ai.validation.RuleGroupOutcome;
import com.boundgen.infrastructure.ai.validation.ValidationInput;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rule group 4. Each invariant must be traceable in known_constraints, by constraint id link,
 * id mention or normalized text.
 */
@Component
public class TraceabilityCheck implements RuleGroupCheck {

    static final String RULE_ID = "TRACEABILITY-001";

    @Override
    public RuleGroup group() {
        return RuleGroup.TRACEABILITY;
    }

    @Override
    public RuleGroupOutcome evaluate(ValidationInput input, RuleGroupSettings settings) {
        List<DocumentItem> constraints = input.document().knownConstraints();
        List<Finding> findings = new ArrayList<>();

        for (Invariant invariant : input.invariants()) {
            if (constraints.isEmpty()) {
                findings.add(new Finding(RULE_ID, settings.severity(), "/known_constraints",
                        "Bound constraint " + invariant.id() + " not traceable, known_constraints is empty",
                        "Add a known_constraints section with the bound constraints."));
            } else if (!isTraceable(invariant, constraints)) {
                findings.add(new Finding(RULE_ID, settings.severity(), "/known_constraints",
                        "Bound constraint " + invariant.id() + " (" + invariant.normalizedText() + ") not found in known_constraints",
                        "Add this constraint to known_constraints for traceability."));
            }
        }
        return RuleGroupOutcome.of(findings, settings);
    }

    private boolean isTraceable(Invariant invariant, List<DocumentItem> constraints) {
        String id = invariant.id().toLowerCase(Locale.ROOT);
        String text = invariant.normalizedText().toLowerCase(Locale.ROOT);
        for (DocumentItem item : constraints) {
            if (invariant.id().equals(item.constraintId())) {
                return true;
            }
            String itemText = item.text().toLowerCase(Locale.ROOT);
            if (itemText.contains(id) || itemText.contains(text)) {
                return true;
            }
        }
        return false;
    }
}
