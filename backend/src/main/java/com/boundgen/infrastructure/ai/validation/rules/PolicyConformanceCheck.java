package com.boundgen.infrastructure.ai.validation.rules;

import com.boundgen.domain.document.model.DocumentSection;
import com.boundgen.domain.document.model.LocatedItem;
import com.boundgen.domain.validation.model.Finding;
import com.boundgen.domain.validation.model.RuleGroup;
import com.boundgen.domain.validation.model.RuleGroupSettings;
import com.boundgen.infrastructure.ai.validation.RuleGroupCheck;
import com.boundgen.infrastructure.ai.validation.RuleGroupOutcome;
import com.boundgen.infrastructure.ai.validation.ValidationInput;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rule group 7. Open questions must not ask about budget or approval authority.
 * Reported at most once per category per entry.
 */
@Component
public class PolicyConformanceCheck implements RuleGroupCheck {

    static final String RULE_ID = "POLICY-001";

    static final Map<String, List<String>> PROHIBITED_TERMS = new LinkedHashMap<>();

    static {
        PROHIBITED_TERMS.put("budget", List.of("budget", "funding", "financial", "cost", "price", "expense", "money"));
        PROHIBITED_TERMS.put("authority", List.of("authority", "approval", "sign-off", "permission", "authorized", "approve"));
    }

    @Override
    public RuleGroup group() {
        return RuleGroup.POLICY_CONFORMANCE;
    }

    @Override
    public RuleGroupOutcome evaluate(ValidationInput input, RuleGroupSettings settings) {
        List<Finding> findings = new ArrayList<>();
        for (LocatedItem entry : input.document().located(DocumentSection.UNKNOWNS)) {
            String text = entry.text().toLowerCase(Locale.ROOT);
            for (Map.Entry<String, List<String>> category : PROHIBITED_TERMS.entrySet()) {
                category.getValue().stream()
                        .filter(text::contains)
                        .findFirst()
                        .ifPresent(term -> findings.add(new Finding(RULE_ID, settings.severity(), entry.location(),
                                "Contains prohibited " + category.getKey() + "-related term: '" + term + "'",
                                "Remove " + category.getKey() + " questions; they are out of scope for this document.")));
            }
        }
        return RuleGroupOutcome.of(findings, settings);
    }
}
