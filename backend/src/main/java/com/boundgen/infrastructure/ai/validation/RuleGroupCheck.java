package com.boundgen.infrastructure.ai.validation;

import com.boundgen.domain.validation.model.RuleGroup;
import com.boundgen.domain.validation.model.RuleGroupSettings;

/**
 * One rule group of the validation engine.
 */
public interface RuleGroupCheck {

    RuleGroup group();

    /**
     * @param settings enabled table row for this group; findings use its severity
     *                 unless the group reports its own
     */
    RuleGroupOutcome evaluate(ValidationInput input, RuleGroupSettings settings);
}
