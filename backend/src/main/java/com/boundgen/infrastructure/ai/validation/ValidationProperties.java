package com.boundgen.infrastructure.ai.validation;

import com.boundgen.domain.validation.model.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Overrides for the rule-group table, keyed by group key (e.g. {@code reopened-decision}).
 */
@Data
@ConfigurationProperties(prefix = "validation")
public class ValidationProperties {

    private Map<String, RuleGroupProperties> ruleGroups = new LinkedHashMap<>();

    @Data
    public static class RuleGroupProperties {
        private Boolean enabled;
        private Severity severity;
    }
}
