package com.boundgen.infrastructure.ai.validation;

import com.boundgen.domain.validation.model.RuleGroup;
import com.boundgen.domain.validation.model.RuleGroupSettings;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Rule group id to enablement and severity. Defaults come from {@link RuleGroup},
 * deployments override single rows.
 */
public final class RuleGroupTable {

    private final Map<RuleGroup, RuleGroupSettings> rows;

    private RuleGroupTable(Map<RuleGroup, RuleGroupSettings> rows) {
        this.rows = Collections.unmodifiableMap(new EnumMap<>(rows));
    }

    public static RuleGroupTable defaults() {
        Map<RuleGroup, RuleGroupSettings> rows = new EnumMap<>(RuleGroup.class);
        for (RuleGroup group : RuleGroup.values()) {
            rows.put(group, group.defaults());
        }
        return new RuleGroupTable(rows);
    }

    public static RuleGroupTable from(ValidationProperties properties) {
        RuleGroupTable table = defaults();
        for (Map.Entry<String, ValidationProperties.RuleGroupProperties> entry : properties.getRuleGroups().entrySet()) {
            RuleGroup group = RuleGroup.fromKey(entry.getKey());
            RuleGroupSettings settings = table.settings(group);
            ValidationProperties.RuleGroupProperties override = entry.getValue();
            if (override.getEnabled() != null) {
                settings = settings.withEnabled(override.getEnabled());
            }
            if (override.getSeverity() != null) {
                settings = settings.withSeverity(override.getSeverity());
            }
            table = table.with(group, settings);
        }
        return table;
    }

    public RuleGroupTable with(RuleGroup group, RuleGroupSettings settings) {
        Map<RuleGroup, RuleGroupSettings> copy = new EnumMap<>(rows);
        copy.put(group, settings);
        return new RuleGroupTable(copy);
    }

    public RuleGroupTable enable(RuleGroup group) {
        return with(group, settings(group).withEnabled(true));
    }

    public RuleGroupTable disable(RuleGroup group) {
        return with(group, settings(group).withEnabled(false));
    }

    public RuleGroupSettings settings(RuleGroup group) {
        return rows.get(group);
    }

    public boolean isEnabled(RuleGroup group) {
        return rows.get(group).enabled();
    }
}
