package com.boundgen.domain.validation.model;

import com.boundgen.domain.clarification.model.AnswerType;
import com.boundgen.domain.execution.model.AttemptState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("wire values under a Turkish default locale")
class WireValueLocaleTest {

    private Locale previous;

    @BeforeEach
    void setUp() {
        previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(previous);
    }

    @Test
    void enumNamesWithDottedIStayAscii() {
        assertThat(AttemptState.BUILDING_CONTEXT.wireValue()).isEqualTo("building_context");
        assertThat(Outcome.FAILED.wireValue()).isEqualTo("failed");
    }

    @Test
    void wireValuesParseBack() {
        assertThat(Severity.fromWire("warning")).isEqualTo(Severity.WARNING);
        assertThat(AnswerType.fromWire("single_choice")).isEqualTo(AnswerType.SINGLE_CHOICE);
    }

    @Test
    void ruleGroupKeysResolveFromEnumStyleNames() {
        assertThat(RuleGroup.fromKey("POLICY_CONFORMANCE")).isEqualTo(RuleGroup.POLICY_CONFORMANCE);
        assertThat(RuleGroup.fromKey("INTERNAL_CONTRADICTION")).isEqualTo(RuleGroup.INTERNAL_CONTRADICTION);
    }
}
