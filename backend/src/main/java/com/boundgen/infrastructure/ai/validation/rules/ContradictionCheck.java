package com.boundgen.infrastructure.ai.validation.rules;

import com.boundgen.domain.clarification.model.AnswerType;
import com.boundgen.domain.clarification.model.Choice;
import com.boundgen.domain.clarification.model.Clarification;
import com.boundgen.domain.clarification.model.ConstraintKind;
import com.boundgen.domain.clarification.model.Invariant;
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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rule group 1. Flags entries that affirm an excluded value, and entries that assert a
 * non-selected choice as the chosen one. Pinned entries are the user's own words and skipped.
 */
@Component
@RequiredArgsConstructor
public class ContradictionCheck implements RuleGroupCheck {

    static final String EXCLUSION_RULE = "CONTRADICTION-001";
    static final String SELECTION_RULE = "CONTRADICTION-002";

    private static final String AFFIRMING_VERBS =
            "(?:recommend(?:s|ed|ing)?|use[sd]?|using|include[sd]?|including|adopt(?:s|ed|ing)?)";
    private static final String SELECTION_ASSERTIONS = "(?:platform is|using|selected|chose|chosen)";
    private static final String ARTICLE = "(?:the\\s+|a\\s+|an\\s+|some\\s+)?";

    private final TextOverlapMatcher overlapMatcher;

    @Override
    public RuleGroup group() {
        return RuleGroup.CONTRADICTION;
    }

    @Override
    public RuleGroupOutcome evaluate(ValidationInput input, RuleGroupSettings settings) {
        List<LocatedItem> entries = input.document().located().stream()
                .filter(e -> !input.isUserPinned(e))
                .toList();
        List<Finding> findings = new ArrayList<>();

        for (Invariant invariant : input.invariants()) {
            if (invariant.isExclusion()) {
                checkExclusion(invariant, entries, settings, findings);
            } else if (isSelection(invariant.clarification())) {
                checkSelection(invariant, entries, settings, findings);
            }
        }
        return RuleGroupOutcome.of(findings, settings);
    }

    private void checkExclusion(Invariant invariant, List<LocatedItem> entries,
                                RuleGroupSettings settings, List<Finding> findings) {
        List<TermPattern> patterns = excludedTerms(invariant).stream()
                .map(term -> new TermPattern(term, affirmationPattern(AFFIRMING_VERBS, term)))
                .toList();
        for (LocatedItem entry : entries) {
            for (TermPattern pattern : patterns) {
                if (pattern.regex().matcher(entry.text()).find()) {
                    findings.add(new Finding(EXCLUSION_RULE, settings.severity(), entry.location(),
                            "Entry affirms '" + pattern.term() + "' which " + invariant.id() + " excluded",
                            "Remove the reference to '" + pattern.term() + "' and respect the user's exclusion."));
                    break;
                }
            }
        }
    }

    private void checkSelection(Invariant invariant, List<LocatedItem> entries,
                                RuleGroupSettings settings, List<Finding> findings) {
        Clarification clarification = invariant.clarification();
        String selectedValue = clarification.answer() == null ? "" : clarification.answer().toString().toLowerCase(Locale.ROOT);
        String selectedLabel = invariant.normalizedText().toLowerCase(Locale.ROOT);

        Set<String> others = new LinkedHashSet<>();
        for (Choice choice : clarification.choices()) {
            String id = choice.id() == null ? "" : choice.id().toLowerCase(Locale.ROOT);
            String label = choice.label() == null ? "" : choice.label().toLowerCase(Locale.ROOT);
            if (id.equals(selectedValue) || label.equals(selectedLabel)) {
                continue;
            }
            if (!id.isBlank()) {
                others.add(id);
            }
            if (!label.isBlank()) {
                others.add(label);
            }
        }

        List<TermPattern> patterns = others.stream()
                .map(term -> new TermPattern(term, affirmationPattern(SELECTION_ASSERTIONS, term)))
                .toList();
        for (LocatedItem entry : entries) {
            for (TermPattern pattern : patterns) {
                if (pattern.regex().matcher(entry.text()).find()) {
                    findings.add(new Finding(SELECTION_RULE, settings.severity(), entry.location(),
                            "Entry states '" + pattern.term() + "' but the user selected '" + invariant.normalizedText() + "'",
                            "Correct the entry to reflect the user's selection: " + invariant.normalizedText()));
                    break;
                }
            }
        }
    }

    /** The excluded label when it carries keywords, plus the canonical tags. */
    private Set<String> excludedTerms(Invariant invariant) {
        Set<String> terms = new LinkedHashSet<>();
        if (!overlapMatcher.keywords(invariant.normalizedText()).isEmpty()) {
            terms.add(invariant.normalizedText().toLowerCase(Locale.ROOT));
        }
        terms.addAll(invariant.canonicalTags());
        return terms;
    }

    private static boolean isSelection(Clarification clarification) {
        if (clarification == null || !clarification.hasChoices()) {
            return false;
        }
        return clarification.constraintKind() == ConstraintKind.SELECTION
                || clarification.answerType() == AnswerType.SINGLE_CHOICE;
    }

    private static Pattern affirmationPattern(String verbs, String term) {
        return Pattern.compile("\\b" + verbs + "\\s+" + ARTICLE + Pattern.quote(term) + "s?\\b",
                Pattern.CASE_INSENSITIVE);
    }

    private record TermPattern(String term, Pattern regex) {}
}
