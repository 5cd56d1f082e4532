package com.boundgen.infrastructure.ai.clarification;

import com.boundgen.domain.clarification.model.AnswerType;
import com.boundgen.domain.clarification.model.Choice;
import com.boundgen.domain.clarification.model.Clarification;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Derives the resolved flag and the human-readable label of an answer
 * when the caller did not supply them.
 */
@Component
public class AnswerLabelResolver {

    private static final String UNDECIDED = "undecided";

    /**
     * Null, blank, "undecided" and empty collections are unresolved; everything else resolves.
     */
    public boolean isResolved(Object answer) {
        if (answer == null) {
            return false;
        }
        if (answer instanceof String text) {
            String normalized = text.strip().toLowerCase(Locale.ROOT);
            return !normalized.isEmpty() && !UNDECIDED.equals(normalized);
        }
        if (answer instanceof Collection<?> list) {
            return !list.isEmpty();
        }
        return true;
    }

    /**
     * Label for an answer. Choice ids map to their labels, yes/no booleans to Yes/No,
     * anything else is rendered as text. Returns null for a null answer.
     */
    public String label(AnswerType answerType, List<Choice> choices, Object answer) {
        if (answer == null) {
            return null;
        }
        AnswerType type = answerType == null ? AnswerType.FREE_TEXT : answerType;
        Map<String, String> labels = choices.stream()
                .filter(c -> c.id() != null)
                .collect(Collectors.toMap(Choice::id, c -> c.label() == null ? c.id() : c.label(),
                        (first, second) -> first));

        return switch (type) {
            case SINGLE_CHOICE -> labels.isEmpty() ? render(answer) : labels.getOrDefault(render(answer), render(answer));
            case MULTI_CHOICE -> answer instanceof Collection<?> selected && !labels.isEmpty()
                    ? joinSelected(selected, id -> labels.getOrDefault(id, id))
                    : render(answer);
            case YES_NO, FREE_TEXT -> render(answer);
        };
    }

    /**
     * Fills in {@code resolved} and {@code answerLabel} from the answer.
     *
     * @param resolvedOverride caller-stated resolved flag, or null to derive it
     */
    public Clarification complete(Clarification clarification, Boolean resolvedOverride) {
        boolean resolved = resolvedOverride != null ? resolvedOverride : isResolved(clarification.answer());
        String label = clarification.answerLabel();
        if (label == null || label.isBlank()) {
            label = label(clarification.answerType(), clarification.choices(), clarification.answer());
        }
        return clarification.toBuilder()
                .resolved(resolved)
                .answerLabel(label)
                .build();
    }

    /** Booleans become Yes/No, lists are joined with ", ", other values stringified. */
    public String render(Object answer) {
        if (answer == null) {
            return "";
        }
        if (answer instanceof Boolean flag) {
            return flag ? "Yes" : "No";
        }
        if (answer instanceof Collection<?> list) {
            return joinSelected(list, Function.identity());
        }
        return answer.toString();
    }

    private String joinSelected(Collection<?> selected, Function<String, String> mapper) {
        return selected.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .map(mapper)
                .collect(Collectors.joining(", "));
    }
}
