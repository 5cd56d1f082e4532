package com.boundgen.infrastructure.ai.validation.rules;

import com.boundgen.domain.clarification.model.Clarification;
import com.boundgen.domain.clarification.model.MergedClarification;
import com.boundgen.domain.clarification.model.Priority;
import com.boundgen.domain.generation.model.TaskParameters;
import com.boundgen.infrastructure.ai.text.TextOverlapMatcher;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keyword sources used to judge whether document statements trace back to input.
 */
final class AnswerSources {

    private AnswerSources() {
    }

    /** Keywords of question text plus answer label, for resolved answers of the given priorities. */
    static List<Set<String>> answerKeywords(TextOverlapMatcher matcher,
                                            List<MergedClarification> clarifications,
                                            Set<Priority> priorities) {
        return clarifications.stream()
                .map(MergedClarification::clarification)
                .filter(Clarification::resolved)
                .filter(c -> c.priority() != null && priorities.contains(c.priority()))
                .map(c -> matcher.keywords(answerText(c)))
                .toList();
    }

    static String answerText(Clarification clarification) {
        String question = clarification.questionText() == null ? "" : clarification.questionText();
        // a bare yes/no carries no topic of its own
        if (clarification.answer() instanceof Boolean) {
            return question;
        }
        String answer = clarification.answerLabel() != null
                ? clarification.answerLabel()
                : String.valueOf(clarification.answer());
        return question + " " + answer;
    }

    /** Raw user input plus every scalar of the extracted context. */
    static String inputText(TaskParameters task) {
        StringBuilder sb = new StringBuilder();
        if (task.userInput() != null) {
            sb.append(task.userInput());
        }
        appendValues(sb, task.extractedContext());
        return sb.toString();
    }

    private static void appendValues(StringBuilder sb, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            map.values().forEach(v -> appendValues(sb, v));
        } else if (value instanceof Collection<?> list) {
            list.forEach(v -> appendValues(sb, v));
        } else {
            sb.append(' ').append(value);
        }
    }
}
