package com.boundgen.infrastructure.ai.context;

import com.boundgen.domain.clarification.exception.MalformedClarificationException;
import com.boundgen.domain.clarification.model.Invariant;
import com.boundgen.domain.generation.model.GenerationRequest;
import com.boundgen.domain.generation.model.TaskParameters;
import com.boundgen.domain.validation.model.Finding;
import com.boundgen.domain.validation.model.QaFeedbackRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders the generation request. Pure rendering, section order is fixed:
 * user request, bound constraints, previous QA feedback, extracted context, task.
 */
@Slf4j
@Component
public class ContextBuilder {

    static final String BOUND_CONSTRAINTS_HEADER = "## Bound Constraints (FINAL - DO NOT REOPEN)";
    static final String QA_FEEDBACK_HEADER = "## Previous QA Feedback (MUST ADDRESS)";
    static final String EXTRACTED_CONTEXT_HEADER = "## Extracted Context";
    static final String TASK_HEADER = "## Task";
    static final String USER_REQUEST_HEADER = "## User Request";

    static final String DEFAULT_SYSTEM_PROMPT = """
            You are a technical analyst producing a structured discovery document.

            ## Rules
            1. Bound constraints are final decisions made by the user. Restate them; never question, reopen or contradict them.
            2. Never recommend or plan around anything a bound constraint excludes.
            3. Do not turn optional preferences into constraints.
            4. Open questions must not ask about budget, funding or approval authority.
            5. If previous QA feedback is present, fix every listed issue.

            ## Output
            Respond with a single JSON object with these array fields:
            known_constraints, assumptions, recommendations, unknowns, early_decision_points, guardrails.
            Each entry is an object with "id" and "text".
            """;

    private final ObjectMapper objectMapper;

    public ContextBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public GenerationRequest build(List<Invariant> invariants,
                                   QaFeedbackRecord feedback,
                                   TaskParameters task,
                                   String schemaRef) {
        StringBuilder sb = new StringBuilder();

        if (task.userInput() != null && !task.userInput().isBlank()) {
            sb.append(USER_REQUEST_HEADER).append("\n");
            sb.append(task.userInput().strip()).append("\n\n");
        }

        appendBoundConstraints(sb, invariants);
        appendFeedback(sb, feedback);

        sb.append(EXTRACTED_CONTEXT_HEADER).append("\n");
        sb.append(toJson(task)).append("\n\n");

        sb.append(TASK_HEADER).append("\n");
        if (task.taskPrompt() != null && !task.taskPrompt().isBlank()) {
            sb.append(task.taskPrompt().strip()).append("\n");
        }
        sb.append("Output schema: ").append(schemaRef);

        String systemPrompt = task.systemPrompt() != null && !task.systemPrompt().isBlank()
                ? task.systemPrompt()
                : DEFAULT_SYSTEM_PROMPT;

        log.info("Context built - invariants: {}, feedbackFindings: {}, userMessage: {} chars",
                invariants.size(), feedback == null ? 0 : feedback.findings().size(), sb.length());
        return new GenerationRequest(systemPrompt, sb.toString(), schemaRef);
    }

    private void appendBoundConstraints(StringBuilder sb, List<Invariant> invariants) {
        if (invariants.isEmpty()) {
            return;
        }
        sb.append(BOUND_CONSTRAINTS_HEADER).append("\n");
        sb.append("These decisions were made by the user and are binding.\n");
        for (Invariant invariant : invariants) {
            if (invariant.normalizedText() == null || invariant.normalizedText().isBlank()) {
                throw new MalformedClarificationException(invariant.id(),
                        "Invariant " + invariant.id() + " has no normalized text");
            }
            sb.append("- ").append(invariant.id())
                    .append(" [").append(invariant.invariantKind().wireValue()).append("]: ")
                    .append(invariant.normalizedText());
            if (invariant.isExclusion()) {
                sb.append(" (EXCLUDED - do not suggest)");
            }
            sb.append("\n");
        }
        sb.append("\n");
    }

    private void appendFeedback(StringBuilder sb, QaFeedbackRecord feedback) {
        if (feedback == null || feedback.isEmpty()) {
            return;
        }
        sb.append(QA_FEEDBACK_HEADER).append("\n");
        sb.append("Attempt ").append(feedback.sourceAttempt())
                .append(" failed validation. Fix these issues:\n");
        int index = 1;
        for (Finding finding : feedback.findings()) {
            sb.append(index++).append(". [").append(finding.ruleId()).append("]");
            if (finding.location() != null && !finding.location().isEmpty()) {
                sb.append(" (").append(finding.location()).append(")");
            }
            sb.append(" ").append(finding.message()).append("\n");
            if (finding.remediation() != null && !finding.remediation().isBlank()) {
                sb.append("   -> Fix: ").append(finding.remediation()).append("\n");
            }
        }
        sb.append("\n");
    }

    private String toJson(TaskParameters task) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(task.extractedContext());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Extracted context is not serializable", e);
        }
    }
}
