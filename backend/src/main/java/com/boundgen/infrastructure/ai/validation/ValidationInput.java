package com.boundgen.infrastructure.ai.validation;

import com.boundgen.domain.clarification.model.Invariant;
import com.boundgen.domain.clarification.model.MergedClarifications;
import com.boundgen.domain.document.model.DocumentItem;
import com.boundgen.domain.document.model.DocumentSection;
import com.boundgen.domain.document.model.GeneratedDocument;
import com.boundgen.domain.document.model.LocatedItem;
import com.boundgen.domain.generation.model.TaskParameters;

import java.util.List;

/**
 * Everything a rule group may look at for one attempt.
 *
 * @param clarifications merged clarification round
 * @param document       reconciled document
 * @param task           caller task parameters (input context, policy text)
 * @param schemaRef      resolved output schema reference
 * @param attempt        1-based attempt number
 */
public record ValidationInput(
        MergedClarifications clarifications,
        GeneratedDocument document,
        TaskParameters task,
        String schemaRef,
        int attempt
) {
    public List<Invariant> invariants() {
        return clarifications.invariants();
    }

    /**
     * True for a known constraint pinned by reconciliation: it names an invariant and carries
     * exactly that invariant's text. A pin marker on any other entry is not trusted.
     */
    public boolean isUserPinned(LocatedItem entry) {
        DocumentItem item = entry.item();
        if (entry.section() != DocumentSection.KNOWN_CONSTRAINTS || !item.isPinned()) {
            return false;
        }
        for (Invariant invariant : invariants()) {
            if (invariant.id().equals(item.constraintId())) {
                return invariant.normalizedText().equals(item.text());
            }
        }
        return false;
    }
}
