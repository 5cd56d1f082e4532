package com.boundgen.infrastructure.ai.reconciliation;

import com.boundgen.domain.clarification.model.Invariant;
import com.boundgen.domain.document.model.DocumentItem;
import com.boundgen.infrastructure.ai.text.TextOverlapMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pins every invariant into known_constraints.
 * <p>
 * Output order: one canonical entry per invariant (invariant order), then the
 * generator-authored entries that overlap no invariant (original order). Generator entries
 * sharing at least {@code overlapThreshold} keywords with an invariant are dropped as duplicates.
 * Entries already pinned for a known invariant are rebuilt, so a second run changes nothing.
 * </p>
 */
@Slf4j
@Component
public class InvariantPinner {

    private final TextOverlapMatcher overlapMatcher;
    private final int overlapThreshold;
    private final boolean deduplicate;

    public InvariantPinner(TextOverlapMatcher overlapMatcher,
                           @Value("${reconciliation.pinning.overlap-threshold:2}") int overlapThreshold,
                           @Value("${reconciliation.pinning.deduplicate:true}") boolean deduplicate) {
        this.overlapMatcher = overlapMatcher;
        this.overlapThreshold = overlapThreshold;
        this.deduplicate = deduplicate;
    }

    public PinningResult pin(List<DocumentItem> knownConstraints, List<Invariant> invariants) {
        Set<String> invariantIds = new HashSet<>();
        List<Set<String>> invariantKeywords = new ArrayList<>(invariants.size());
        for (Invariant invariant : invariants) {
            invariantIds.add(invariant.id());
            invariantKeywords.add(keywordsOf(invariant));
        }

        List<DocumentItem> survivors = new ArrayList<>();
        int duplicatesRemoved = 0;
        for (DocumentItem item : knownConstraints) {
            if (item.isPinned() && invariantIds.contains(item.constraintId())) {
                continue;
            }
            if (deduplicate && duplicatesAny(item, invariantKeywords)) {
                duplicatesRemoved++;
                log.debug("Dropping generator constraint as duplicate: \"{}\"", item.text());
                continue;
            }
            survivors.add(item);
        }

        List<DocumentItem> result = new ArrayList<>(invariants.size() + survivors.size());
        for (Invariant invariant : invariants) {
            result.add(DocumentItem.pinned(invariant.id(), invariant.normalizedText()));
        }
        result.addAll(survivors);

        return new PinningResult(List.copyOf(result), invariants.size(), duplicatesRemoved, survivors.size());
    }

    private boolean duplicatesAny(DocumentItem item, List<Set<String>> invariantKeywords) {
        Set<String> itemKeywords = overlapMatcher.keywords(item.text());
        for (Set<String> keywords : invariantKeywords) {
            if (overlapMatcher.overlap(itemKeywords, keywords) >= overlapThreshold) {
                return true;
            }
        }
        return false;
    }

    private Set<String> keywordsOf(Invariant invariant) {
        Set<String> keywords = new LinkedHashSet<>(overlapMatcher.keywords(invariant.normalizedText()));
        keywords.addAll(invariant.canonicalTags());
        return keywords;
    }

    public record PinningResult(List<DocumentItem> items, int pinned, int duplicatesRemoved, int kept) {}
}
