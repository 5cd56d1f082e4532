package com.boundgen.infrastructure.ai.reconciliation;

import com.boundgen.domain.clarification.model.Invariant;
import com.boundgen.domain.document.model.DocumentItem;
import com.boundgen.domain.document.model.DocumentSection;
import com.boundgen.domain.document.model.GeneratedDocument;
import com.boundgen.infrastructure.ai.text.TextOverlapMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Drops recommendations and early decision points that mention an excluded topic.
 * Any shared canonical tag counts as a mention, which also removes entries that merely
 * restate the exclusion.
 */
@Slf4j
@Component
public class ExclusionFilter {

    private final TextOverlapMatcher overlapMatcher;
    private final int minOverlap;

    public ExclusionFilter(TextOverlapMatcher overlapMatcher,
                           @Value("${reconciliation.exclusion.min-overlap:1}") int minOverlap) {
        this.overlapMatcher = overlapMatcher;
        this.minOverlap = minOverlap;
    }

    public FilterResult filter(GeneratedDocument document, List<Invariant> invariants) {
        List<Invariant> exclusions = invariants.stream()
                .filter(Invariant::isExclusion)
                .filter(i -> !i.canonicalTags().isEmpty())
                .toList();
        if (exclusions.isEmpty()) {
            return new FilterResult(document, 0, 0);
        }

        List<DocumentItem> recommendations = retain(document.recommendations(), exclusions, DocumentSection.RECOMMENDATIONS);
        List<DocumentItem> decisionPoints = retain(document.earlyDecisionPoints(), exclusions, DocumentSection.EARLY_DECISION_POINTS);

        int recommendationsRemoved = document.recommendations().size() - recommendations.size();
        int decisionPointsRemoved = document.earlyDecisionPoints().size() - decisionPoints.size();

        GeneratedDocument filtered = document
                .withSection(DocumentSection.RECOMMENDATIONS, recommendations)
                .withSection(DocumentSection.EARLY_DECISION_POINTS, decisionPoints);
        return new FilterResult(filtered, recommendationsRemoved, decisionPointsRemoved);
    }

    private List<DocumentItem> retain(List<DocumentItem> items, List<Invariant> exclusions, DocumentSection section) {
        List<DocumentItem> kept = new ArrayList<>(items.size());
        for (DocumentItem item : items) {
            Invariant matched = firstMatch(item, exclusions);
            if (matched != null) {
                log.info("Removed {} entry mentioning excluded {}: \"{}\"", section.key(), matched.id(), item.text());
                continue;
            }
            kept.add(item);
        }
        return kept;
    }

    private Invariant firstMatch(DocumentItem item, List<Invariant> exclusions) {
        Set<String> itemKeywords = overlapMatcher.keywords(item.text());
        for (Invariant exclusion : exclusions) {
            if (overlapMatcher.overlap(itemKeywords, Set.copyOf(exclusion.canonicalTags())) >= minOverlap) {
                return exclusion;
            }
        }
        return null;
    }

    public record FilterResult(GeneratedDocument document, int recommendationsRemoved, int decisionPointsRemoved) {}
}
