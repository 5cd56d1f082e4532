package com.boundgen.infrastructure.ai.reconciliation;

import com.boundgen.domain.clarification.model.Invariant;
import com.boundgen.domain.document.model.DocumentSection;
import com.boundgen.domain.document.model.GeneratedDocument;
import com.boundgen.domain.document.model.ReconciliationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Post-generation reconciliation: pinning, then exclusion filtering.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationStage {

    private final InvariantPinner invariantPinner;
    private final ExclusionFilter exclusionFilter;

    public ReconciledDocument reconcile(GeneratedDocument document, List<Invariant> invariants) {
        InvariantPinner.PinningResult pinning = invariantPinner.pin(document.knownConstraints(), invariants);
        GeneratedDocument pinned = document.withSection(DocumentSection.KNOWN_CONSTRAINTS, pinning.items());

        ExclusionFilter.FilterResult filtering = exclusionFilter.filter(pinned, invariants);

        ReconciliationReport report = new ReconciliationReport(
                pinning.pinned(),
                pinning.duplicatesRemoved(),
                pinning.kept(),
                filtering.recommendationsRemoved(),
                filtering.decisionPointsRemoved());

        log.info("Reconciliation - pinned: {}, duplicatesRemoved: {}, kept: {}, recommendationsRemoved: {}, decisionPointsRemoved: {}",
                report.pinned(), report.duplicatesRemoved(), report.kept(),
                report.recommendationsRemoved(), report.decisionPointsRemoved());
        return new ReconciledDocument(filtering.document(), report);
    }

    public record ReconciledDocument(GeneratedDocument document, ReconciliationReport report) {}
}
