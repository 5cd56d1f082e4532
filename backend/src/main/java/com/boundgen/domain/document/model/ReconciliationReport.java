package com.boundgen.domain.document.model;

/**
 * Counts from one reconciliation run, kept for audit and logging.
 *
 * @param pinned                 canonical entries present after pinning (one per invariant)
 * @param duplicatesRemoved      generator entries removed as duplicates of an invariant
 * @param kept                   generator entries that survived pinning
 * @param recommendationsRemoved recommendations removed by exclusion filtering
 * @param decisionPointsRemoved  early decision points removed by exclusion filtering
 */
public record ReconciliationReport(
        int pinned,
        int duplicatesRemoved,
        int kept,
        int recommendationsRemoved,
        int decisionPointsRemoved
) {
    public static ReconciliationReport empty() {
        return new ReconciliationReport(0, 0, 0, 0, 0);
    }
}
