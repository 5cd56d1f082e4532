package com.boundgen.infrastructure.ai.text;

import java.util.Set;

/**
 * Token-overlap heuristics shared by reconciliation and validation.
 * <p>
 * The keyword implementation is known to produce false positives (restatements look like
 * recommendations) and false negatives (paraphrases share no tokens). Callers rely on that
 * exact behavior; a semantic implementation can replace it without touching them.
 * </p>
 */
public interface TextOverlapMatcher {

    /** Ordered keyword set of a text; empty for null or blank input. */
    Set<String> keywords(String text);

    /** Number of keywords both sets share. */
    int overlap(Set<String> a, Set<String> b);

    /** |a ∩ b| / |a ∪ b|, 0 when both are empty. */
    double jaccard(Set<String> a, Set<String> b);

    /** Fraction of target keywords found in source, 0 when target is empty. */
    double coverage(Set<String> source, Set<String> target);

    default int overlap(String a, String b) {
        return overlap(keywords(a), keywords(b));
    }
}
