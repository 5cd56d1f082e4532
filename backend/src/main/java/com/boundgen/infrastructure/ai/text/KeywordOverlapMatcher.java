package com.boundgen.infrastructure.ai.text;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword tokenizer: lowercase alphanumeric tokens, stopwords and tokens shorter than
 * three characters dropped, simple plural folding.
 */
@Component
public class KeywordOverlapMatcher implements TextOverlapMatcher {

    private static final Pattern TOKEN_PATTERN = Pattern.compile("[a-z0-9]+");

    private static final int MIN_TOKEN_LENGTH = 3;

    static final Set<String> STOPWORDS = Set.of(
            "a", "an", "the", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "from", "as", "is", "was", "are", "were", "been",
            "be", "have", "has", "had", "do", "does", "did", "will", "would",
            "could", "should", "may", "might", "must", "shall", "can", "need",
            "it", "its", "this", "that", "these", "those", "i", "you", "he",
            "she", "we", "they", "what", "which", "who", "whom", "where", "when",
            "why", "how", "all", "each", "every", "both", "few", "more", "most",
            "other", "some", "such", "no", "not", "only", "same", "so", "than",
            "too", "very", "just", "also", "now", "here", "there", "then",
            "if", "else", "because", "about", "into", "through", "during",
            "before", "after", "above", "below", "between", "under", "again",
            "further", "once", "any", "our", "your", "their", "his", "her",
            // filler nouns that carry no decision content
            "app", "etc", "via", "per"
    );

    @Override
    public Set<String> keywords(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        Set<String> keywords = new LinkedHashSet<>();
        Matcher matcher = TOKEN_PATTERN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            if (token.length() < MIN_TOKEN_LENGTH || STOPWORDS.contains(token)) {
                continue;
            }
            keywords.add(foldPlural(token));
        }
        return Collections.unmodifiableSet(keywords);
    }

    @Override
    public int overlap(Set<String> a, Set<String> b) {
        int count = 0;
        for (String token : a) {
            if (b.contains(token)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public double jaccard(Set<String> a, Set<String> b) {
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) {
            return 0.0;
        }
        return (double) overlap(a, b) / union.size();
    }

    @Override
    public double coverage(Set<String> source, Set<String> target) {
        if (target.isEmpty()) {
            return 0.0;
        }
        return (double) overlap(target, source) / target.size();
    }

    static String foldPlural(String token) {
        if (token.length() > 4 && token.endsWith("s")
                && !token.endsWith("ss") && !token.endsWith("us") && !token.endsWith("is")) {
            return token.substring(0, token.length() - 1);
        }
        return token;
    }
}
