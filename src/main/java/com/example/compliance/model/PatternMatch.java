package com.example.compliance.model;

import java.util.List;

/**
 * Patterns of a rule that matched a text, in catalog order.
 * A pattern appears at most once no matter how often it occurs in the text.
 *
 * @param matchedPatterns Source of every pattern that matched
 */
public record PatternMatch(List<String> matchedPatterns) {

    public static final PatternMatch NONE = new PatternMatch(List.of());

    public PatternMatch {
        matchedPatterns = matchedPatterns != null ? List.copyOf(matchedPatterns) : List.of();
    }

    public int count() {
        return matchedPatterns.size();
    }

    public boolean isEmpty() {
        return matchedPatterns.isEmpty();
    }
}
