package com.example.compliance.service;

import com.example.compliance.model.PatternMatch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Applies a rule's detection patterns to lower-cased text.
 * Each pattern counts once, however many times it occurs.
 */
@Component
public class PatternMatcher {

    /**
     * @param text     lower-cased text to scan
     * @param patterns ordered rule patterns
     * @return the patterns that matched, in catalog order
     */
    public PatternMatch match(String text, List<Pattern> patterns) {
        if (text == null || text.isEmpty() || patterns.isEmpty()) return PatternMatch.NONE;

        List<String> matched = new ArrayList<>();
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                matched.add(pattern.pattern());
            }
        }
        return new PatternMatch(matched);
    }

    public int countMatches(String text, List<Pattern> patterns) {
        return match(text, patterns).count();
    }
}
