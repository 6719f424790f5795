package com.example.compliance.service;

import com.example.compliance.model.PatternMatch;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class PatternMatcherTest {

    private final PatternMatcher matcher = new PatternMatcher();

    private final List<Pattern> patterns = List.of(
            Pattern.compile("risk\\s+analysis", Pattern.CASE_INSENSITIVE),
            Pattern.compile("hazard", Pattern.CASE_INSENSITIVE),
            Pattern.compile("design\\s+review", Pattern.CASE_INSENSITIVE));

    @Test
    void patternCountsOnceEvenWhenRepeated() {
        PatternMatch match = matcher.match("risk analysis, then risk   analysis again, hazard hazard", patterns);

        assertThat(match.count()).isEqualTo(2);
        assertThat(match.matchedPatterns()).containsExactly("risk\\s+analysis", "hazard");
    }

    @Test
    void evidenceFollowsPatternOrderNotTextOrder() {
        PatternMatch match = matcher.match("a hazard found during risk analysis", patterns);

        assertThat(match.matchedPatterns()).containsExactly("risk\\s+analysis", "hazard");
    }

    @Test
    void whitespaceBetweenWordsIsFlexible() {
        assertThat(matcher.countMatches("design\n\treview", patterns)).isEqualTo(1);
    }

    @Test
    void noMatchYieldsEmptyEvidence() {
        PatternMatch match = matcher.match("user login page", patterns);

        assertThat(match.isEmpty()).isTrue();
        assertThat(match.matchedPatterns()).isEmpty();
    }

    @Test
    void emptyTextOrPatternsMatchNothing() {
        assertThat(matcher.match("", patterns)).isEqualTo(PatternMatch.NONE);
        assertThat(matcher.match(null, patterns)).isEqualTo(PatternMatch.NONE);
        assertThat(matcher.match("risk analysis", List.of())).isEqualTo(PatternMatch.NONE);
    }
}
