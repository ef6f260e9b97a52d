package com.agentrouter.common.analysis;

import com.agentrouter.common.model.Complexity;
import com.agentrouter.common.model.QueryAnalysis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pure stateless analyzer that derives routing signals from raw query text.
 *
 * <p><b>Keywords</b>: lower-cased tokens split on non-word characters, without stop-words
 * and tokens shorter than {@value #MIN_KEYWORD_LENGTH} characters, de-duplicated in
 * first-seen order, capped at {@value #MAX_KEYWORDS}.
 *
 * <p><b>Complexity</b>:
 * <pre>
 *   score = wordCount / 10 + questionMarks × 2 + technicalTermHits × 1.5
 *   score &gt; 8 → HIGH,  score &gt; 4 → MEDIUM,  otherwise LOW
 * </pre>
 *
 * <p><b>Sentiment</b>: distinct positive lexicon words minus distinct negative lexicon
 * words found among the tokens. The negative lexicon holds words of frustration and
 * dissatisfaction; neutral fault descriptions ("error", "failing") are left to the
 * keyword and complexity signals.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class QueryAnalyzer {

    static final int MIN_KEYWORD_LENGTH = 3;
    static final int MAX_KEYWORDS       = 8;

    static final double HIGH_COMPLEXITY_ABOVE   = 8.0;
    static final double MEDIUM_COMPLEXITY_ABOVE = 4.0;

    static final Set<String> STOP_WORDS = Set.of(
        "the", "is", "at", "which", "on", "and", "a", "an", "are",
        "how", "what", "when", "where", "why"
    );

    static final List<String> TECHNICAL_TERMS = List.of(
        "api", "webhook", "ssl", "database", "authentication", "integration"
    );

    static final Set<String> POSITIVE_WORDS = Set.of(
        "good", "great", "excellent", "perfect", "working", "successful", "thanks", "love"
    );

    static final Set<String> NEGATIVE_WORDS = Set.of(
        "broken", "wrong", "bad", "terrible", "awful", "angry", "frustrated", "frustrating",
        "unacceptable", "worst", "useless", "hate", "disappointed", "ridiculous"
    );

    private static final Pattern NON_WORD   = Pattern.compile("\\W+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private QueryAnalyzer() {}

    public static QueryAnalysis analyze(String text) {
        double complexityScore = complexityScore(text);
        return new QueryAnalysis(
            extractKeywords(text),
            bucket(complexityScore),
            complexityScore,
            assessSentiment(text));
    }

    public static List<String> extractKeywords(String text) {
        Set<String> keywords = new LinkedHashSet<>();
        for (String token : tokens(text)) {
            if (token.length() < MIN_KEYWORD_LENGTH || STOP_WORDS.contains(token)) {
                continue;
            }
            keywords.add(token);
            if (keywords.size() == MAX_KEYWORDS) {
                break;
            }
        }
        return List.copyOf(keywords);
    }

    public static Complexity assessComplexity(String text) {
        return bucket(complexityScore(text));
    }

    public static double complexityScore(String text) {
        String trimmed = text == null ? "" : text.trim();
        int wordCount = trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
        long questionMarks = trimmed.chars().filter(c -> c == '?').count();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        long technicalHits = TECHNICAL_TERMS.stream().filter(lower::contains).count();
        return wordCount / 10.0 + questionMarks * 2.0 + technicalHits * 1.5;
    }

    public static int assessSentiment(String text) {
        Set<String> distinct = new LinkedHashSet<>(tokens(text));
        int positive = 0;
        int negative = 0;
        for (String token : distinct) {
            if (POSITIVE_WORDS.contains(token)) positive++;
            if (NEGATIVE_WORDS.contains(token)) negative++;
        }
        return positive - negative;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static Complexity bucket(double score) {
        if (score > HIGH_COMPLEXITY_ABOVE) {
            return Complexity.HIGH;
        }
        if (score > MEDIUM_COMPLEXITY_ABOVE) {
            return Complexity.MEDIUM;
        }
        return Complexity.LOW;
    }

    private static List<String> tokens(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        for (String token : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
