package ai.relocale.text;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** Additive relevance score for a candidate string. Every term is independent of the others. */
public final class CandidateScorer {
    public static final int HINT_MATCH = 10;
    public static final int PLACEHOLDER_HINT_MATCH = 3;

    private static final Pattern CAPITAL_START = Pattern.compile("^[A-Z]");
    private static final Pattern TERMINAL_PUNCTUATION = Pattern.compile("[.!?]$");
    private static final Pattern UI_VOCABULARY = Pattern.compile(
            "(?i)\\b(please|click|tap|select|enter|submit|cancel|save|delete|edit|view|loading|error|success|warning)\\b");
    private static final Pattern BARE_CALL = Pattern.compile("^\\w+\\(");
    private static final Pattern BARE_IDENTIFIER = Pattern.compile("^[a-z][a-zA-Z0-9]*$");

    private CandidateScorer() {}

    public static int score(String text, Collection<String> hintWords) {
        return score(text, hintWords, List.of(), 0);
    }

    public static int score(
            String text, Collection<String> hintWords, Collection<String> placeholderHints, int sourceBonus) {
        int score = sourceBonus;
        score += HINT_MATCH * countMatches(text, hintWords);
        score += PLACEHOLDER_HINT_MATCH * countMatches(text, placeholderHints);
        if (CAPITAL_START.matcher(text).find()) {
            score += 2;
        }
        if (TERMINAL_PUNCTUATION.matcher(text).find()) {
            score += 2;
        }
        if (text.contains(" ")) {
            score += 1;
            if (TextRules.wordCount(text) >= 3) {
                score += 2;
            }
        }
        if (text.length() >= 5 && text.length() <= 150) {
            score += 2;
        }
        if (UI_VOCABULARY.matcher(text).find()) {
            score += 3;
        }
        if (BARE_CALL.matcher(text).find() || BARE_IDENTIFIER.matcher(text).matches()) {
            score -= 5;
        }
        return score;
    }

    /** Number of words from {@code words} occurring case-insensitively as substrings of {@code text}. */
    public static int countMatches(String text, Collection<String> words) {
        var lower = text.toLowerCase(Locale.ROOT);
        int count = 0;
        for (var word : words) {
            if (lower.contains(word.toLowerCase(Locale.ROOT))) {
                count++;
            }
        }
        return count;
    }
}
