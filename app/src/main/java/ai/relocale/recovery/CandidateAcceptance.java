package ai.relocale.recovery;

import ai.relocale.text.CandidateScorer;
import ai.relocale.text.KeyPaths;
import ai.relocale.text.TextRules;
import java.util.List;
import java.util.regex.Pattern;

/** Final gate for text mined from source files: it must read like a message and match enough of the key's words. */
final class CandidateAcceptance {
    static final int MAX_LENGTH = 160;
    private static final Pattern WHITESPACE = Pattern.compile("\\s");
    private static final Pattern PLACEHOLDER_START = Pattern.compile("\\{[a-zA-Z_]");

    private CandidateAcceptance() {}

    static boolean hasSignal(String text, List<String> hintWords, List<String> placeholderHints) {
        return CandidateScorer.countMatches(text, hintWords) > 0
                || CandidateScorer.countMatches(text, placeholderHints) > 0;
    }

    static boolean isAcceptable(String text, List<String> hintWords, List<String> placeholderHints) {
        var trimmed = text.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_LENGTH || trimmed.contains("\n")) {
            return false;
        }
        if (KeyPaths.isKeyLike(trimmed)) {
            return false;
        }
        if (!WHITESPACE.matcher(trimmed).find() && !PLACEHOLDER_START.matcher(trimmed).find()) {
            return false;
        }
        if (!hasSignal(trimmed, hintWords, placeholderHints)) {
            return false;
        }
        return meetsHintQuota(trimmed, hintWords, placeholderHints);
    }

    /**
     * At least {@code ceil(0.6 n)} of {@code n >= 3} hint words, otherwise one. One fewer is enough when the text
     * carries a placeholder and there are at least two hint words.
     */
    static boolean meetsHintQuota(String text, List<String> hintWords, List<String> placeholderHints) {
        int matches = CandidateScorer.countMatches(text, hintWords);
        int target = requiredMatches(hintWords.size());
        if (matches >= target) {
            return true;
        }
        boolean anyPlaceholder =
                CandidateScorer.countMatches(text, placeholderHints) > 0 || TextRules.countPlaceholders(text) > 0;
        return anyPlaceholder && hintWords.size() >= 2 && matches >= target - 1;
    }

    static int requiredMatches(int hintCount) {
        return hintCount >= 3 ? (int) Math.ceil(hintCount * 0.6) : 1;
    }
}
