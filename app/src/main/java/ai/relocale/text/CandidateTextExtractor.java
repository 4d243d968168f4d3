package ai.relocale.text;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Pulls strings that read like user-facing text out of source code, diff fragments or whole files, and scores them
 * against the hint words of a translation key.
 */
public final class CandidateTextExtractor {

    /** Where a candidate was found, with the score bonus that location earns. */
    public enum Source {
        JSX_TEXT(2),
        UI_PROP(5),
        VUE_INTERPOLATION(4),
        TEMPLATE_LITERAL(4),
        OBJECT_PROPERTY(4),
        CALL_ARGUMENT(6),
        QUOTED_LITERAL(0);

        private final int bonus;

        Source(int bonus) {
            this.bonus = bonus;
        }

        public int bonus() {
            return bonus;
        }
    }

    private static final Pattern JSX_TEXT = Pattern.compile(">([^<>{]+)<");
    private static final List<Pattern> UI_PROPS = List.of(
            Pattern.compile(
                    "(?i)\\b(title|placeholder|alt|label|message|description|header|tooltip)\\s*=\\s*[\"']([^\"']+)[\"']"),
            Pattern.compile("(?i)\\b(aria-label|aria-description)\\s*=\\s*[\"']([^\"']+)[\"']"),
            Pattern.compile(
                    "(?i)\\b(buttonText|submitText|cancelText|confirmText|errorText|helperText)\\s*=\\s*[\"']([^\"']+)[\"']"));
    private static final Pattern VUE_INTERPOLATION = Pattern.compile("\\{\\{\\s*['\"]([^'\"{}]+)['\"]\\s*}}");
    private static final Pattern TEMPLATE_LITERAL = Pattern.compile("`([^`]+)`");
    private static final Pattern OBJECT_PROPERTY = Pattern.compile(
            "(?i)(?:text|label|title|message|description|placeholder|content|header|tooltip|buttonText"
                    + "|errorMessage|successMessage):\\s*[\"']([^\"']+)[\"']");
    private static final Pattern CALL_ARGUMENT = Pattern.compile(
            "(?i)(?:showMessage|showError|showSuccess|toast|alert|confirm|notify|setError|setMessage|setTitle)"
                    + "\\s*\\(\\s*[\"']([^\"']+)[\"']");
    private static final Pattern STYLE_LINE = Pattern.compile("className\\s*=|style\\s*=|styles\\.|classes\\.");
    private static final Pattern STYLE_LINE_BRACKETS = Pattern.compile("className\\s*=|style\\s*=|styles\\[|classes\\[");
    private static final Pattern DOUBLE_QUOTED = Pattern.compile("\"((?:[^\"\\\\]|\\\\.){3,})\"");
    private static final Pattern SINGLE_QUOTED = Pattern.compile("'((?:[^'\\\\]|\\\\.){3,})'");
    private static final Pattern LINE_BREAK = Pattern.compile("\\s*\\R\\s*");

    private CandidateTextExtractor() {}

    public static List<Candidate> extract(String content, List<String> hintWords) {
        return extract(content, hintWords, List.of());
    }

    /**
     * All user-text candidates in {@code content}, in discovery order. Labeled sources are scanned before bare
     * quoted literals, and a text seen twice keeps its first score.
     */
    public static List<Candidate> extract(String content, List<String> hintWords, List<String> placeholderHints) {
        var collector = new Collector(hintWords, placeholderHints);

        var m = JSX_TEXT.matcher(content);
        while (m.find()) {
            collector.add(m.group(1), Source.JSX_TEXT);
        }
        for (var pattern : UI_PROPS) {
            m = pattern.matcher(content);
            while (m.find()) {
                collector.add(m.group(2), Source.UI_PROP);
            }
        }
        m = VUE_INTERPOLATION.matcher(content);
        while (m.find()) {
            collector.add(m.group(1), Source.VUE_INTERPOLATION);
        }
        m = TEMPLATE_LITERAL.matcher(content);
        while (m.find()) {
            var normalized = TemplateLiterals.normalize(m.group(1));
            if (normalized != null) {
                collector.add(LINE_BREAK.matcher(normalized).replaceAll(" "), Source.TEMPLATE_LITERAL);
            }
        }
        m = OBJECT_PROPERTY.matcher(content);
        while (m.find()) {
            collector.add(m.group(1), Source.OBJECT_PROPERTY);
        }
        m = CALL_ARGUMENT.matcher(content);
        while (m.find()) {
            collector.add(m.group(1), Source.CALL_ARGUMENT);
        }
        for (var line : content.split("\\R")) {
            if (STYLE_LINE.matcher(line).find()) {
                continue;
            }
            m = DOUBLE_QUOTED.matcher(line);
            while (m.find()) {
                collector.add(unescape(m.group(1), '"'), Source.QUOTED_LITERAL);
            }
            m = SINGLE_QUOTED.matcher(line);
            while (m.find()) {
                collector.add(unescape(m.group(1), '\''), Source.QUOTED_LITERAL);
            }
        }
        return collector.candidates;
    }

    /** Candidates sorted best first. */
    public static List<Candidate> ranked(String content, List<String> hintWords, List<String> placeholderHints) {
        var candidates = new ArrayList<>(extract(content, hintWords, placeholderHints));
        candidates.sort(Candidate.BY_SCORE_DESC);
        return candidates;
    }

    /**
     * Best string on a single source line for {@code key}: the top candidate when it scores at least 3, or the only
     * candidate on the line. Lines assigning classes or styles yield nothing.
     */
    public static @Nullable String extractHardcodedStringFromLine(String line, String key) {
        if (STYLE_LINE_BRACKETS.matcher(line).find()) {
            return null;
        }
        var candidates = ranked(line, KeyPaths.extractHintWords(key), List.of());
        if (candidates.isEmpty()) {
            return null;
        }
        var best = candidates.get(0);
        if (best.score() >= 3 || candidates.size() == 1) {
            return best.text();
        }
        return null;
    }

    private static String unescape(String raw, char quote) {
        return raw.replace("\\" + quote, String.valueOf(quote)).replace("\\n", " ");
    }

    private static final class Collector {
        private final List<String> hintWords;
        private final List<String> placeholderHints;
        private final Set<String> seen = new HashSet<>();
        private final List<Candidate> candidates = new ArrayList<>();

        Collector(List<String> hintWords, List<String> placeholderHints) {
            this.hintWords = hintWords;
            this.placeholderHints = placeholderHints;
        }

        void add(String raw, Source source) {
            var text = raw.trim();
            if (text.isEmpty() || seen.contains(text) || !TextRules.looksLikeUserText(text)) {
                return;
            }
            seen.add(text);
            candidates.add(new Candidate(
                    text, CandidateScorer.score(text, hintWords, placeholderHints, source.bonus())));
        }
    }
}
