package ai.relocale.text;

import com.google.common.base.Splitter;
import java.util.List;
import java.util.regex.Pattern;

/** The prioritized rule chain deciding whether a string reads like text shown to a user. */
public final class TextRules {
    private static final Splitter WHITESPACE = Splitter.on(Pattern.compile("\\s+")).omitEmptyStrings();

    private static final List<Pattern> CSS_PATTERNS = List.of(
            Pattern.compile("(?i)^[a-z]+-[a-z0-9-]+(\\s+[a-z]+-[a-z0-9-]+)*$"),
            Pattern.compile("\\b(flex|grid|block|inline|hidden|absolute|relative|fixed)\\b"),
            Pattern.compile("\\b(w-|h-|p-|m-|px-|py-|mx-|my-|pt-|pb-|pl-|pr-|mt-|mb-|ml-|mr-)"),
            Pattern.compile("\\b(text-|bg-|border-|rounded|shadow|overflow|cursor|opacity)"),
            Pattern.compile("\\b(sm:|md:|lg:|xl:|2xl:|hover:|focus:|active:|dark:)"),
            Pattern.compile("\\b(justify-|items-|self-|gap-|space-)"),
            Pattern.compile("\\b(font-|leading-|tracking-)"),
            Pattern.compile("\\b(z-\\d|top-|bottom-|left-|right-)"),
            Pattern.compile("^[a-z][a-z0-9]*(-[a-z0-9]+)+(\\s|$)"));
    private static final Pattern UTILITY_TOKEN = Pattern.compile("(?i)^[a-z][a-z0-9]*(-[a-z0-9]+)+$");
    private static final Pattern STATE_PREFIX = Pattern.compile("^(sm|md|lg|xl|2xl|hover|focus|dark):");

    private static final List<Pattern> CODE_PATTERNS = List.of(
            Pattern.compile("(?i)^[a-z_][a-z0-9_]*$"),
            Pattern.compile("^[a-z][a-zA-Z0-9]*$"),
            Pattern.compile("^(https?:|mailto:|tel:|//|www\\.)"),
            Pattern.compile("^[./\\\\]"),
            Pattern.compile("(?i)\\.(ts|tsx|js|jsx|vue|json|css|scss|html|php|blade\\.php)$"),
            Pattern.compile("^\\$\\{.*}$"),
            Pattern.compile("^\\{\\{.*}}$"),
            Pattern.compile("^(intent:|scheme=|#Intent)"),
            Pattern.compile("^on[A-Z][a-zA-Z]*$"),
            Pattern.compile("^[a-z]+-[a-z-]+$"),
            Pattern.compile("^#[0-9a-fA-F]{3,8}$"),
            Pattern.compile("^-?\\d+(\\.\\d+)?$"),
            Pattern.compile("^[a-zA-Z_$][a-zA-Z0-9_$]*:$"),
            Pattern.compile("^@/|^\\.\\.?/|^~/"));

    private static final Pattern LETTER = Pattern.compile("[a-zA-Z]");
    private static final Pattern CAPITAL_START = Pattern.compile("^[A-Z]");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?:]$");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{[a-zA-Z_][a-zA-Z0-9_]*}");
    private static final Pattern CAPITALIZED_PHRASE = Pattern.compile("[A-Z][a-z]+(\\s+[a-z]+)+");
    private static final Pattern COMMON_WORDS = Pattern.compile(
            "(?i)\\b(the|and|or|to|is|are|was|has|have|this|that|your|our|please|click|tap|select|add|save|cancel"
                    + "|delete|edit|view|open|close|enter|submit|confirm|error|success|warning|loading|welcome|hello"
                    + "|hi|thanks|sorry|oops|done|next|back|continue|finish|start|stop|pause|play|search|find|filter"
                    + "|sort|show|hide|enable|disable|on|off|yes|no|ok|failed|try|again)\\b");

    static final List<TextRule> RULES = List.of(
            TextRule.rejectIf("tooShort", text -> text.length() < 2),
            TextRule.rejectIf("hasLetter", text -> !LETTER.matcher(text).find()),
            TextRule.rejectIf("isCssClassLike", TextRules::isCssClassLike),
            TextRule.rejectIf("isCodePatternLike", TextRules::isCodePatternLike),
            TextRule.acceptIf("multiWord", text -> wordCount(text) >= 2),
            TextRule.acceptIf("capitalStart", text -> CAPITAL_START.matcher(text).find()),
            TextRule.acceptIf("sentencePunctuation", text -> SENTENCE_END.matcher(text).find()),
            TextRule.acceptIf("commonWord", text -> COMMON_WORDS.matcher(text).find()),
            TextRule.acceptIf("placeholder", text -> PLACEHOLDER.matcher(text).find()),
            TextRule.acceptIf("capitalizedPhrase", text -> CAPITALIZED_PHRASE.matcher(text).find()));

    private TextRules() {}

    /** Folds the rule chain over the trimmed text. Falls through to a rejection when no positive rule fires. */
    public static TextRule.Verdict evaluate(String text) {
        var trimmed = text.trim();
        for (var rule : RULES) {
            var verdict = rule.apply(trimmed);
            if (verdict.outcome() != TextRule.Outcome.CONTINUE) {
                return verdict;
            }
        }
        return new TextRule.Verdict("noPositiveSignal", TextRule.Outcome.REJECT);
    }

    public static boolean looksLikeUserText(String text) {
        return evaluate(text).accepted();
    }

    /** Tailwind-style utilities, hyphenated utility tokens and responsive/state prefixes. */
    public static boolean isCssClassLike(String text) {
        var trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        for (var pattern : CSS_PATTERNS) {
            if (pattern.matcher(trimmed).find()) {
                return true;
            }
        }
        var tokens = WHITESPACE.splitToList(trimmed);
        if (tokens.size() >= 2) {
            long cssLike = tokens.stream()
                    .filter(t -> UTILITY_TOKEN.matcher(t).matches()
                            || STATE_PREFIX.matcher(t).find())
                    .count();
            return cssLike * 2 >= tokens.size();
        }
        return false;
    }

    /** Identifiers, URLs, paths, lone template expressions, colors, numbers, handler names and import paths. */
    public static boolean isCodePatternLike(String text) {
        var trimmed = text.trim();
        for (var pattern : CODE_PATTERNS) {
            if (pattern.matcher(trimmed).find()) {
                return true;
            }
        }
        return false;
    }

    public static int wordCount(String text) {
        return WHITESPACE.splitToList(text.trim()).size();
    }

    public static boolean hasPlaceholder(String text) {
        return PLACEHOLDER.matcher(text).find();
    }

    public static int countPlaceholders(String text) {
        return (int) PLACEHOLDER.matcher(text).results().count();
    }
}
