package ai.relocale.recovery;

import ai.relocale.text.TextRules;
import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/** Flags stored or recovered values that are not plausible display text for their key. */
public final class SuspiciousValueDetector {

    public enum Reason {
        EMPTY,
        EQUALS_KEY,
        DOTTED_IDENTIFIER,
        UNKNOWN_PLACEHOLDER,
        TOO_LONG_FOR_LABEL,
        /** Placeholder names that lost their braces, e.g. {@code Value1 allowed value2 sent}. */
        BADLY_EXTRACTED
    }

    private static final Pattern DOTTED_IDENTIFIER = Pattern.compile("^[A-Za-z0-9_]+(\\.[A-Za-z0-9_\\-]+)+$");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-zA-Z_][a-zA-Z0-9_]*)}");
    private static final Pattern BARE_VALUE_N = Pattern.compile("\\b[Vv]alue\\d+\\b");
    private static final Pattern COMMON_PLACEHOLDER_WORD =
            Pattern.compile("\\b(Count|Total|Name|Value|Item|User|Email|Date|Time|Status|Type|Id)\\b");
    private static final Pattern CAPITALIZED_PAIR = Pattern.compile("[A-Z][a-z]+\\s+[A-Z][a-z]+");
    private static final int LABEL_WORD_LIMIT = 10;
    private static final String[] LABEL_SEGMENTS = {".label.", ".button.", ".title.", ".heading.", ".placeholder."};

    private SuspiciousValueDetector() {}

    public static boolean isSuspicious(String key, String value, @Nullable Collection<String> knownOptionNames) {
        return detect(key, value, knownOptionNames).isPresent();
    }

    /**
     * First reason {@code value} is implausible for {@code key}. Placeholders are checked against
     * {@code knownOptionNames} only when that collection is non-null.
     */
    public static Optional<Reason> detect(String key, String value, @Nullable Collection<String> knownOptionNames) {
        var trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return Optional.of(Reason.EMPTY);
        }
        if (trimmed.equals(key)) {
            return Optional.of(Reason.EQUALS_KEY);
        }
        if (DOTTED_IDENTIFIER.matcher(trimmed).matches()) {
            return Optional.of(Reason.DOTTED_IDENTIFIER);
        }
        if (knownOptionNames != null && hasUnknownPlaceholder(trimmed, knownOptionNames)) {
            return Optional.of(Reason.UNKNOWN_PLACEHOLDER);
        }
        if (isLabelKey(key) && TextRules.wordCount(trimmed) >= LABEL_WORD_LIMIT) {
            return Optional.of(Reason.TOO_LONG_FOR_LABEL);
        }
        if (isBadlyExtracted(trimmed)) {
            return Optional.of(Reason.BADLY_EXTRACTED);
        }
        return Optional.empty();
    }

    public static boolean isBadlyExtracted(String value) {
        var outsideBraces = PLACEHOLDER.matcher(value).replaceAll("");
        if (BARE_VALUE_N.matcher(outsideBraces).find()) {
            return true;
        }
        return COMMON_PLACEHOLDER_WORD.matcher(value).find()
                && CAPITALIZED_PAIR.matcher(value).find();
    }

    static boolean hasUnknownPlaceholder(String value, Collection<String> knownOptionNames) {
        var known = knownOptionNames.stream()
                .map(n -> n.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        var m = PLACEHOLDER.matcher(value);
        while (m.find()) {
            if (!known.contains(m.group(1).toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    static boolean isLabelKey(String key) {
        var wrapped = "." + key.toLowerCase(Locale.ROOT) + ".";
        for (var segment : LABEL_SEGMENTS) {
            if (wrapped.contains(segment)) {
                return true;
            }
        }
        return false;
    }
}
