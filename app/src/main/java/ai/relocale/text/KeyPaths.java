package ai.relocale.text;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** Helpers for dot-delimited translation keys. */
public final class KeyPaths {
    private static final Splitter DOT_SPLITTER = Splitter.on('.').omitEmptyStrings();
    private static final Splitter WORD_SPLITTER =
            Splitter.on(Pattern.compile("[\\s_\\-]+")).omitEmptyStrings();
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern LAST_N = Pattern.compile("(?i)\\blast\\s+(\\d+)\\b");
    private static final Pattern DAYS_WORD = Pattern.compile("(?i)\\bdays?\\b");

    private KeyPaths() {}

    public static List<String> segments(String key) {
        return DOT_SPLITTER.splitToList(key);
    }

    /** Last non-empty segment of the key, or the empty string. */
    public static String lastSegment(String key) {
        var parts = segments(key);
        return parts.isEmpty() ? "" : parts.get(parts.size() - 1);
    }

    public static boolean isValidKey(String key) {
        return !segments(key).isEmpty();
    }

    /**
     * Alternate paths under which the same string may be stored, most specific first: the full key, the key without
     * its first and first two segments, the last segment, and the last two segments. Duplicates are dropped.
     */
    public static List<String> getKeyPathVariations(String key) {
        var parts = segments(key);
        var variations = new LinkedHashSet<String>();
        variations.add(key);
        if (parts.size() > 1) {
            variations.add(String.join(".", parts.subList(1, parts.size())));
            if (parts.size() > 2) {
                variations.add(String.join(".", parts.subList(2, parts.size())));
            }
            variations.add(parts.get(parts.size() - 1));
            if (parts.size() > 2) {
                variations.add(String.join(".", parts.subList(parts.size() - 2, parts.size())));
            }
        }
        return List.copyOf(variations);
    }

    /**
     * Lower-case words of the last key segment, split on camelCase, underscores and hyphens, keeping tokens longer
     * than two characters.
     */
    public static List<String> extractHintWords(String key) {
        var spaced = CAMEL_BOUNDARY.matcher(lastSegment(key)).replaceAll("$1 $2");
        var words = new ArrayList<String>();
        for (var word : WORD_SPLITTER.split(spaced)) {
            var lower = word.toLowerCase(Locale.ROOT);
            if (lower.length() > 2 && !words.contains(lower)) {
                words.add(lower);
            }
        }
        return words;
    }

    /** {@code user_profile} becomes {@code User profile}. */
    public static String buildLabelFromKeySegment(String segment) {
        var parts = WORD_SPLITTER.splitToList(segment);
        if (parts.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        for (int i = 0; i < parts.size(); i++) {
            var lower = parts.get(i).toLowerCase(Locale.ROOT);
            if (i == 0) {
                sb.append(Character.toUpperCase(lower.charAt(0))).append(lower.substring(1));
            } else {
                sb.append(' ').append(lower);
            }
        }
        return sb.toString();
    }

    /**
     * Label generated for a key nothing could be recovered for. Keys ending in {@code last_7} read as
     * {@code Last 7 days}. Falls back to the key itself when the last segment has no words.
     */
    public static String buildFallbackLabel(String key) {
        var segment = lastSegment(key);
        var label = buildLabelFromKeySegment(segment);
        if (label.isEmpty()) {
            return key;
        }
        var lastN = LAST_N.matcher(label);
        if (lastN.find() && !DAYS_WORD.matcher(label).find()) {
            label = label.substring(0, lastN.end()) + " days" + label.substring(lastN.end());
        }
        return label;
    }

    /** Contains a dot and no whitespace, i.e. reads like a key rather than prose. */
    public static boolean isKeyLike(String text) {
        return text.contains(".") && text.chars().noneMatch(Character::isWhitespace);
    }
}
