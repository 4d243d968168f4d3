package ai.relocale.text;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** Recognizes {@code t('key')} and {@code $t("key")} call sites in source text. */
public final class TranslationCalls {
    private static final Pattern ANY_CALL = Pattern.compile("(?:\\b|\\$)t\\(\\s*['\"]");
    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    private TranslationCalls() {}

    /** Matches a call to exactly {@code key}, with or without the {@code $} prefix. */
    public static Pattern callPattern(String key) {
        return Pattern.compile("(?:\\b|\\$)t\\(\\s*['\"]" + Pattern.quote(key) + "['\"]");
    }

    public static boolean containsCall(String content, String key) {
        return callPattern(key).matcher(content).find();
    }

    public static boolean containsAnyCall(String content) {
        return ANY_CALL.matcher(content).find();
    }

    /** Literal substrings that identify a call to {@code key} without a regex scan. */
    public static List<String> searchNeedles(String key) {
        return List.of("t('" + key + "'", "t(\"" + key + "\"", "$t('" + key + "'", "$t(\"" + key + "\"");
    }

    /**
     * Option names passed at the key's call sites, e.g. {@code t('key', { count: n, name })} yields
     * {@code [count, n, name]} in lower case. The value side of shorthand-free pairs is included as a weaker hint.
     */
    public static List<String> placeholderHints(String content, String key) {
        var pattern = Pattern.compile(
                "(?:\\b|\\$)t\\(\\s*['\"]" + Pattern.quote(key) + "['\"]\\s*,\\s*\\{([^}]+)}");
        var names = new LinkedHashSet<String>();
        var matcher = pattern.matcher(content);
        while (matcher.find()) {
            for (var part : matcher.group(1).split("[:,]")) {
                var trimmed = part.trim();
                if (IDENTIFIER.matcher(trimmed).matches()) {
                    names.add(trimmed.toLowerCase(Locale.ROOT));
                }
            }
        }
        return List.copyOf(names);
    }

    /** Option names only (left-hand sides and shorthands), preserving case; empty when no call passes options. */
    public static List<String> knownOptionNames(String content, String key) {
        var pattern = Pattern.compile(
                "(?:\\b|\\$)t\\(\\s*['\"]" + Pattern.quote(key) + "['\"]\\s*,\\s*\\{([^}]+)}");
        var names = new LinkedHashSet<String>();
        var matcher = pattern.matcher(content);
        while (matcher.find()) {
            for (var entry : matcher.group(1).split(",")) {
                var name = entry.split(":", 2)[0].trim();
                if (IDENTIFIER.matcher(name).matches()) {
                    names.add(name);
                }
            }
        }
        return List.copyOf(names);
    }
}
