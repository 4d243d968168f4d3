package ai.relocale.text;

import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/** Normalizes JavaScript template literal bodies into translatable text. */
public final class TemplateLiterals {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{value\\d+}");
    private static final Pattern LETTER = Pattern.compile("[a-zA-Z]");

    private TemplateLiterals() {}

    /**
     * Replaces each {@code ${expr}} with {@code {value1}}, {@code {value2}}, ... in order of appearance, honouring
     * nested braces inside the expression. Returns {@code null} when nothing alphabetic remains outside the
     * placeholders or when an interpolation is unterminated.
     */
    public static @Nullable String normalize(String body) {
        var sb = new StringBuilder();
        int index = 0;
        int i = 0;
        while (i < body.length()) {
            if (body.startsWith("${", i)) {
                int depth = 1;
                int j = i + 2;
                while (j < body.length() && depth > 0) {
                    char c = body.charAt(j);
                    if (c == '{') {
                        depth++;
                    } else if (c == '}') {
                        depth--;
                    }
                    j++;
                }
                if (depth != 0) {
                    return null;
                }
                sb.append("{value").append(++index).append('}');
                i = j;
            } else {
                sb.append(body.charAt(i));
                i++;
            }
        }
        var normalized = sb.toString().trim();
        var staticText = PLACEHOLDER.matcher(normalized).replaceAll("");
        if (!LETTER.matcher(staticText).find()) {
            return null;
        }
        return normalized;
    }
}
