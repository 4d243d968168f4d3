package ai.relocale.recovery;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of a {@link MissingKeyFixer} run.
 *
 * @param typoFixes missing key to the existing key it most likely meant; nothing is written for these
 * @param recovered values found by recovery
 * @param generated labels built from the key name, which a person should review
 * @param writtenTo locale file that received the new values, or null when nothing was written
 */
public record FixReport(
        Map<String, String> typoFixes,
        Map<String, RecoveryResult> recovered,
        Map<String, String> generated,
        @Nullable Path writtenTo) {

    public Set<String> needsReview() {
        return generated.keySet();
    }

    public int writtenCount() {
        return writtenTo == null ? 0 : recovered.size() + generated.size();
    }
}
