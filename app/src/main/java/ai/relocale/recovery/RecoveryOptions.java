package ai.relocale.recovery;

import ai.relocale.config.RecoveryConfig;
import ai.relocale.lock.CancellationToken;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Per-call recovery settings.
 *
 * @param daysBack history lookback for locale and source files
 * @param maxCommits commits inspected per locale file
 * @param extractRef commit to read first; when null the workspace's recorded extraction commit is used
 * @param knownOptionNames option names passed at the call site; when null they are derived from source files
 * @param cancellation checked between phases and iterations
 */
public record RecoveryOptions(
        int daysBack,
        int maxCommits,
        @Nullable String extractRef,
        @Nullable List<String> knownOptionNames,
        CancellationToken cancellation) {

    public static RecoveryOptions singleKey(RecoveryConfig config) {
        return new RecoveryOptions(
                config.singleKeyDaysBack(), config.singleKeyMaxCommits(), null, null, CancellationToken.NONE);
    }

    public static RecoveryOptions batch(RecoveryConfig config) {
        return new RecoveryOptions(config.daysBack(), config.maxCommitsPerFile(), null, null, CancellationToken.NONE);
    }

    public RecoveryOptions withExtractRef(@Nullable String ref) {
        return new RecoveryOptions(daysBack, maxCommits, ref, knownOptionNames, cancellation);
    }

    public RecoveryOptions withKnownOptionNames(@Nullable List<String> names) {
        return new RecoveryOptions(daysBack, maxCommits, extractRef, names == null ? null : List.copyOf(names), cancellation);
    }

    public RecoveryOptions withCancellation(CancellationToken token) {
        return new RecoveryOptions(daysBack, maxCommits, extractRef, knownOptionNames, token);
    }

    public RecoveryOptions withWindow(int days, int commits) {
        return new RecoveryOptions(days, commits, extractRef, knownOptionNames, cancellation);
    }
}
