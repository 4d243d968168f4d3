package ai.relocale.recovery;

import ai.relocale.cache.LocaleSnapshotCache;
import ai.relocale.cache.LocaleSnapshotCache.HistoryWindow;
import ai.relocale.history.CommitRef;
import ai.relocale.lock.CancellationToken;
import ai.relocale.text.CandidateTextExtractor;
import ai.relocale.text.KeyPaths;
import ai.relocale.text.TranslationCalls;
import java.util.List;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Last resort: finds the commit where a source file started calling {@code t('key')} and reads the text the call
 * replaced, either from that commit's diff or from the file as it was before the call existed.
 */
final class SourceFileRecovery {
    private static final Logger logger = LogManager.getLogger(SourceFileRecovery.class);

    static final int SNAPSHOT_MIN_SCORE = 5;

    /** Adjacent commits with the call absent in {@code without} and present in {@code with}. */
    record Introduction(String without, String with) {}

    private final LocaleSnapshotCache cache;

    SourceFileRecovery(LocaleSnapshotCache cache) {
        this.cache = cache;
    }

    @Nullable
    RecoveryResult recover(String key, int daysBack, CancellationToken cancellation, Predicate<String> plausible) {
        var window = new HistoryWindow(daysBack, cache.config().sourceMaxCommits());
        for (var relativePath : cache.sourceFilesReferencing(key)) {
            if (cancellation.isCancellationRequested()) {
                return null;
            }
            var result = recoverFromFile(key, relativePath, window, plausible);
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    /** Loads the history and every historical version of each file referencing {@code key} into the cache. */
    void prefetch(String key, int daysBack) {
        var window = new HistoryWindow(daysBack, cache.config().sourceMaxCommits());
        for (var relativePath : cache.sourceFilesReferencing(key)) {
            for (var commit : cache.sourceCommits(relativePath, window)) {
                cache.sourceAt(relativePath, commit.hash());
            }
        }
    }

    private @Nullable RecoveryResult recoverFromFile(
            String key, String relativePath, HistoryWindow window, Predicate<String> plausible) {
        var commits = cache.sourceCommits(relativePath, window);
        if (commits.isEmpty()) {
            return null;
        }
        var current = cache.sourceContent(relativePath);
        var placeholderHints = current == null ? List.<String>of() : TranslationCalls.placeholderHints(current, key);

        var introduction = findIntroduction(relativePath, key, commits);
        if (introduction != null) {
            var diff = cache.diff(relativePath, introduction.without(), introduction.with());
            if (diff != null) {
                var best = DiffCandidateMiner.best(diff, key, placeholderHints, plausible);
                if (best != null) {
                    logger.debug(
                            "Recovered {} from diff {}..{} of {} (score {})",
                            key,
                            introduction.without(),
                            introduction.with(),
                            relativePath,
                            best.score());
                    return RecoveryResult.diff(best.text(), introduction.without(), introduction.with());
                }
            }
        }

        var snapshotCommit = introduction != null ? introduction.without() : newestWithoutCall(relativePath, key, commits);
        if (snapshotCommit == null) {
            return null;
        }
        var content = cache.sourceAt(relativePath, snapshotCommit);
        if (content == null) {
            return null;
        }
        var hints = KeyPaths.extractHintWords(key);
        for (var candidate : CandidateTextExtractor.ranked(content, hints, placeholderHints)) {
            if (CandidateAcceptance.isAcceptable(candidate.text(), hints, placeholderHints)
                    && plausible.test(candidate.text())) {
                if (candidate.score() < SNAPSHOT_MIN_SCORE) {
                    return null;
                }
                logger.debug("Recovered {} from {} at {}", key, relativePath, snapshotCommit);
                return RecoveryResult.source(candidate.text(), snapshotCommit, relativePath);
            }
        }
        return null;
    }

    /** Scans oldest to newest for the first commit that adds the call. Unreadable commits are skipped. */
    @Nullable
    Introduction findIntroduction(String relativePath, String key, List<CommitRef> newestFirst) {
        String previous = null;
        boolean previousHasCall = false;
        for (int i = newestFirst.size() - 1; i >= 0; i--) {
            var commit = newestFirst.get(i);
            var content = cache.sourceAt(relativePath, commit.hash());
            if (content == null) {
                continue;
            }
            boolean hasCall = TranslationCalls.containsCall(content, key);
            if (hasCall && previous != null && !previousHasCall) {
                return new Introduction(previous, commit.hash());
            }
            previous = commit.hash();
            previousHasCall = hasCall;
        }
        return null;
    }

    private @Nullable String newestWithoutCall(String relativePath, String key, List<CommitRef> newestFirst) {
        for (var commit : newestFirst) {
            var content = cache.sourceAt(relativePath, commit.hash());
            if (content != null && !TranslationCalls.containsCall(content, key)) {
                return commit.hash();
            }
        }
        return null;
    }
}
