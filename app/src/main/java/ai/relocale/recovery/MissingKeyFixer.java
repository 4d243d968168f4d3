package ai.relocale.recovery;

import ai.relocale.cache.LocaleSnapshotCache;
import ai.relocale.lock.CancellationToken;
import ai.relocale.lock.OperationLockManager;
import ai.relocale.lock.OperationType;
import ai.relocale.locale.LocaleFileWriter;
import ai.relocale.text.KeyPaths;
import ai.relocale.text.TextSimilarity;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Fixes references to keys that have no value in the target locale. Each key is, in order, redirected to an
 * existing key it is a likely typo of, given a recovered value, or given a label generated from its name and flagged
 * for review. New values are written to the first target-locale file in a single update.
 */
public class MissingKeyFixer {
    private static final Logger logger = LogManager.getLogger(MissingKeyFixer.class);

    private final RecoveryPipeline pipeline;
    private final OperationLockManager locks;
    private final LocaleFileWriter writer;

    public MissingKeyFixer(RecoveryPipeline pipeline, OperationLockManager locks, LocaleFileWriter writer) {
        this.pipeline = pipeline;
        this.locks = locks;
        this.writer = writer;
    }

    /**
     * Runs the fix under the {@link OperationType#KEY_MANAGEMENT} lock.
     *
     * @return the report, or null when another operation holds the lock
     * @throws UncheckedIOException if the locale file cannot be written
     */
    public @Nullable FixReport fix(
            Path workspace, String locale, List<String> keys, Collection<String> existingKeys, RecoveryOptions options) {
        var description = "Fix " + keys.size() + " missing translation keys";
        return locks.withGlobalLock(
                OperationType.KEY_MANAGEMENT,
                description,
                token -> doFix(workspace, locale, keys, existingKeys, options, token),
                true);
    }

    private FixReport doFix(
            Path workspace,
            String locale,
            List<String> keys,
            Collection<String> existingKeys,
            RecoveryOptions options,
            CancellationToken token) {
        var cache = pipeline.registry().forWorkspace(workspace);
        cache.clear();

        var typoFixes = new LinkedHashMap<String, String>();
        var remaining = new ArrayList<String>();
        for (var key : keys) {
            var match = findTypoMatch(key, existingKeys);
            if (match.isPresent()) {
                typoFixes.put(key, match.get());
            } else {
                remaining.add(key);
            }
        }

        var recovered = new LinkedHashMap<String, RecoveryResult>();
        var generated = new LinkedHashMap<String, String>();
        if (!remaining.isEmpty() && !token.isCancellationRequested()) {
            var results = pipeline.recoverBatch(workspace, remaining, locale, options.withCancellation(token));
            for (var key : remaining) {
                var result = results.get(key);
                if (result != null
                        && !SuspiciousValueDetector.isSuspicious(key, result.value(), options.knownOptionNames())) {
                    recovered.put(key, result);
                } else {
                    generated.put(key, KeyPaths.buildFallbackLabel(key));
                }
            }
        }

        if (token.isCancellationRequested()) {
            logger.info("Fixing missing keys in {} was cancelled; nothing written", workspace);
            return new FixReport(typoFixes, recovered, generated, null);
        }

        var updates = new LinkedHashMap<String, String>();
        recovered.forEach((key, result) -> updates.put(key, result.value()));
        updates.putAll(generated);
        var target = write(cache, locale, updates);
        logger.info(
                "Fixed missing keys in {}: {} typos, {} recovered, {} generated",
                workspace,
                typoFixes.size(),
                recovered.size(),
                generated.size());
        return new FixReport(typoFixes, recovered, generated, target);
    }

    private @Nullable Path write(LocaleSnapshotCache cache, String locale, LinkedHashMap<String, String> updates) {
        if (updates.isEmpty()) {
            return null;
        }
        cache.initialize(locale, cache.config().daysBack());
        var files = cache.filesForLocale(locale);
        if (files.isEmpty()) {
            logger.warn("No {} locale file in {}; {} values not written", locale, cache.workspace(), updates.size());
            return null;
        }
        var target = files.get(0).path();
        try {
            writer.setMultiple(target, OperationType.KEY_MANAGEMENT, updates);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write " + target, e);
        }
        cache.clear();
        return target;
    }

    /**
     * Nearest existing key under the same parent whose last segment is within
     * {@code max(2, floor(longerLength / 4))} edits.
     */
    static Optional<String> findTypoMatch(String key, Collection<String> existingKeys) {
        var prefix = parentOf(key);
        var leaf = KeyPaths.lastSegment(key);
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (var existing : existingKeys) {
            if (existing.equals(key) || !parentOf(existing).equals(prefix)) {
                continue;
            }
            var existingLeaf = KeyPaths.lastSegment(existing);
            int threshold = Math.max(2, Math.max(leaf.length(), existingLeaf.length()) / 4);
            int distance = TextSimilarity.computeEditDistance(leaf, existingLeaf);
            if (distance <= threshold && distance < bestDistance) {
                best = existing;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    private static String parentOf(String key) {
        int dot = key.lastIndexOf('.');
        return dot < 0 ? "" : key.substring(0, dot);
    }
}
