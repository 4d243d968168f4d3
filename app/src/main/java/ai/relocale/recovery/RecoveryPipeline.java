package ai.relocale.recovery;

import ai.relocale.cache.LocaleSnapshotCache;
import ai.relocale.cache.LocaleSnapshotCache.HistoryWindow;
import ai.relocale.git.ExtractionRefTracker;
import ai.relocale.history.CommitRef;
import ai.relocale.locale.LocaleFileInfo;
import ai.relocale.locale.LocaleTree;
import ai.relocale.text.KeyPaths;
import ai.relocale.text.TextRules;
import ai.relocale.text.TranslationCalls;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Suppliers;
import com.google.common.collect.Lists;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;

/**
 * Looks up the best-guess original text for translation keys. Phases run in a fixed order and the first hit wins:
 *
 * <ol>
 *   <li>results already found this session
 *   <li>target-locale files at the extraction reference commit
 *   <li>target-locale files at HEAD
 *   <li>other locales at HEAD
 *   <li>target-locale file history
 *   <li>other locales' history
 *   <li>source files that call the key, via the diff that introduced the call
 * </ol>
 *
 * Suspicious values are skipped. A value that looks like mangled placeholders inside locale history ends the locale
 * history search for that key. Batch recovery runs the same phases with files and commits in the outer loop, so
 * every key gets the result the single-key path would give it.
 *
 * <p>Neither entry point throws; a key that cannot be recovered maps to null.
 */
public class RecoveryPipeline implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(RecoveryPipeline.class);

    private static final int DEFAULT_THREADS = 4;

    @VisibleForTesting
    record ResultKey(Path workspace, String locale, String key) {}

    private final LocaleSnapshotCache.Registry registry;
    private final ExecutorService executor;
    private final ConcurrentMap<ResultKey, RecoveryResult> results = new ConcurrentHashMap<>();

    public RecoveryPipeline(LocaleSnapshotCache.Registry registry) {
        this(registry, DEFAULT_THREADS);
    }

    public RecoveryPipeline(LocaleSnapshotCache.Registry registry, int threads) {
        this.registry = registry;
        var counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            var t = new Thread(r, "RecoveryFetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public LocaleSnapshotCache.Registry registry() {
        return registry;
    }

    /** Recovers one key. Returns null when every phase comes up empty. */
    public @Nullable RecoveryResult recover(Path workspace, String locale, String key, RecoveryOptions options) {
        return run(workspace, locale, List.of(key), options, false).get(key);
    }

    /**
     * Recovers many keys in one pass over the locale files and their history. The returned map has an entry for
     * every requested key, in request order, with null for keys that were not recovered.
     */
    public Map<String, @Nullable RecoveryResult> recoverBatch(
            Path workspace, List<String> keys, String locale, RecoveryOptions options) {
        var recovered = run(workspace, locale, keys, options, true);
        logger.info(
                "Batch recovery in {}: {}/{} keys recovered",
                workspace,
                recovered.values().stream().filter(Objects::nonNull).count(),
                recovered.size());
        return recovered;
    }

    /** Forgets every recovered value and every workspace cache. */
    public void clearCaches() {
        results.clear();
        registry.clearAll();
    }

    @VisibleForTesting
    int cachedResultCount() {
        return results.size();
    }

    private Map<String, @Nullable RecoveryResult> run(
            Path workspace, String locale, List<String> keys, RecoveryOptions options, boolean batch) {
        var ordered = new LinkedHashMap<String, @Nullable RecoveryResult>();
        keys.forEach(k -> ordered.put(k, null));

        var valid = new LinkedHashSet<String>();
        for (var key : keys) {
            if (KeyPaths.isValidKey(key)) {
                valid.add(key);
            } else {
                logger.debug("Ignoring invalid key '{}'", key);
            }
        }
        if (valid.isEmpty()) {
            return ordered;
        }

        var root = workspace.toAbsolutePath().normalize();
        var search = new Search(registry.forWorkspace(root), root, locale, valid, options, batch);
        try {
            search.run();
        } catch (RuntimeException e) {
            logger.warn("Recovery in {} stopped early: {}", root, e.getMessage());
            logger.debug("Recovery failure", e);
        }
        search.found.forEach(ordered::put);
        return ordered;
    }

    /** Stops the fetch pool and closes the registry's history sources. */
    @Override
    public void close() {
        executor.shutdownNow();
        registry.close();
    }

    private static final class KeyState {
        final String key;
        final List<String> variations;
        boolean historyAbandoned;
        private final Supplier<Optional<List<String>>> knownOptions;

        KeyState(String key, Supplier<Optional<List<String>>> knownOptions) {
            this.key = key;
            this.variations = KeyPaths.getKeyPathVariations(key);
            this.knownOptions = Suppliers.memoize(knownOptions::get);
        }
    }

    /** One recovery run over a set of pending keys. Found keys leave the pending set immediately. */
    private final class Search {
        private final LocaleSnapshotCache cache;
        private final Path workspace;
        private final String locale;
        private final Collection<String> allKeys;
        private final RecoveryOptions options;
        private final boolean parallel;
        private final Map<String, KeyState> pending = new LinkedHashMap<>();
        final Map<String, RecoveryResult> found = new LinkedHashMap<>();

        Search(
                LocaleSnapshotCache cache,
                Path workspace,
                String locale,
                Collection<String> keys,
                RecoveryOptions options,
                boolean batch) {
            this.cache = cache;
            this.workspace = workspace;
            this.locale = locale;
            this.allKeys = List.copyOf(keys);
            this.options = options;
            this.parallel = batch && keys.size() > 1;
            for (var key : keys) {
                pending.put(key, new KeyState(key, () -> resolveKnownOptions(key)));
            }
        }

        void run() {
            fromSessionCache();
            if (done()) {
                return;
            }
            cache.initialize(locale, options.daysBack());

            fromExtractionRef();
            if (done()) {
                return;
            }
            scanHead(cache.filesForLocale(locale), (value, file) -> RecoveryResult.head(value));
            if (done()) {
                return;
            }
            scanHead(cache.filesExceptLocale(locale), (value, file) -> RecoveryResult.headLocale(value, file.locale()));
            if (done()) {
                return;
            }
            scanHistory(cache.filesForLocale(locale), (value, file, commit) -> RecoveryResult.history(value, commit));
            if (done()) {
                return;
            }
            scanHistory(
                    cache.filesExceptLocale(locale),
                    (value, file, commit) -> RecoveryResult.historyLocale(value, file.locale(), commit));
            if (done()) {
                return;
            }
            fromSourceFiles();
        }

        private boolean done() {
            return pending.isEmpty() || options.cancellation().isCancellationRequested();
        }

        private void fromSessionCache() {
            for (var state : List.copyOf(pending.values())) {
                var cached = results.get(new ResultKey(workspace, locale, state.key));
                if (cached != null) {
                    pending.remove(state.key);
                    found.put(state.key, cached);
                }
            }
        }

        private void fromExtractionRef() {
            if (!cache.history().isAvailable()) {
                return;
            }
            var ref = options.extractRef();
            if (ref == null) {
                ref = new ExtractionRefTracker(workspace, cache.history())
                        .getExtractCommitRef()
                        .map(ExtractionRefTracker.ScriptCommitRef::commitHash)
                        .orElse(null);
            }
            if (ref == null) {
                return;
            }
            for (var file : cache.filesForLocale(locale)) {
                if (done()) {
                    return;
                }
                var tree = cache.treeAt(file.relativePath(), ref);
                for (var state : List.copyOf(pending.values())) {
                    var value = lookup(tree, state, false);
                    if (value != null) {
                        recordHit(state, RecoveryResult.ref(value, ref));
                    }
                }
            }
        }

        private void scanHead(List<LocaleFileInfo> files, HeadTag tag) {
            for (var file : files) {
                if (done()) {
                    return;
                }
                var tree = cache.headTree(file);
                if (tree == null) {
                    continue;
                }
                for (var state : List.copyOf(pending.values())) {
                    var value = lookup(tree, state, false);
                    if (value != null) {
                        recordHit(state, tag.apply(value, file));
                    }
                }
            }
        }

        private void scanHistory(List<LocaleFileInfo> files, HistoryTag tag) {
            if (!cache.history().isAvailable()) {
                return;
            }
            var window = new HistoryWindow(options.daysBack(), options.maxCommits());
            int groupSize = cache.config().parallelBatchSize();
            for (var file : files) {
                if (done() || historyCandidates().isEmpty()) {
                    return;
                }
                var commits = cache.commits(file, window);
                for (var group : Lists.partition(commits, groupSize)) {
                    if (done() || historyCandidates().isEmpty()) {
                        return;
                    }
                    if (parallel) {
                        prefetch(file, group);
                    }
                    for (var commit : group) {
                        if (options.cancellation().isCancellationRequested()) {
                            return;
                        }
                        var tree = cache.treeAt(file.relativePath(), commit.hash());
                        if (tree == null) {
                            continue;
                        }
                        for (var state : historyCandidates()) {
                            var value = lookup(tree, state, true);
                            if (value != null) {
                                recordHit(state, tag.apply(value, file, commit.hash()));
                            }
                        }
                    }
                }
            }
        }

        private List<KeyState> historyCandidates() {
            return pending.values().stream().filter(s -> !s.historyAbandoned).toList();
        }

        private void prefetch(LocaleFileInfo file, List<CommitRef> group) {
            var futures = group.stream()
                    .map(commit -> CompletableFuture.runAsync(
                            () -> cache.treeAt(file.relativePath(), commit.hash()), executor))
                    .toArray(CompletableFuture[]::new);
            try {
                CompletableFuture.allOf(futures).join();
            } catch (CompletionException e) {
                logger.debug("Prefetch for {} failed, continuing sequentially: {}", file.relativePath(), e.getMessage());
            }
        }

        private void fromSourceFiles() {
            cache.buildSourceFileKeyIndex(pending.keySet());
            var sources = new SourceFileRecovery(cache);
            for (var group : Lists.partition(List.copyOf(pending.values()), cache.config().parallelBatchSize())) {
                if (options.cancellation().isCancellationRequested()) {
                    return;
                }
                if (parallel) {
                    prefetchSources(sources, group);
                }
                for (var state : group) {
                    if (options.cancellation().isCancellationRequested()) {
                        return;
                    }
                    var result = sources.recover(
                            state.key, options.daysBack(), options.cancellation(), value -> isPlausible(state, value));
                    if (result != null) {
                        recordHit(state, result);
                    }
                }
            }
        }

        private void prefetchSources(SourceFileRecovery sources, List<KeyState> group) {
            var futures = group.stream()
                    .map(state -> CompletableFuture.runAsync(
                            () -> sources.prefetch(state.key, options.daysBack()), executor))
                    .toArray(CompletableFuture[]::new);
            try {
                CompletableFuture.allOf(futures).join();
            } catch (CompletionException e) {
                logger.debug("Source prefetch failed, continuing sequentially: {}", e.getMessage());
            }
        }

        /** First non-suspicious value under any of the key's path variations. */
        private @Nullable String lookup(@Nullable JsonNode tree, KeyState state, boolean inHistory) {
            if (tree == null) {
                return null;
            }
            for (var variation : state.variations) {
                var value = LocaleTree.getNestedValue(tree, variation);
                if (value == null) {
                    continue;
                }
                var reason = SuspiciousValueDetector.detect(state.key, value, knownOptionsFor(state, value));
                if (reason.isEmpty()) {
                    return value;
                }
                logger.debug("Skipping suspicious value for {} at {}: {}", state.key, variation, reason.get());
                if (inHistory && reason.get() == SuspiciousValueDetector.Reason.BADLY_EXTRACTED) {
                    state.historyAbandoned = true;
                    return null;
                }
            }
            return null;
        }

        private boolean isPlausible(KeyState state, String value) {
            return !SuspiciousValueDetector.isSuspicious(state.key, value, knownOptionsFor(state, value));
        }

        private @Nullable List<String> knownOptionsFor(KeyState state, String value) {
            if (!TextRules.hasPlaceholder(value)) {
                return null;
            }
            return state.knownOptions.get().orElse(null);
        }

        /**
         * Caller-supplied option names, else the union of option names at the key's call sites. Empty when there is
         * no call site to learn from.
         */
        private Optional<List<String>> resolveKnownOptions(String key) {
            if (options.knownOptionNames() != null) {
                return Optional.of(options.knownOptionNames());
            }
            var files = cache.buildSourceFileKeyIndex(allKeys).filesFor(key);
            if (files.isEmpty()) {
                return Optional.empty();
            }
            var names = new LinkedHashSet<String>();
            for (var file : files) {
                var content = cache.sourceContent(file);
                if (content != null) {
                    names.addAll(TranslationCalls.knownOptionNames(content, key));
                }
            }
            return Optional.of(new ArrayList<>(names));
        }

        private void recordHit(KeyState state, RecoveryResult result) {
            pending.remove(state.key);
            found.put(state.key, result);
            results.put(new ResultKey(workspace, locale, state.key), result);
            logger.debug("Recovered {} from {}", state.key, result.source());
        }
    }

    @FunctionalInterface
    private interface HeadTag {
        RecoveryResult apply(String value, LocaleFileInfo file);
    }

    @FunctionalInterface
    private interface HistoryTag {
        RecoveryResult apply(String value, LocaleFileInfo file, String commit);
    }
}
