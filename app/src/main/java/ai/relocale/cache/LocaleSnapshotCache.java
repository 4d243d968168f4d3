package ai.relocale.cache;

import ai.relocale.config.RecoveryConfig;
import ai.relocale.git.GitHistorySource;
import ai.relocale.history.CommitRef;
import ai.relocale.history.VersionHistorySource;
import ai.relocale.locale.LocaleFileDiscovery;
import ai.relocale.locale.LocaleFileInfo;
import ai.relocale.locale.LocaleJson;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Per-workspace memo of everything recovery reads: the discovered locale files and their current trees, locale-file
 * history per lookback window (fetched with one batched query), parsed trees and raw source text at commits, diffs,
 * and the source-file-to-key index. Misses are cached too. Entries never expire; {@link #clear()} drops everything.
 *
 * <p>Instances are owned by a {@link Registry} held by the host process.
 */
public class LocaleSnapshotCache {
    private static final Logger logger = LogManager.getLogger(LocaleSnapshotCache.class);

    /** Lookback bounds for a history query. */
    public record HistoryWindow(int daysBack, int maxCommits) {
        Instant since() {
            return Instant.now().minus(Duration.ofDays(daysBack));
        }
    }

    private record Snapshot(String defaultLocale, List<LocaleFileInfo> files, Map<String, Optional<ObjectNode>> head) {}

    private final Path workspace;
    private final VersionHistorySource history;
    private final RecoveryConfig config;

    private volatile @Nullable Snapshot snapshot;
    private volatile @Nullable HistoryWindow defaultWindow;
    private volatile SourceKeyIndex sourceIndex = SourceKeyIndex.EMPTY;
    private final ConcurrentMap<HistoryWindow, Map<String, List<CommitRef>>> localeHistory = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<CommitRef>> sourceHistory = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Optional<ObjectNode>> treesAtCommit = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Optional<String>> sourceAtCommit = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Optional<String>> diffs = new ConcurrentHashMap<>();

    public LocaleSnapshotCache(Path workspace, VersionHistorySource history, RecoveryConfig config) {
        this.workspace = workspace;
        this.history = history;
        this.config = config;
    }

    public Path workspace() {
        return workspace;
    }

    public VersionHistorySource history() {
        return history;
    }

    public RecoveryConfig config() {
        return config;
    }

    /**
     * Discovers locale files and reads their current content, default locale first. History is not touched here; it
     * is fetched on first use. Re-initializing with the same default locale is a no-op.
     */
    public synchronized void initialize(String defaultLocale, int daysBack) {
        var current = snapshot;
        if (current != null && current.defaultLocale().equals(defaultLocale)) {
            return;
        }
        var discovered = LocaleFileDiscovery.discover(workspace);
        var ordered = new ArrayList<LocaleFileInfo>();
        discovered.stream().filter(f -> f.locale().equals(defaultLocale)).forEach(ordered::add);
        discovered.stream().filter(f -> !f.locale().equals(defaultLocale)).forEach(ordered::add);

        var head = new HashMap<String, Optional<ObjectNode>>();
        for (var file : ordered) {
            head.put(file.relativePath(), Optional.ofNullable(LocaleJson.read(file.path())));
        }
        snapshot = new Snapshot(defaultLocale, List.copyOf(ordered), Map.copyOf(head));
        defaultWindow = new HistoryWindow(daysBack, config.maxCommitsPerFile());
        logger.debug("Locale cache for {} initialized with {} files", workspace, ordered.size());
    }

    public boolean isInitialized() {
        return snapshot != null;
    }

    private Snapshot requireSnapshot() {
        var current = snapshot;
        if (current == null) {
            throw new IllegalStateException("LocaleSnapshotCache for " + workspace + " is not initialized");
        }
        return current;
    }

    public List<LocaleFileInfo> localeFiles() {
        return requireSnapshot().files();
    }

    public List<LocaleFileInfo> filesForLocale(String locale) {
        return localeFiles().stream().filter(f -> f.locale().equals(locale)).toList();
    }

    public List<LocaleFileInfo> filesExceptLocale(String locale) {
        return localeFiles().stream().filter(f -> !f.locale().equals(locale)).toList();
    }

    /** Current tree of {@code file} as read at initialization; null if missing or unparseable. */
    public @Nullable ObjectNode headTree(LocaleFileInfo file) {
        return requireSnapshot().head().getOrDefault(file.relativePath(), Optional.empty()).orElse(null);
    }

    /** History of {@code file} within the window given at initialization. */
    public List<CommitRef> commits(LocaleFileInfo file) {
        var window = defaultWindow;
        if (window == null) {
            throw new IllegalStateException("LocaleSnapshotCache for " + workspace + " is not initialized");
        }
        return commits(file, window);
    }

    /**
     * History of {@code file} within {@code window}, newest first. The first request for a window fetches every
     * locale file's history in one batched query.
     */
    public List<CommitRef> commits(LocaleFileInfo file, HistoryWindow window) {
        if (!history.isAvailable()) {
            return List.of();
        }
        var byPath = localeHistory.computeIfAbsent(window, this::prefetchLocaleHistory);
        return byPath.getOrDefault(file.relativePath(), List.of());
    }

    private Map<String, List<CommitRef>> prefetchLocaleHistory(HistoryWindow window) {
        var paths = localeFiles().stream().map(LocaleFileInfo::relativePath).toList();
        var fetched = history.listCommits(paths, window.since(), window.maxCommits());
        logger.debug(
                "Prefetched history for {} locale files ({} days, {} commits max)",
                paths.size(),
                window.daysBack(),
                window.maxCommits());
        return Map.copyOf(fetched);
    }

    /** Locale tree of {@code relativePath} at {@code commit}; null when absent or unparseable. */
    public @Nullable ObjectNode treeAt(String relativePath, String commit) {
        return treesAtCommit
                .computeIfAbsent(cacheKey(relativePath, commit), k -> Optional.ofNullable(
                        LocaleJson.parseObject(history.contentAt(relativePath, commit))))
                .orElse(null);
    }

    /** Raw text of a source file at {@code commit}. */
    public @Nullable String sourceAt(String relativePath, String commit) {
        return sourceAtCommit
                .computeIfAbsent(cacheKey(relativePath, commit), k -> Optional.ofNullable(
                        history.contentAt(relativePath, commit)))
                .orElse(null);
    }

    public List<CommitRef> sourceCommits(String relativePath, HistoryWindow window) {
        if (!history.isAvailable()) {
            return List.of();
        }
        return sourceHistory.computeIfAbsent(
                relativePath + "|" + window.daysBack() + "|" + window.maxCommits(),
                k -> List.copyOf(history.listCommits(relativePath, window.since(), window.maxCommits())));
    }

    public @Nullable String diff(String relativePath, String fromCommit, String toCommit) {
        return diffs.computeIfAbsent(
                        relativePath + "@" + fromCommit + ".." + toCommit,
                        k -> Optional.ofNullable(history.diff(relativePath, fromCommit, toCommit)))
                .orElse(null);
    }

    /** Scans source files once for all of {@code keys} not yet indexed. */
    public synchronized SourceKeyIndex buildSourceFileKeyIndex(Collection<String> keys) {
        var missing = keys.stream().filter(k -> !sourceIndex.covers(List.of(k))).distinct().toList();
        if (!missing.isEmpty()) {
            sourceIndex = sourceIndex.merge(SourceKeyIndex.build(workspace, missing, config));
        }
        return sourceIndex;
    }

    public List<String> sourceFilesReferencing(String key) {
        return buildSourceFileKeyIndex(List.of(key)).filesFor(key);
    }

    public @Nullable String sourceContent(String relativePath) {
        return sourceIndex.content(relativePath);
    }

    /** Drops every cached entry; the next use must call {@link #initialize} again. */
    public synchronized void clear() {
        snapshot = null;
        defaultWindow = null;
        sourceIndex = SourceKeyIndex.EMPTY;
        localeHistory.clear();
        sourceHistory.clear();
        treesAtCommit.clear();
        sourceAtCommit.clear();
        diffs.clear();
        logger.debug("Locale cache for {} cleared", workspace);
    }

    private static String cacheKey(String relativePath, String commit) {
        return relativePath + "@" + commit;
    }

    /** Owns one cache per workspace, and the history source each was opened with. */
    public static final class Registry implements AutoCloseable {
        private final ConcurrentMap<Path, LocaleSnapshotCache> caches = new ConcurrentHashMap<>();
        private final Function<Path, VersionHistorySource> historyFactory;
        private final Function<Path, RecoveryConfig> configLoader;

        public Registry() {
            this(GitHistorySource::open, RecoveryConfig::load);
        }

        public Registry(Function<Path, VersionHistorySource> historyFactory, Function<Path, RecoveryConfig> configLoader) {
            this.historyFactory = historyFactory;
            this.configLoader = configLoader;
        }

        public LocaleSnapshotCache forWorkspace(Path workspace) {
            var key = workspace.toAbsolutePath().normalize();
            return caches.computeIfAbsent(
                    key, ws -> new LocaleSnapshotCache(ws, historyFactory.apply(ws), configLoader.apply(ws)));
        }

        /** Clears the content of every cache. History sources stay open. */
        public void clearAll() {
            caches.values().forEach(LocaleSnapshotCache::clear);
        }

        /** Clears every cache and closes the history sources that hold resources. */
        @Override
        public void close() {
            for (var cache : caches.values()) {
                cache.clear();
                if (cache.history() instanceof AutoCloseable closeable) {
                    try {
                        closeable.close();
                    } catch (Exception e) {
                        logger.warn("Could not close history for {}: {}", cache.workspace(), e.getMessage());
                    }
                }
            }
            caches.clear();
        }
    }
}
