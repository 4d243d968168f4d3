package ai.relocale.cache;

import ai.relocale.config.RecoveryConfig;
import ai.relocale.locale.LocaleFileDiscovery;
import ai.relocale.text.TranslationCalls;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Which source files call the translator with which keys. Built by scanning the workspace once for a set of keys;
 * the content of every referencing file is kept for placeholder and option-name lookups.
 */
public final class SourceKeyIndex {
    private static final Logger logger = LogManager.getLogger(SourceKeyIndex.class);

    static final SourceKeyIndex EMPTY = new SourceKeyIndex(Set.of(), Map.of(), Map.of());

    private final Set<String> keys;
    private final Map<String, List<String>> filesByKey;
    private final Map<String, String> contentByFile;

    private SourceKeyIndex(Set<String> keys, Map<String, List<String>> filesByKey, Map<String, String> contentByFile) {
        this.keys = keys;
        this.filesByKey = filesByKey;
        this.contentByFile = contentByFile;
    }

    public static SourceKeyIndex build(Path workspace, Collection<String> keys, RecoveryConfig config) {
        var files = listSourceFiles(workspace, config);
        var filesByKey = new HashMap<String, List<String>>();
        var contentByFile = new HashMap<String, String>();
        for (var file : files) {
            String content;
            try {
                content = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                logger.debug("Skipping unreadable source file {}: {}", file, e.getMessage());
                continue;
            }
            var relativePath = LocaleFileDiscovery.relativize(workspace, file);
            for (var key : keys) {
                if (TranslationCalls.searchNeedles(key).stream().anyMatch(content::contains)) {
                    filesByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(relativePath);
                    contentByFile.put(relativePath, content);
                }
            }
        }
        logger.debug("Indexed {} keys over {} source files", keys.size(), files.size());
        return new SourceKeyIndex(Set.copyOf(keys), filesByKey, contentByFile);
    }

    /** Source files under {@code workspace} matching the configured glob, sorted, at most the configured count. */
    static List<Path> listSourceFiles(Path workspace, RecoveryConfig config) {
        var matcher = FileSystems.getDefault().getPathMatcher("glob:" + config.sourceFileGlob());
        var excludes = Set.copyOf(config.sourceExcludes());
        var found = new ArrayList<Path>();
        try {
            Files.walkFileTree(workspace, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    var name = dir.getFileName();
                    if (!dir.equals(workspace) && name != null && excludes.contains(name.toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && matcher.matches(file.getFileName())) {
                        found.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    logger.debug("Cannot visit {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            logger.debug("Source scan of {} failed: {}", workspace, e.getMessage());
        }
        found.sort(null);
        if (found.size() > config.maxSourceFiles()) {
            logger.debug("Capping source scan at {} of {} files", config.maxSourceFiles(), found.size());
            return List.copyOf(found.subList(0, config.maxSourceFiles()));
        }
        return found;
    }

    public boolean covers(Collection<String> wanted) {
        return keys.containsAll(wanted);
    }

    /** Workspace-relative paths of files calling {@code key}, in path order. */
    public List<String> filesFor(String key) {
        return filesByKey.getOrDefault(key, List.of());
    }

    public @Nullable String content(String relativePath) {
        return contentByFile.get(relativePath);
    }

    /** An index answering for the keys of both this index and {@code other}; {@code other} wins on overlap. */
    SourceKeyIndex merge(SourceKeyIndex other) {
        var mergedKeys = new HashSet<>(keys);
        mergedKeys.addAll(other.keys);
        var mergedFiles = new HashMap<>(filesByKey);
        mergedFiles.putAll(other.filesByKey);
        var mergedContent = new HashMap<>(contentByFile);
        mergedContent.putAll(other.contentByFile);
        return new SourceKeyIndex(Set.copyOf(mergedKeys), mergedFiles, mergedContent);
    }
}
