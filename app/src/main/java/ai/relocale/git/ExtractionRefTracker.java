package ai.relocale.git;

import ai.relocale.config.RecoveryConfig;
import ai.relocale.history.VersionHistorySource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Remembers the commit that was HEAD right before a bulk i18n script rewrote the workspace, so recovery can read locale
 * values from before the rewrite. Stored as JSON in {@code .relocale/commit-refs.json}; one entry per script, newest
 * {@link #MAX_REFS} kept.
 */
public class ExtractionRefTracker {
    private static final Logger logger = LogManager.getLogger(ExtractionRefTracker.class);
    private static final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static final String STORE_FILE = "commit-refs.json";
    public static final String EXTRACT_SCRIPT = "i18n:extract";
    public static final List<String> REPLACE_SCRIPTS = List.of("i18n:rewrite", "i18n:replace");
    public static final int MAX_REFS = 50;

    /** One recorded script run. {@code timestamp} is epoch milliseconds. */
    public record ScriptCommitRef(String scriptName, String commitHash, long timestamp) {}

    private final Path storeFile;
    private final VersionHistorySource history;
    private final Clock clock;

    public ExtractionRefTracker(Path workspace, VersionHistorySource history) {
        this(workspace, history, Clock.systemUTC());
    }

    public ExtractionRefTracker(Path workspace, VersionHistorySource history, Clock clock) {
        this.storeFile = workspace.resolve(RecoveryConfig.WORKSPACE_DIR).resolve(STORE_FILE);
        this.history = history;
        this.clock = clock;
    }

    /**
     * Records the current HEAD for {@code scriptName}, replacing that script's previous entry.
     *
     * @return the stored entry, or null when HEAD cannot be resolved
     */
    public synchronized @Nullable ScriptCommitRef saveCommitRef(String scriptName) {
        var head = history.headCommit();
        if (head == null) {
            logger.warn("Could not get commit hash for {}", scriptName);
            return null;
        }
        var ref = new ScriptCommitRef(scriptName, head, clock.millis());
        var updated = new ArrayList<>(refs());
        updated.removeIf(r -> r.scriptName().equals(scriptName));
        updated.add(ref);
        if (updated.size() > MAX_REFS) {
            updated = new ArrayList<>(updated.subList(updated.size() - MAX_REFS, updated.size()));
        }
        try {
            Files.createDirectories(storeFile.getParent());
            Files.writeString(storeFile, objectMapper.writeValueAsString(updated), StandardCharsets.UTF_8);
            logger.debug("Recorded {} at {}", scriptName, ref.commitHash());
        } catch (IOException e) {
            logger.warn("Could not persist commit ref for {} to {}: {}", scriptName, storeFile, e.getMessage());
        }
        return ref;
    }

    /** All stored entries, oldest first. */
    public synchronized List<ScriptCommitRef> refs() {
        if (!Files.isRegularFile(storeFile)) {
            return List.of();
        }
        try {
            return objectMapper.readValue(
                    Files.readString(storeFile, StandardCharsets.UTF_8), new TypeReference<List<ScriptCommitRef>>() {});
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring corrupt commit ref store {}: {}", storeFile, e.getOriginalMessage());
            return List.of();
        } catch (IOException e) {
            logger.debug("Could not read {}: {}", storeFile, e.getMessage());
            return List.of();
        }
    }

    public Optional<ScriptCommitRef> getCommitRef(String scriptName) {
        return newest(List.of(scriptName));
    }

    public Optional<ScriptCommitRef> getExtractCommitRef() {
        return newest(List.of(EXTRACT_SCRIPT));
    }

    public Optional<ScriptCommitRef> getReplaceCommitRef() {
        return newest(REPLACE_SCRIPTS);
    }

    private Optional<ScriptCommitRef> newest(List<String> scriptNames) {
        return refs().stream()
                .filter(r -> scriptNames.contains(r.scriptName()))
                .max(Comparator.comparingLong(ScriptCommitRef::timestamp));
    }
}
