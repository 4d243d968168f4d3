package ai.relocale.config;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tunables for recovery. Defaults come from {@code relocale-defaults.properties} on the classpath and may be overridden
 * per workspace in {@code .relocale/recovery.properties}. Invalid values are logged and replaced by the default.
 *
 * @param daysBack history window for batch recovery
 * @param maxCommitsPerFile commits inspected per locale file in batch recovery
 * @param singleKeyDaysBack history window for single-key recovery
 * @param singleKeyMaxCommits commits inspected per locale file in single-key recovery
 * @param sourceMaxCommits commits inspected per source file when mining diffs
 * @param parallelBatchSize width of the parallel fetch groups in batch recovery
 * @param maxSourceFiles cap on source files scanned for key references
 * @param sourceFileGlob file-name glob for source files that may call the translator
 * @param sourceExcludes directory names never descended into
 */
public record RecoveryConfig(
        int daysBack,
        int maxCommitsPerFile,
        int singleKeyDaysBack,
        int singleKeyMaxCommits,
        int sourceMaxCommits,
        int parallelBatchSize,
        int maxSourceFiles,
        String sourceFileGlob,
        List<String> sourceExcludes) {
    private static final Logger logger = LogManager.getLogger(RecoveryConfig.class);

    public static final String DEFAULTS_RESOURCE = "/relocale-defaults.properties";
    public static final String WORKSPACE_DIR = ".relocale";
    public static final String WORKSPACE_FILE = "recovery.properties";

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private static final RecoveryConfig BUILT_IN =
            new RecoveryConfig(120, 15, 365, 100, 50, 5, 500, "*.{ts,tsx,js,jsx,vue}", List.of(
                    "node_modules", ".git", "dist", "build"));

    /** Classpath defaults only. */
    public static RecoveryConfig defaults() {
        return fromProperties(loadDefaults());
    }

    /** Classpath defaults overridden by the workspace file, if present. */
    public static RecoveryConfig load(Path workspace) {
        var props = new Properties(loadDefaults());
        var file = workspace.resolve(WORKSPACE_DIR).resolve(WORKSPACE_FILE);
        if (Files.isRegularFile(file)) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                props.load(reader);
                logger.debug("Loaded recovery overrides from {}", file);
            } catch (IOException e) {
                logger.warn("Could not read {}, using defaults: {}", file, e.getMessage());
            }
        }
        return fromProperties(props);
    }

    private static Properties loadDefaults() {
        var props = new Properties();
        try (InputStream in = RecoveryConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.warn("{} not found on classpath, using built-in defaults", DEFAULTS_RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}: {}", DEFAULTS_RESOURCE, e.getMessage());
        }
        return props;
    }

    static RecoveryConfig fromProperties(Properties props) {
        return new RecoveryConfig(
                positiveInt(props, "daysBack", BUILT_IN.daysBack()),
                positiveInt(props, "maxCommitsPerFile", BUILT_IN.maxCommitsPerFile()),
                positiveInt(props, "singleKeyDaysBack", BUILT_IN.singleKeyDaysBack()),
                positiveInt(props, "singleKeyMaxCommits", BUILT_IN.singleKeyMaxCommits()),
                positiveInt(props, "sourceMaxCommits", BUILT_IN.sourceMaxCommits()),
                positiveInt(props, "parallelBatchSize", BUILT_IN.parallelBatchSize()),
                positiveInt(props, "maxSourceFiles", BUILT_IN.maxSourceFiles()),
                props.getProperty("sourceFileGlob", BUILT_IN.sourceFileGlob()).trim(),
                props.getProperty("sourceExcludes") == null
                        ? BUILT_IN.sourceExcludes()
                        : LIST_SPLITTER.splitToList(props.getProperty("sourceExcludes")));
    }

    private static int positiveInt(Properties props, String name, int fallback) {
        var raw = props.getProperty(name);
        if (raw == null) {
            return fallback;
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid value for {}: '{}', using {}", name, raw, fallback);
            return fallback;
        }
        if (value <= 0) {
            logger.warn("Value for {} must be positive, got {}, using {}", name, value, fallback);
            return fallback;
        }
        return value;
    }
}
