package ai.relocale.locale;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Finds locale files under the conventional roots. A root may group files per locale ({@code <root>/<locale>/*.json})
 * or hold one file per locale ({@code <root>/<locale>.json}); both layouts are recognized in the same root.
 */
public final class LocaleFileDiscovery {
    private static final Logger logger = LogManager.getLogger(LocaleFileDiscovery.class);

    public static final List<String> LOCALE_ROOTS =
            List.of("resources/js/i18n/auto", "src/i18n", "src/locales", "locales", "i18n");

    private LocaleFileDiscovery() {}

    /** All locale files in the workspace, ordered by root, then locale, then file name. */
    public static List<LocaleFileInfo> discover(Path workspace) {
        var found = new LinkedHashMap<Path, LocaleFileInfo>();
        for (var root : LOCALE_ROOTS) {
            var rootDir = workspace.resolve(root);
            if (!Files.isDirectory(rootDir)) {
                continue;
            }
            for (var info : discoverUnder(workspace, rootDir)) {
                found.putIfAbsent(info.path(), info);
            }
        }
        logger.debug("Discovered {} locale files under {}", found.size(), workspace);
        return List.copyOf(found.values());
    }

    private static List<LocaleFileInfo> discoverUnder(Path workspace, Path rootDir) {
        var result = new ArrayList<LocaleFileInfo>();
        try (Stream<Path> entries = Files.list(rootDir)) {
            for (var entry : entries.sorted(Comparator.comparing(p -> p.getFileName().toString())).toList()) {
                var name = entry.getFileName().toString();
                if (Files.isDirectory(entry)) {
                    result.addAll(groupedFiles(workspace, entry, name));
                } else if (isJson(entry)) {
                    result.add(toInfo(workspace, entry, name.substring(0, name.length() - ".json".length())));
                }
            }
        } catch (IOException e) {
            logger.debug("Could not list locale root {}: {}", rootDir, e.getMessage());
        }
        return result;
    }

    private static List<LocaleFileInfo> groupedFiles(Path workspace, Path localeDir, String locale) {
        try (Stream<Path> files = Files.list(localeDir)) {
            return files.filter(LocaleFileDiscovery::isJson)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .map(p -> toInfo(workspace, p, locale))
                    .toList();
        } catch (IOException e) {
            logger.debug("Could not list locale directory {}: {}", localeDir, e.getMessage());
            return List.of();
        }
    }

    private static boolean isJson(Path path) {
        return Files.isRegularFile(path) && path.getFileName().toString().endsWith(".json");
    }

    private static LocaleFileInfo toInfo(Path workspace, Path file, String locale) {
        return new LocaleFileInfo(file, relativize(workspace, file), locale, file.getFileName().toString());
    }

    public static String relativize(Path workspace, Path file) {
        return workspace.toAbsolutePath()
                .normalize()
                .relativize(file.toAbsolutePath().normalize())
                .toString()
                .replace('\\', '/');
    }
}
