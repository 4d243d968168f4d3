package ai.relocale.locale;

import java.nio.file.Path;

/**
 * A locale JSON file found under one of the known locale roots.
 *
 * @param relativePath workspace-relative, forward slashes
 */
public record LocaleFileInfo(Path path, String relativePath, String locale, String fileName) {}
