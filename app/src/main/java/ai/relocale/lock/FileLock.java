package ai.relocale.lock;

import java.nio.file.Path;
import java.time.Instant;

public record FileLock(Path path, OperationType holder, Instant timestamp) {}
