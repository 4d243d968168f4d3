package ai.relocale.lock;

import java.time.Instant;

/** The operation currently holding the global lock. */
public record OperationLock(
        OperationType type, String description, Instant startTime, CancellationToken cancellationToken) {}
