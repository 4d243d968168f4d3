package ai.relocale.lock;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Per-file mutual exclusion for read-modify-write sequences. Each path has a single fair slot; callers queue for it
 * and give up with {@link MutexTimeoutException} once their timeout elapses, so a wedged holder delays others by at
 * most that timeout. Not re-entrant.
 */
public class FileMutex {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final ConcurrentMap<Path, Semaphore> slots = new ConcurrentHashMap<>();
    private final Duration timeout;

    public FileMutex() {
        this(DEFAULT_TIMEOUT);
    }

    public FileMutex(Duration timeout) {
        this.timeout = timeout;
    }

    public <T> T withFileMutex(Path path, Supplier<T> operation) {
        return withFileMutex(path, timeout, operation);
    }

    public <T> T withFileMutex(Path path, Duration waitTimeout, Supplier<T> operation) {
        var key = path.toAbsolutePath().normalize();
        var slot = slots.computeIfAbsent(key, k -> new Semaphore(1, true));
        boolean acquired;
        try {
            acquired = slot.tryAcquire(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MutexTimeoutException("Interrupted waiting for " + key);
        }
        if (!acquired) {
            throw new MutexTimeoutException("Timed out after " + waitTimeout.toMillis() + "ms waiting for " + key);
        }
        try {
            return operation.get();
        } finally {
            slot.release();
        }
    }

    public boolean isLocked(Path path) {
        var slot = slots.get(path.toAbsolutePath().normalize());
        return slot != null && slot.availablePermits() == 0;
    }

    public static class MutexTimeoutException extends OperationLockManager.LockException {
        public MutexTimeoutException(String message) {
            super(message);
        }
    }
}
