package ai.relocale.lock;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Serializes bulk operations that mutate locale files, and guards individual file writes.
 *
 * <p>The global lock is either idle or held by one {@link OperationType} with a hold count. A request of the held type
 * nests and bumps the count; a request of any other type fails fast or queues (FIFO) with a timeout. Releasing the last
 * hold hands the lock straight to the next waiter. A hold older than {@link #LOCK_TIMEOUT} is reclaimed the next time
 * {@link #isHeld()} runs.
 *
 * <p>File locks are independent of the global lock: a file held by a different operation type is unavailable unless
 * its lock is older than {@link #FILE_LOCK_TIMEOUT}, and successful acquisitions across all files are spaced by at
 * least {@link #FILE_WRITE_SPACING}.
 *
 * <p>One instance is shared by everything that writes locale files in a process; tests create their own.
 */
public class OperationLockManager {
    private static final Logger logger = LogManager.getLogger(OperationLockManager.class);

    public static final Duration LOCK_TIMEOUT = Duration.ofMinutes(5);
    public static final Duration FILE_LOCK_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration FILE_WRITE_SPACING = Duration.ofMillis(50);
    public static final Duration DEFAULT_WAIT_TIMEOUT = Duration.ofSeconds(30);

    /** How {@link #acquire} behaves when another operation type holds the lock. */
    public record AcquireOptions(boolean waitForRelease, Duration timeout, CancellationToken cancellationToken) {
        public static AcquireOptions failFast() {
            return new AcquireOptions(false, Duration.ZERO, CancellationToken.NONE);
        }

        public static AcquireOptions waitUpTo(Duration timeout) {
            return new AcquireOptions(true, timeout, CancellationToken.NONE);
        }

        public AcquireOptions withCancellation(CancellationToken token) {
            return new AcquireOptions(waitForRelease, timeout, token);
        }
    }

    /** Point-in-time snapshot for diagnostics. */
    public record Stats(@Nullable OperationLock globalLock, int holdCount, int fileLockCount, int waitingCount) {}

    private sealed interface LockState permits Idle, Held {}

    private record Idle() implements LockState {}

    private record Held(OperationLock lock, int count) implements LockState {}

    private record Waiter(
            OperationType type, String description, CancellationToken token, CompletableFuture<Void> granted) {}

    private static final Idle IDLE = new Idle();

    private final Clock clock;
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private final Map<Path, FileLock> fileLocks = new HashMap<>();
    private LockState state = IDLE;
    private Instant lastFileAcquire = Instant.EPOCH;

    public OperationLockManager() {
        this(Clock.systemUTC());
    }

    public OperationLockManager(Clock clock) {
        this.clock = clock;
    }

    /**
     * Acquires the global lock for {@code type}.
     *
     * @return true if acquired (or nested), false if another type holds it and {@code options} say not to wait
     * @throws LockTimeoutException if waiting and the lock was not handed over within the timeout
     * @throws LockException if the wait was aborted by {@link #forceReleaseAll()} or an interrupt
     */
    public boolean acquire(OperationType type, String description, AcquireOptions options) {
        Waiter waiter;
        synchronized (this) {
            cleanupStaleLocks();
            if (state instanceof Held held) {
                if (held.lock().type() == type) {
                    state = new Held(held.lock(), held.count() + 1);
                    return true;
                }
                if (!options.waitForRelease()) {
                    return false;
                }
                waiter = new Waiter(type, description, options.cancellationToken(), new CompletableFuture<>());
                waiters.addLast(waiter);
                logger.debug("{} queued behind {} ({} waiting)", type, held.lock().type(), waiters.size());
            } else {
                state = new Held(new OperationLock(type, description, clock.instant(), options.cancellationToken()), 1);
                return true;
            }
        }
        return awaitPromotion(waiter, options.timeout());
    }

    private boolean awaitPromotion(Waiter waiter, Duration timeout) {
        try {
            waiter.granted().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            synchronized (this) {
                if (waiters.remove(waiter)) {
                    var blocker = currentOperation().orElse(null);
                    throw new LockTimeoutException(
                            "Timeout waiting for lock: " + blockingOperationMessage(), blocker);
                }
            }
            // Handed over or rejected between the timeout and the removal
            try {
                waiter.granted().join();
                return true;
            } catch (CompletionException ce) {
                throw asLockException(ce.getCause());
            }
        } catch (ExecutionException e) {
            throw asLockException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            synchronized (this) {
                if (!waiters.remove(waiter) && !waiter.granted().isCompletedExceptionally()) {
                    release(waiter.type());
                }
            }
            throw new LockException("Interrupted while waiting for lock", e);
        }
    }

    private static LockException asLockException(Throwable cause) {
        return cause instanceof LockException le ? le : new LockException("Lock wait failed", cause);
    }

    /** Drops one hold of {@code type}. No-op unless {@code type} is the current holder. */
    public synchronized void release(OperationType type) {
        if (!(state instanceof Held held) || held.lock().type() != type) {
            return;
        }
        if (held.count() > 1) {
            state = new Held(held.lock(), held.count() - 1);
            return;
        }
        promoteNextWaiter();
    }

    private void promoteNextWaiter() {
        assert Thread.holdsLock(this);
        var next = waiters.pollFirst();
        if (next == null) {
            state = IDLE;
            return;
        }
        state = new Held(new OperationLock(next.type(), next.description(), clock.instant(), next.token()), 1);
        logger.debug("Lock handed over to {}", next.type());
        next.granted().complete(null);
    }

    /** Whether an operation holds the global lock. Reclaims a hold older than {@link #LOCK_TIMEOUT}. */
    public synchronized boolean isHeld() {
        if (!(state instanceof Held held)) {
            return false;
        }
        if (isOlderThan(held.lock().startTime(), LOCK_TIMEOUT)) {
            logger.warn(
                    "Stale lock auto-release for {} (\"{}\", started {})",
                    held.lock().type(),
                    held.lock().description(),
                    held.lock().startTime());
            promoteNextWaiter();
            return state instanceof Held;
        }
        return true;
    }

    public synchronized Optional<OperationLock> currentOperation() {
        if (!isHeld()) {
            return Optional.empty();
        }
        return Optional.of(((Held) state).lock());
    }

    /** Human-readable description of the blocking operation, or the empty string when idle. */
    public synchronized String blockingOperationMessage() {
        return currentOperation()
                .map(op -> "\"%s\" is in progress (%ds elapsed)"
                        .formatted(
                                op.description(),
                                Duration.between(op.startTime(), clock.instant())
                                        .toSeconds()))
                .orElse("");
    }

    /** Requests cancellation of the running operation. Returns false when idle. */
    public synchronized boolean cancelCurrentOperation() {
        var current = currentOperation();
        current.ifPresent(op -> op.cancellationToken().cancel());
        return current.isPresent();
    }

    private void cleanupStaleLocks() {
        assert Thread.holdsLock(this);
        fileLocks.values().removeIf(lock -> isOlderThan(lock.timestamp(), FILE_LOCK_TIMEOUT));
        isHeld();
    }

    private boolean isOlderThan(Instant start, Duration limit) {
        return Duration.between(start, clock.instant()).compareTo(limit) > 0;
    }

    /**
     * Takes the file lock for {@code holder}. Returns false if another operation type holds a fresh lock on the file.
     * Blocks briefly so that acquisitions across all files are at least {@link #FILE_WRITE_SPACING} apart.
     */
    public boolean acquireFileLock(Path path, OperationType holder) {
        var key = path.toAbsolutePath().normalize();
        Duration delay;
        synchronized (this) {
            var existing = fileLocks.get(key);
            if (existing != null) {
                if (isOlderThan(existing.timestamp(), FILE_LOCK_TIMEOUT)) {
                    logger.warn("Releasing stale file lock for {} held by {}", key, existing.holder());
                    fileLocks.remove(key);
                } else if (existing.holder() != holder) {
                    return false;
                }
            }
            var now = clock.instant();
            var slot = lastFileAcquire.plus(FILE_WRITE_SPACING);
            if (slot.isBefore(now)) {
                slot = now;
            }
            lastFileAcquire = slot;
            fileLocks.put(key, new FileLock(key, holder, slot));
            delay = Duration.between(now, slot);
        }
        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return true;
    }

    public synchronized void releaseFileLock(Path path) {
        fileLocks.remove(path.toAbsolutePath().normalize());
    }

    public synchronized Optional<FileLock> fileLock(Path path) {
        return Optional.ofNullable(fileLocks.get(path.toAbsolutePath().normalize()));
    }

    /**
     * Runs {@code fn} holding the file lock.
     *
     * @throws FileLockUnavailableException if another operation type holds the file
     */
    public <T> T withFileLock(Path path, OperationType holder, Supplier<T> fn) {
        if (!acquireFileLock(path, holder)) {
            throw new FileLockUnavailableException("Cannot acquire file lock for " + path);
        }
        try {
            return fn.get();
        } finally {
            releaseFileLock(path);
        }
    }

    /**
     * Runs {@code fn} holding the global lock for {@code type}, without waiting.
     *
     * @return the result of {@code fn}, or null if another operation holds the lock (a warning naming it is logged)
     */
    public <T> @Nullable T withGlobalLock(
            OperationType type, String description, Function<CancellationToken, T> fn, boolean cancellable) {
        var token = cancellable ? new CancellationToken() : CancellationToken.NONE;
        if (!acquire(type, description, AcquireOptions.failFast().withCancellation(token))) {
            logger.warn(
                    "Cannot start \"{}\": {}. Wait for it to complete or cancel it.",
                    description,
                    blockingOperationMessage());
            return null;
        }
        try {
            return fn.apply(token);
        } finally {
            release(type);
        }
    }

    public <T> @Nullable T withGlobalLock(OperationType type, String description, Supplier<T> fn) {
        return withGlobalLock(type, description, token -> fn.get(), false);
    }

    /** Emergency cleanup: drops every lock and rejects all waiters. */
    public synchronized void forceReleaseAll() {
        logger.warn("Force releasing all locks ({} waiting)", waiters.size());
        state = IDLE;
        fileLocks.clear();
        for (var waiter : waiters) {
            waiter.granted().completeExceptionally(new LockException("All locks force released"));
        }
        waiters.clear();
    }

    public synchronized Stats stats() {
        if (state instanceof Held held) {
            return new Stats(held.lock(), held.count(), fileLocks.size(), waiters.size());
        }
        return new Stats(null, 0, fileLocks.size(), waiters.size());
    }

    public static class LockException extends RuntimeException {
        public LockException(String message) {
            super(message);
        }

        public LockException(String message, @Nullable Throwable cause) {
            super(message, cause);
        }
    }

    /** Raised when a queued request is not served in time. Carries the operation that was blocking it. */
    public static class LockTimeoutException extends LockException {
        private final @Nullable OperationLock blocker;

        public LockTimeoutException(String message, @Nullable OperationLock blocker) {
            super(message);
            this.blocker = blocker;
        }

        public @Nullable OperationLock getBlocker() {
            return blocker;
        }
    }

    public static class FileLockUnavailableException extends LockException {
        public FileLockUnavailableException(String message) {
            super(message);
        }
    }
}
