package ai.relocale.lock;

import static org.junit.jupiter.api.Assertions.*;

import ai.relocale.lock.OperationLockManager.AcquireOptions;
import ai.relocale.testutil.MutableClock;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.Test;

class OperationLockManagerTest {

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not reached in time");
            }
            Thread.sleep(5);
        }
    }

    @Test
    void testSecondOperationRejectedWhileFirstRuns() throws Exception {
        var locks = new OperationLockManager();
        var started = new CountDownLatch(1);
        var finish = new CountDownLatch(1);

        var first = new Thread(() -> locks.withGlobalLock(OperationType.TRANSLATION_PROJECT, "Translate project", () -> {
            started.countDown();
            try {
                finish.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "done";
        }));
        first.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertNull(locks.withGlobalLock(OperationType.CLEANUP_UNUSED, "Remove unused keys", () -> "cleaned"));

        finish.countDown();
        first.join(5000);
        assertEquals("cleaned", locks.withGlobalLock(OperationType.CLEANUP_UNUSED, "Remove unused keys", () -> "cleaned"));
        assertFalse(locks.isHeld());
    }

    @Test
    void testAcquireOptionsWaitMode() {
        var token = new CancellationToken();

        assertFalse(AcquireOptions.failFast().waitForRelease());
        var waiting = AcquireOptions.waitUpTo(Duration.ofSeconds(3)).withCancellation(token);
        assertTrue(waiting.waitForRelease());
        assertEquals(Duration.ofSeconds(3), waiting.timeout());
        assertSame(token, waiting.cancellationToken());
    }

    @Test
    void testSameTypeNests() {
        var locks = new OperationLockManager();
        assertTrue(locks.acquire(OperationType.KEY_MANAGEMENT, "outer", AcquireOptions.failFast()));
        assertTrue(locks.acquire(OperationType.KEY_MANAGEMENT, "inner", AcquireOptions.failFast()));
        assertEquals(2, locks.stats().holdCount());

        locks.release(OperationType.KEY_MANAGEMENT);
        assertTrue(locks.isHeld());
        assertEquals("outer", locks.currentOperation().orElseThrow().description());

        locks.release(OperationType.KEY_MANAGEMENT);
        assertFalse(locks.isHeld());
    }

    @Test
    void testReleaseByOtherTypeIsNoOp() {
        var locks = new OperationLockManager();
        locks.acquire(OperationType.STYLE_FIX, "Fix styles", AcquireOptions.failFast());

        locks.release(OperationType.CLEANUP_INVALID);

        assertTrue(locks.isHeld());
        assertFalse(locks.acquire(OperationType.CLEANUP_INVALID, "Cleanup", AcquireOptions.failFast()));
    }

    @Test
    void testWaitersPromotedInArrivalOrder() throws Exception {
        var locks = new OperationLockManager();
        var order = new ConcurrentLinkedQueue<OperationType>();
        locks.acquire(OperationType.TRANSLATION_FILE, "Translate file", AcquireOptions.failFast());

        Runnable cleanup = () -> {
            locks.acquire(OperationType.CLEANUP_UNUSED, "Cleanup", AcquireOptions.waitUpTo(Duration.ofSeconds(5)));
            order.add(OperationType.CLEANUP_UNUSED);
            locks.release(OperationType.CLEANUP_UNUSED);
        };
        Runnable styles = () -> {
            locks.acquire(OperationType.STYLE_FIX, "Styles", AcquireOptions.waitUpTo(Duration.ofSeconds(5)));
            order.add(OperationType.STYLE_FIX);
            locks.release(OperationType.STYLE_FIX);
        };
        var t1 = new Thread(cleanup);
        t1.start();
        awaitCondition(() -> locks.stats().waitingCount() == 1);
        var t2 = new Thread(styles);
        t2.start();
        awaitCondition(() -> locks.stats().waitingCount() == 2);

        locks.release(OperationType.TRANSLATION_FILE);
        t1.join(5000);
        t2.join(5000);

        assertEquals(List.of(OperationType.CLEANUP_UNUSED, OperationType.STYLE_FIX), List.copyOf(order));
        assertFalse(locks.isHeld());
    }

    @Test
    void testWaitTimesOutNamingBlocker() {
        var locks = new OperationLockManager();
        locks.acquire(OperationType.TRANSLATION_PROJECT, "Translate project", AcquireOptions.failFast());

        var e = assertThrows(
                OperationLockManager.LockTimeoutException.class,
                () -> locks.acquire(
                        OperationType.CLEANUP_UNUSED, "Cleanup", AcquireOptions.waitUpTo(Duration.ofMillis(100))));

        assertNotNull(e.getBlocker());
        assertEquals(OperationType.TRANSLATION_PROJECT, e.getBlocker().type());
        assertTrue(e.getMessage().contains("Translate project"), e.getMessage());
        assertEquals(0, locks.stats().waitingCount());
    }

    @Test
    void testStaleLockReclaimed() {
        var clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        var locks = new OperationLockManager(clock);
        locks.acquire(OperationType.TRANSLATION_PROJECT, "Translate project", AcquireOptions.failFast());

        clock.advance(Duration.ofMinutes(4));
        assertTrue(locks.isHeld());

        clock.advance(Duration.ofMinutes(2));
        assertFalse(locks.isHeld());
        assertTrue(locks.acquire(OperationType.CLEANUP_UNUSED, "Cleanup", AcquireOptions.failFast()));
    }

    @Test
    void testBlockingOperationMessage() {
        var clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        var locks = new OperationLockManager(clock);
        assertEquals("", locks.blockingOperationMessage());

        locks.acquire(OperationType.TRANSLATION_PROJECT, "Translate project", AcquireOptions.failFast());
        clock.advance(Duration.ofSeconds(12));

        assertEquals("\"Translate project\" is in progress (12s elapsed)", locks.blockingOperationMessage());
    }

    @Test
    void testCancellableGlobalLockReceivesCancellation() {
        var locks = new OperationLockManager();

        Boolean cancelled = locks.withGlobalLock(
                OperationType.KEY_MANAGEMENT,
                "Fix keys",
                token -> {
                    assertFalse(token.isCancellationRequested());
                    assertTrue(locks.cancelCurrentOperation());
                    return token.isCancellationRequested();
                },
                true);

        assertEquals(Boolean.TRUE, cancelled);
        assertFalse(locks.cancelCurrentOperation());
    }

    @Test
    void testForceReleaseRejectsWaiters() throws Exception {
        var locks = new OperationLockManager();
        var failure = new AtomicReference<Throwable>();
        locks.acquire(OperationType.TRANSLATION_PROJECT, "Translate project", AcquireOptions.failFast());

        var waiter = new Thread(() -> {
            try {
                locks.acquire(OperationType.STYLE_FIX, "Styles", AcquireOptions.waitUpTo(Duration.ofSeconds(5)));
            } catch (OperationLockManager.LockException e) {
                failure.set(e);
            }
        });
        waiter.start();
        awaitCondition(() -> locks.stats().waitingCount() == 1);

        locks.forceReleaseAll();
        waiter.join(5000);

        assertNotNull(failure.get());
        assertFalse(failure.get() instanceof OperationLockManager.LockTimeoutException);
        var stats = locks.stats();
        assertNull(stats.globalLock());
        assertEquals(0, stats.waitingCount());
    }

    @Test
    void testFileLockHeldByOtherTypeUntilStale() {
        var clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        var locks = new OperationLockManager(clock);
        var file = Path.of("locales", "en.json");

        assertTrue(locks.acquireFileLock(file, OperationType.TRANSLATION_FILE));
        assertFalse(locks.acquireFileLock(file, OperationType.CLEANUP_INVALID));

        clock.advance(Duration.ofSeconds(31));
        assertTrue(locks.acquireFileLock(file, OperationType.CLEANUP_INVALID));
        assertEquals(OperationType.CLEANUP_INVALID, locks.fileLock(file).orElseThrow().holder());

        locks.releaseFileLock(file);
        assertTrue(locks.fileLock(file).isEmpty());
    }

    @Test
    void testFileLockAcquisitionsAreSpaced() {
        var locks = new OperationLockManager();
        var a = Path.of("locales", "en.json");
        var b = Path.of("locales", "fr.json");

        assertTrue(locks.acquireFileLock(a, OperationType.TRANSLATION_FILE));
        assertTrue(locks.acquireFileLock(b, OperationType.TRANSLATION_FILE));

        var gap = Duration.between(
                locks.fileLock(a).orElseThrow().timestamp(),
                locks.fileLock(b).orElseThrow().timestamp());
        assertTrue(gap.compareTo(OperationLockManager.FILE_WRITE_SPACING) >= 0, gap.toString());
    }

    @Test
    void testWithFileLockThrowsWhenUnavailable() {
        var locks = new OperationLockManager();
        var file = Path.of("locales", "en.json");
        locks.acquireFileLock(file, OperationType.TRANSLATION_FILE);

        assertThrows(
                OperationLockManager.FileLockUnavailableException.class,
                () -> locks.withFileLock(file, OperationType.STYLE_FIX, () -> "never"));
        assertEquals("written", locks.withFileLock(file, OperationType.TRANSLATION_FILE, () -> "written"));
        assertTrue(locks.fileLock(file).isEmpty());
    }
}
