package ai.relocale.lock;

/**
 * Cooperative cancellation flag. Long-running work polls {@link #isCancellationRequested()} at safe points; nothing is
 * interrupted and work already done is kept.
 */
public final class CancellationToken {
    /** A token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private volatile boolean cancelled;

    public CancellationToken() {
        this(true);
    }

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public void cancel() {
        if (cancellable) {
            cancelled = true;
        }
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }
}
