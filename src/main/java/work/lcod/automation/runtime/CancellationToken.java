package work.lcod.automation.runtime;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation flag. Cancelling a token cancels every child created from it and wakes
 * any thread blocked in {@link #await(Duration)}.
 */
public final class CancellationToken {
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<CancellationToken> children = new CopyOnWriteArrayList<>();
    private final CancellationToken parent;

    public CancellationToken() {
        this(null);
    }

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public CancellationToken child() {
        var child = new CancellationToken(this);
        children.add(child);
        if (isCancelled()) {
            child.cancel();
        }
        return child;
    }

    public void cancel() {
        if (cancelled.getCount() == 0) {
            return;
        }
        cancelled.countDown();
        for (var child : children) {
            child.cancel();
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Sleeps for {@code duration} or until cancelled.
     *
     * @return true when the wait ended because the token was cancelled
     */
    public boolean await(Duration duration) throws InterruptedException {
        if (duration.isNegative() || duration.isZero()) {
            return isCancelled();
        }
        return cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS);
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new ExecutionCancelledException("Execution cancelled");
        }
    }

    /** Unlinks this token from its parent once the work it guards has finished. */
    public void release() {
        if (parent != null) {
            parent.children.remove(this);
        }
    }
}
