package work.lcod.automation.runtime;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One step running on a worker thread. The backend is not reentrant, so a step that is given up
 * on must still be allowed to leave the backend before anything else calls into it:
 * {@link #settle(Future)} interrupts the step and blocks until it has returned.
 */
final class StepTask implements Callable<StepOutcome> {
    private final Callable<StepOutcome> body;
    private final AtomicBoolean claimed = new AtomicBoolean();
    private final CountDownLatch finished = new CountDownLatch(1);

    StepTask(Callable<StepOutcome> body) {
        this.body = body;
    }

    @Override
    public StepOutcome call() throws Exception {
        if (!claimed.compareAndSet(false, true)) {
            throw new ExecutionCancelledException("Step abandoned before it started");
        }
        try {
            return body.call();
        } finally {
            finished.countDown();
        }
    }

    /**
     * Interrupts the step and waits until it has returned. A step that had not started yet never
     * starts. The caller's interrupt status is restored afterwards.
     *
     * @return how long the step kept running after it was interrupted
     */
    Duration settle(Future<StepOutcome> future) {
        future.cancel(true);
        if (claimed.compareAndSet(false, true)) {
            return Duration.ZERO;
        }
        long started = System.nanoTime();
        boolean interrupted = false;
        while (true) {
            try {
                finished.await();
                break;
            } catch (InterruptedException ex) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return Duration.ofNanos(System.nanoTime() - started);
    }
}
