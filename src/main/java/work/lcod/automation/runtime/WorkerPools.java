package work.lcod.automation.runtime;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Daemon thread pools for step tasks and transport loops.
 */
public final class WorkerPools {
    private static final ExecutorService SHARED = newCachedPool("lcod-worker");

    private WorkerPools() {}

    /** Process-wide pool used when no executor is supplied. Never shut down. */
    public static ExecutorService shared() {
        return SHARED;
    }

    public static ExecutorService newCachedPool(String namePrefix) {
        return Executors.newCachedThreadPool(daemonFactory(namePrefix));
    }

    public static ThreadFactory daemonFactory(String namePrefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
