package com.example.distcache.memory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Periodically purges expired entries that nobody reads. Runs on its own daemon thread with a
 * fixed delay between passes.
 */
public class ExpirySweeper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExpirySweeper.class);
    private static final long SHUTDOWN_WAIT_SECONDS = 10;

    private final EntryStore store;
    private final ScheduledExecutorService executor;
    private final ScheduledFuture<?> task;

    public ExpirySweeper(EntryStore store, Duration interval) {
        this.store = store;
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("cache-sweep-");
        threadFactory.setDaemon(true);
        this.executor = Executors.newSingleThreadScheduledExecutor(threadFactory);
        long millis = interval.toMillis();
        this.task = executor.scheduleWithFixedDelay(this::sweepOnce, millis, millis, TimeUnit.MILLISECONDS);
    }

    void sweepOnce() {
        try {
            int purged = store.purgeExpired();
            if (purged > 0) {
                log.debug("Expiry sweep purged {} entries", purged);
            }
        } catch (RuntimeException e) {
            // an exception escaping here would cancel every later pass
            log.warn("Expiry sweep failed", e);
        }
    }

    /** Stops scheduling and waits for a pass in progress to finish. */
    @Override
    public void close() {
        task.cancel(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Expiry sweep did not stop within {}s, interrupting", SHUTDOWN_WAIT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isStopped() {
        return executor.isTerminated();
    }
}
