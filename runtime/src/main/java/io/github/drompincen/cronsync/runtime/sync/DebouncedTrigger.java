package io.github.drompincen.cronsync.runtime.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Coalesces bursts of requests into one delayed invocation of a bound action. Each
 * {@link #schedule} supersedes the pending timer; only the last one fires.
 *
 * <p>Superseding and cancelling bump a generation counter under the same lock the timer
 * checks before firing, so a timer that has already started running but lost the race still
 * does nothing.
 */
public class DebouncedTrigger {

    private static final Logger log = LoggerFactory.getLogger(DebouncedTrigger.class);

    private final String name;
    private final ScheduledExecutorService scheduler;
    private final Runnable action;
    private final Object lock = new Object();

    private ScheduledFuture<?> pending;
    private long generation;

    public DebouncedTrigger(String name, ScheduledExecutorService scheduler, Runnable action) {
        this.name = name;
        this.scheduler = scheduler;
        this.action = action;
    }

    public void schedule(Duration delay) {
        synchronized (lock) {
            cancelPendingLocked();
            long armed = ++generation;
            pending = scheduler.schedule(() -> fire(armed), delay.toMillis(), TimeUnit.MILLISECONDS);
        }
        log.debug("Armed {} trigger ({}ms)", name, delay.toMillis());
    }

    public void cancelAll() {
        synchronized (lock) {
            generation++;
            cancelPendingLocked();
        }
    }

    public boolean isPending() {
        synchronized (lock) {
            return pending != null;
        }
    }

    public String getName() {
        return name;
    }

    private void fire(long armed) {
        synchronized (lock) {
            if (armed != generation) return;
            pending = null;
        }
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Debounced {} action failed", name, e);
        }
    }

    private void cancelPendingLocked() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }
}
