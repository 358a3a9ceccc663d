package com.alphamind.trial;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wraps the blocking part of a trial run with a one-shot wall-clock timer.
 * <p>
 * When the timer fires the process is killed outright (no grace period); the wrapped body then
 * sees the process output close and returns, and the call fails with {@link TrialTimeoutException}.
 * The timer is always cancelled when the call returns.
 */
@Component
public class DeadlineEnforcer {

    private static final Logger log = LoggerFactory.getLogger(DeadlineEnforcer.class);

    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "trial-deadline");
        t.setDaemon(true);
        return t;
    });

    /**
     * Runs {@code body} under a deadline for {@code handle}.
     *
     * @param timeout zero or negative disables the deadline
     * @return whatever {@code body} returns
     * @throws TrialTimeoutException if the deadline fired, regardless of what the body returned
     */
    public <T> T supervise(TrialHandle handle, Duration timeout, Callable<T> body) {
        try (Deadline deadline = arm(handle, timeout)) {
            T result;
            try {
                result = body.call();
            } catch (TrialException e) {
                if (deadline.fired()) {
                    throw new TrialTimeoutException(timeout);
                }
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SupervisionException("Interrupted while supervising process " + handle.pid(), e);
            } catch (Exception e) {
                if (deadline.fired()) {
                    throw new TrialTimeoutException(timeout);
                }
                throw new SupervisionException("Supervision of process " + handle.pid() + " failed: "
                        + e.getMessage(), e);
            }
            if (deadline.fired()) {
                throw new TrialTimeoutException(timeout);
            }
            return result;
        }
    }

    Deadline arm(TrialHandle handle, Duration timeout) {
        var deadline = new Deadline(handle, timeout);
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            deadline.future = timer.schedule(deadline::expire, timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        return deadline;
    }

    @PreDestroy
    void shutdown() {
        timer.shutdownNow();
    }

    /**
     * Armed timer for one trial. Closing it disarms the timer.
     */
    static final class Deadline implements AutoCloseable {

        private final TrialHandle handle;
        private final Duration timeout;
        private final AtomicBoolean fired = new AtomicBoolean();
        private volatile ScheduledFuture<?> future;

        private Deadline(TrialHandle handle, Duration timeout) {
            this.handle = handle;
            this.timeout = timeout;
        }

        private void expire() {
            if (fired.compareAndSet(false, true)) {
                log.warn("Process {} exceeded its {}s deadline, killing it", handle.pid(), timeout.toSeconds());
                handle.kill();
            }
        }

        boolean fired() {
            return fired.get();
        }

        boolean armed() {
            ScheduledFuture<?> f = future;
            return f != null && !f.isDone();
        }

        @Override
        public void close() {
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
