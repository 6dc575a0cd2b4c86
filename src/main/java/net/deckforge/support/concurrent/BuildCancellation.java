package net.deckforge.support.concurrent;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal shared by one build run and its workers.
 * <p>
 * Workers check {@link #isCancelled()} between units of work and wait through
 * {@link #pause(Duration)} so that a cancel request wakes them immediately.
 */
public final class BuildCancellation {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public static BuildCancellation none() {
        return new BuildCancellation();
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits for the given duration unless cancelled first.
     * An interrupted waiter cancels the whole run.
     *
     * @return {@code true} if the full duration elapsed, {@code false} if cancelled
     */
    public boolean pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return !isCancelled();
        }
        try {
            return !cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            cancel();
            return false;
        }
    }
}
