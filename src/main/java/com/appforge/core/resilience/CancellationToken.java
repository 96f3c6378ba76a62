package com.appforge.core.resilience;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal shared by a run and its in-flight attempts.
 */
public class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (cancelled.getCount() == 0) {
            return;
        }
        cancelled.countDown();
        callbacks.forEach(Runnable::run);
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Registers a callback run on cancellation, immediately if already cancelled.
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled()) {
            callback.run();
        }
    }

    public void removeCallback(Runnable callback) {
        callbacks.remove(callback);
    }

    /**
     * Sleeps for the given delay unless cancelled first.
     *
     * @return true if the token was cancelled before the delay elapsed
     */
    public boolean await(Duration delay) throws InterruptedException {
        if (delay.isZero() || delay.isNegative()) {
            return isCancelled();
        }
        return cancelled.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    }
}
