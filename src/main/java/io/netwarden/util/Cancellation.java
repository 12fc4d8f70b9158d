package io.netwarden.util;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class Cancellation {
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> listeners = new ArrayList<>();
    private String reason;

    public boolean cancel(String why) {
        List<Runnable> toRun;
        synchronized (listeners) {
            if (reason != null) {
                return false;
            }
            reason = why == null || why.isBlank() ? "cancelled" : why;
            toRun = List.copyOf(listeners);
            listeners.clear();
            latch.countDown();
        }
        for (Runnable listener : toRun) {
            listener.run();
        }
        return true;
    }

    public boolean isCancelled() {
        return latch.getCount() == 0L;
    }

    public String reason() {
        synchronized (listeners) {
            return reason;
        }
    }

    public void await() throws InterruptedException {
        latch.await();
    }

    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public Registration onCancel(Runnable listener) {
        synchronized (listeners) {
            if (reason == null) {
                listeners.add(listener);
                return () -> {
                    synchronized (listeners) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        listener.run();
        return () -> {
        };
    }

    public Cancellation child() {
        Cancellation child = new Cancellation();
        Registration link = onCancel(() -> child.cancel(reason()));
        child.onCancel(link::remove);
        return child;
    }

    @FunctionalInterface
    public interface Registration {
        void remove();
    }
}
