package anyrun.core.service.common;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

/**
 * Counts calls between subscription and termination, and refuses new calls once closed.
 *
 * <p>A call leaves the count when it completes, fails or is cancelled.
 */
public class InFlightTracker {

    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Object drained = new Object();

    /**
     * Track a call.
     *
     * @param call produces the call on subscription
     * @param <T>  the result type
     * @return the tracked call, failing with {@link IllegalStateException} once closed
     */
    public <T> Uni<T> track(Supplier<Uni<T>> call) {
        return Uni.createFrom().deferred(() -> {
            if (!enter()) {
                return Uni.createFrom().<T>failure(new IllegalStateException("Client is closed"));
            }
            return Uni.createFrom().deferred(call::get).onTermination().invoke(this::exit);
        });
    }

    /**
     * Track a stream for as long as it is subscribed.
     */
    public <T> Multi<T> trackStream(Supplier<Multi<T>> stream) {
        return Multi.createFrom().deferred(() -> {
            if (!enter()) {
                return Multi.createFrom().<T>failure(new IllegalStateException("Client is closed"));
            }
            return Multi.createFrom().deferred(stream::get).onTermination().invoke(this::exit);
        });
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int inFlight() {
        return inFlight.get();
    }

    /**
     * Refuse new calls and wait for the running ones to finish.
     *
     * <p>Blocks the calling thread; must not be called from an event loop.
     *
     * @param gracePeriod the longest time to wait
     * @return true if every call finished in time
     */
    public boolean closeAndAwait(Duration gracePeriod) {
        closed.set(true);
        final var deadline = System.nanoTime() + gracePeriod.toNanos();
        synchronized (drained) {
            while (inFlight.get() > 0) {
                final var remainingNanos = deadline - System.nanoTime();
                if (remainingNanos <= 0) {
                    return false;
                }
                try {
                    drained.wait(Math.max(1L, remainingNanos / 1_000_000L));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return inFlight.get() == 0;
                }
            }
        }
        return true;
    }

    // Counted before the closed check, so closeAndAwait never sees zero while a call is admitted.
    private boolean enter() {
        inFlight.incrementAndGet();
        if (closed.get()) {
            exit();
            return false;
        }
        return true;
    }

    private void exit() {
        if (inFlight.decrementAndGet() == 0) {
            synchronized (drained) {
                drained.notifyAll();
            }
        }
    }
}
