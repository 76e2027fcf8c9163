package anyrun.mock;

import java.time.Duration;

import anyrun.core.util.Clock;

/**
 * Clock advanced explicitly by tests.
 */
public final class ManualClock implements Clock {

    private long now;

    public ManualClock() {
        this(0L);
    }

    public ManualClock(long startNanos) {
        this.now = startNanos;
    }

    @Override
    public synchronized long nanoTime() {
        return now;
    }

    public synchronized void advance(Duration delta) {
        if (delta.isNegative()) {
            throw new IllegalArgumentException("delta < 0");
        }
        now += delta.toNanos();
    }
}
