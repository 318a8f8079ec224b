package com.ryuqq.fetcher.testkit.contract;

import com.ryuqq.fetcher.core.clock.Sleeper;
import com.ryuqq.fetcher.core.clock.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Virtual clock implementing both {@link Ticker} and {@link Sleeper}.
 *
 * <p>Sleeping never blocks: it records the requested duration and advances the clock by it,
 * so backoff schedules and time budgets can be verified without waiting.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public class ManualClock implements Ticker, Sleeper {

    private final AtomicLong nanos;
    private final List<Duration> sleeps;

    /**
     * Creates a clock starting at zero.
     */
    public ManualClock() {
        this.nanos = new AtomicLong();
        this.sleeps = new CopyOnWriteArrayList<>();
    }

    @Override
    public long read() {
        return nanos.get();
    }

    @Override
    public void sleep(Duration duration) {
        if (duration == null) {
            throw new IllegalArgumentException("duration cannot be null");
        }
        sleeps.add(duration);
        if (!duration.isNegative()) {
            nanos.addAndGet(duration.toNanos());
        }
    }

    /**
     * Advances the clock without recording a sleep.
     *
     * @param duration amount to advance
     */
    public void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    /**
     * Returns the time elapsed since the clock was created or last reset.
     *
     * @return elapsed virtual time
     */
    public Duration elapsed() {
        return Duration.ofNanos(nanos.get());
    }

    /**
     * Returns every sleep requested so far, in order.
     *
     * @return snapshot of recorded sleeps
     */
    public List<Duration> sleeps() {
        return new ArrayList<>(sleeps);
    }

    /**
     * Resets the clock to zero and forgets recorded sleeps.
     */
    public void reset() {
        nanos.set(0);
        sleeps.clear();
    }
}
