package com.jreinhal.querygate.util;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Minimal closed / open / half-open breaker for a remote dependency. After {@code failureThreshold}
 * consecutive failures calls are refused for {@code openDuration}; then a limited number of trial calls
 * decide whether to close again.
 */
public class SimpleCircuitBreaker {
    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final int failureThreshold;
    private final int halfOpenMaxCalls;
    private final Duration openDuration;
    private final LongSupplier clock;
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicInteger halfOpenCalls = new AtomicInteger(0);
    private volatile long openUntilEpochMs = 0L;
    private volatile State state = State.CLOSED;

    public SimpleCircuitBreaker(int failureThreshold, Duration openDuration, int halfOpenMaxCalls) {
        this(failureThreshold, openDuration, halfOpenMaxCalls, System::currentTimeMillis);
    }

    SimpleCircuitBreaker(int failureThreshold, Duration openDuration, int halfOpenMaxCalls, LongSupplier clock) {
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDuration = openDuration == null || openDuration.isNegative() ? Duration.ofSeconds(30) : openDuration;
        this.halfOpenMaxCalls = Math.max(1, halfOpenMaxCalls);
        this.clock = clock;
    }

    public boolean allowRequest() {
        if (this.state == State.CLOSED) {
            return true;
        }
        long now = this.clock.getAsLong();
        if (this.state == State.OPEN) {
            if (now < this.openUntilEpochMs) {
                return false;
            }
            synchronized (this) {
                if (this.state == State.OPEN && now >= this.openUntilEpochMs) {
                    this.state = State.HALF_OPEN;
                    this.halfOpenCalls.set(0);
                }
            }
        }
        return this.halfOpenCalls.incrementAndGet() <= this.halfOpenMaxCalls;
    }

    public void recordSuccess() {
        if (this.state == State.CLOSED) {
            this.failureCount.set(0);
            return;
        }
        synchronized (this) {
            this.state = State.CLOSED;
            this.failureCount.set(0);
            this.halfOpenCalls.set(0);
            this.openUntilEpochMs = 0L;
        }
    }

    public void recordFailure(Throwable error) {
        if (this.state == State.HALF_OPEN || this.failureCount.incrementAndGet() >= this.failureThreshold) {
            this.open();
        }
    }

    public State getState() {
        return this.state;
    }

    private synchronized void open() {
        this.state = State.OPEN;
        this.openUntilEpochMs = this.clock.getAsLong() + this.openDuration.toMillis();
        this.failureCount.set(0);
        this.halfOpenCalls.set(0);
    }
}
