package io.mnemo.core.consolidation;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Bounds the wall time of a consolidation run and lets another thread cancel it.
 * The run polls {@link #check(long)} between atoms.
 */
public final class ConsolidationBudget {
    private final Duration maxDuration;
    private final LongSupplier nanoTime;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    ConsolidationBudget(Duration maxDuration, LongSupplier nanoTime) {
        this.maxDuration = maxDuration == null || maxDuration.isZero() || maxDuration.isNegative() ? null : maxDuration;
        this.nanoTime = nanoTime;
    }

    public static ConsolidationBudget unbounded() {
        return new ConsolidationBudget(null, System::nanoTime);
    }

    /**
     * A zero or negative duration means no deadline.
     */
    public static ConsolidationBudget of(Duration maxDuration) {
        return new ConsolidationBudget(maxDuration, System::nanoTime);
    }

    public boolean bounded() {
        return maxDuration != null;
    }

    public void cancel() {
        cancelled.set(true);
    }

    long start() {
        return nanoTime.getAsLong();
    }

    void check(long startedNanos) {
        if (cancelled.get()) {
            throw new ConsolidationCancelledException("Consolidation cancelled");
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new ConsolidationCancelledException("Consolidation interrupted");
        }
        if (maxDuration != null && nanoTime.getAsLong() - startedNanos > maxDuration.toNanos()) {
            throw new ConsolidationCancelledException(
                "Consolidation exceeded its budget of " + maxDuration.toMillis() + " ms"
            );
        }
    }
}
