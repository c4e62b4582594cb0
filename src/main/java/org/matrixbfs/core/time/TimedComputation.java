package org.matrixbfs.core.time;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of a computation together with its wall-clock duration.
 *
 * @param result value returned by the computation (may be null).
 * @param elapsed wall-clock duration of the computation.
 * @param <T> result type.
 */
public record TimedComputation<T>(T result, Duration elapsed) {

    public TimedComputation {
        Objects.requireNonNull(elapsed, "elapsed");
        if (elapsed.isNegative()) {
            throw new IllegalArgumentException("elapsed must be non-negative");
        }
    }

    public long elapsedMillis() {
        return elapsed.toMillis();
    }
}
