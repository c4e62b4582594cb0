package org.matrixbfs.core.time;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Wall-clock timing helpers.
 *
 * <p>Timing never changes what the computation returns or throws.</p>
 */
public final class Stopwatch {

    /**
     * Computation whose failures, checked or not, pass through {@link #timed(Computation)} unchanged.
     *
     * @param <T> result type.
     * @param <X> checked exception type, {@link RuntimeException} when there is none.
     */
    @FunctionalInterface
    public interface Computation<T, X extends Exception> {
        T compute() throws X;
    }

    /**
     * Prevents instantiation of this utility class.
     */
    private Stopwatch() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Runs {@code computation} on the calling thread and measures it.
     *
     * @param computation computation to run.
     * @return the computation's result and elapsed time.
     * @throws X whatever {@code computation} throws.
     */
    public static <T, X extends Exception> TimedComputation<T> timed(Computation<T, X> computation) throws X {
        Objects.requireNonNull(computation, "computation");
        long start = System.nanoTime();
        T result = computation.compute();
        long elapsedNanos = System.nanoTime() - start;
        return new TimedComputation<>(result, Duration.ofNanos(Math.max(0L, elapsedNanos)));
    }

    /**
     * Formats a duration as fractional milliseconds, for logs and CLI output.
     */
    public static String formatMillis(Duration duration) {
        Objects.requireNonNull(duration, "duration");
        return String.format(Locale.ROOT, "%.3f", duration.toNanos() / 1_000_000.0d);
    }
}
