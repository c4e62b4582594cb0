package org.matrixbfs.graph;

import java.util.Objects;

/**
 * Outcome of a graph query: either a value or a {@link GraphError}.
 *
 * <p>Lookups with out-of-range vertices are expected input, so they are reported as values
 * instead of exceptions. Call {@link #orElseThrow()} where an invalid vertex is a bug.</p>
 *
 * @param <T> value type.
 */
public final class GraphQuery<T> {
    private final T value;
    private final GraphError error;

    private GraphQuery(T value, GraphError error) {
        this.value = value;
        this.error = error;
    }

    static <T> GraphQuery<T> success(T value) {
        return new GraphQuery<>(Objects.requireNonNull(value, "value"), null);
    }

    static <T> GraphQuery<T> failure(GraphError error) {
        return new GraphQuery<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Returns the query value.
     *
     * @throws IllegalStateException when the query failed.
     */
    public T value() {
        if (error != null) {
            throw new IllegalStateException("query failed: " + error.message());
        }
        return value;
    }

    /**
     * Returns the failure.
     *
     * @throws IllegalStateException when the query succeeded.
     */
    public GraphError error() {
        if (error == null) {
            throw new IllegalStateException("query succeeded");
        }
        return error;
    }

    /**
     * Returns the value or raises the failure as a {@link GraphException}.
     */
    public T orElseThrow() {
        if (error != null) {
            throw new GraphException(error);
        }
        return value;
    }

    @Override
    public String toString() {
        return error == null ? "GraphQuery[value=" + value + "]" : "GraphQuery[error=" + error + "]";
    }
}
