package org.matrixbfs.graph;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when adjacency-matrix contracts cannot be satisfied.
 *
 * <p>Messages are prefixed with deterministic reason-code text for observability.</p>
 */
@Getter
@Accessors(fluent = true)
public final class GraphException extends RuntimeException {
    public static final String REASON_INVALID_MATRIX = "INVALID_MATRIX";
    public static final String REASON_UNKNOWN_VERTEX = "UNKNOWN_VERTEX";

    private final String reasonCode;

    /**
     * Creates a reason-coded graph failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public GraphException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates the exception equivalent of a failed graph query.
     *
     * @param error query failure value.
     */
    public GraphException(GraphError error) {
        this(Objects.requireNonNull(error, "error").reasonCode(), error.message());
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
