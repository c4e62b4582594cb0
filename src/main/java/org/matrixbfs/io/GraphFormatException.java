package org.matrixbfs.io;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a graph cannot be loaded from text or generated.
 */
@Getter
@Accessors(fluent = true)
public final class GraphFormatException extends RuntimeException {
    public static final String REASON_INVALID_FORMAT = "INVALID_FORMAT";
    public static final String REASON_NEGATIVE_VERTEX_COUNT = "NEGATIVE_VERTEX_COUNT";

    private final String reasonCode;

    public GraphFormatException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    public GraphFormatException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
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
