package org.matrixbfs.fanout;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Fan-out contract failure with a deterministic reason code.
 *
 * <p>A fan-out either returns the full result set or fails with this exception; partial
 * results are never returned.</p>
 */
@Getter
@Accessors(fluent = true)
public final class FanOutException extends RuntimeException {
    public static final String REASON_INVALID_WORKER_COUNT = "INVALID_WORKER_COUNT";
    public static final String REASON_TASK_FAILURE = "TASK_FAILURE";
    public static final String REASON_INTERRUPTED = "INTERRUPTED";

    private final String reasonCode;

    /**
     * Creates a reason-coded fan-out failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public FanOutException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded fan-out failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public FanOutException(String reasonCode, String message, Throwable cause) {
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
