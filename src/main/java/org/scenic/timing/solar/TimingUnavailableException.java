package org.scenic.timing.solar;

import lombok.Getter;

import java.util.Objects;

/**
 * Solar timing failure with a deterministic reason code.
 *
 * <p>Raised when the inputs cannot yield a snapshot. Callers recover by showing a neutral
 * "timing unavailable" state; retrying with the same inputs always fails the same way.</p>
 */
@Getter
public final class TimingUnavailableException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded timing failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public TimingUnavailableException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded timing failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public TimingUnavailableException(String reasonCode, String message, Throwable cause) {
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
