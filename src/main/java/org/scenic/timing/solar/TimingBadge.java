package org.scenic.timing.solar;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;
import java.util.Optional;

/**
 * Timing result handed to the UI for one photo.
 *
 * <p>Either carries a snapshot and its classification, or a reason code for the neutral
 * "timing unavailable" state. Never represents a partially computed snapshot.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TimingBadge {
    public static final String UNAVAILABLE_LABEL = "Timing unavailable";

    SolarSnapshot snapshot;
    TimingClassification classification;
    String unavailableReasonCode;

    /**
     * Creates an available badge.
     */
    public static TimingBadge available(SolarSnapshot snapshot, TimingClassification classification) {
        return new TimingBadge(
                Objects.requireNonNull(snapshot, "snapshot"),
                Objects.requireNonNull(classification, "classification"),
                null
        );
    }

    /**
     * Creates the neutral unavailable badge.
     *
     * @param reasonCode reason the timing could not be computed.
     */
    public static TimingBadge unavailable(String reasonCode) {
        return new TimingBadge(null, null, Objects.requireNonNull(reasonCode, "reasonCode"));
    }

    /**
     * Returns {@code true} when a snapshot was computed.
     */
    public boolean isAvailable() {
        return snapshot != null;
    }

    public Optional<SolarSnapshot> snapshot() {
        return Optional.ofNullable(snapshot);
    }

    public Optional<TimingClassification> classification() {
        return Optional.ofNullable(classification);
    }

    public Optional<String> unavailableReasonCode() {
        return Optional.ofNullable(unavailableReasonCode);
    }

    /**
     * Returns the badge text.
     */
    public String label() {
        return classification == null ? UNAVAILABLE_LABEL : classification.badgeLabel();
    }
}
