package org.scenic.timing.solar;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Classification of one instant against a {@link SolarSnapshot}.
 */
@Value
@Builder
public class TimingClassification {
    public static final String GOLDEN_HOUR_LABEL = "Golden Hour";
    public static final String BLUE_HOUR_LABEL = "Blue Hour";

    /**
     * True when the instant lies in {@code [goldenHourStart, goldenHourEnd]}.
     */
    boolean goldenHour;

    /**
     * True when the instant lies in {@code [blueHourStart, blueHourEnd]}.
     */
    boolean blueHour;

    /**
     * Event closest to the classified instant.
     */
    @NonNull
    SolarEvent closestEvent;

    /**
     * Signed whole minutes from {@link #closestEvent} to the instant.
     */
    int relativeMinutes;

    /**
     * Text like {@code 22 minutes before sunrise}; always populated.
     */
    @NonNull
    String relativeDescription;

    /**
     * Returns the label shown on the timing badge.
     *
     * <p>Golden hour wins when both windows hold.</p>
     */
    public String badgeLabel() {
        if (goldenHour) {
            return GOLDEN_HOUR_LABEL;
        }
        if (blueHour) {
            return BLUE_HOUR_LABEL;
        }
        return relativeDescription;
    }
}
