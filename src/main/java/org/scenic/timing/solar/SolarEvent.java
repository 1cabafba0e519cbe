package org.scenic.timing.solar;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Named solar boundaries a capture instant is measured against.
 *
 * <p>Declaration order is the tie-break order when two events are equally close.</p>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum SolarEvent {
    SUNRISE("Sunrise", "sunrise"),
    SUNSET("Sunset", "sunset"),
    GOLDEN_HOUR_START("Golden Hour Start", "golden hour"),
    GOLDEN_HOUR_END("Golden Hour End", "golden hour"),
    BLUE_HOUR_START("Blue Hour Start", "blue hour"),
    BLUE_HOUR_END("Blue Hour End", "blue hour");

    /** Title-case label for detail screens. */
    private final String displayName;
    /** Lower-case label used inside relative descriptions. */
    private final String shortName;
}
