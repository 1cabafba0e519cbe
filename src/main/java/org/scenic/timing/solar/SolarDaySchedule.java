package org.scenic.timing.solar;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Approximate solar boundaries of one local calendar day at one latitude.
 *
 * <p>Golden and blue hour are only modelled around sunset.</p>
 */
@Value
@Builder
public class SolarDaySchedule {

    /** Local calendar day the boundaries belong to. */
    @NonNull
    LocalDate date;

    /** Latitude the schedule was computed for. */
    double latitudeDegrees;

    @NonNull
    ZonedDateTime sunrise;

    @NonNull
    ZonedDateTime sunset;

    /** Sixty minutes before sunset. */
    @NonNull
    ZonedDateTime goldenHourStart;

    /** Thirty minutes after sunset. */
    @NonNull
    ZonedDateTime goldenHourEnd;

    /** Same instant as sunset. */
    @NonNull
    ZonedDateTime blueHourStart;

    /** Forty-five minutes after sunset. */
    @NonNull
    ZonedDateTime blueHourEnd;

    /**
     * Returns the boundary time of one event.
     */
    public ZonedDateTime eventTime(SolarEvent event) {
        switch (event) {
            case SUNRISE:
                return sunrise;
            case SUNSET:
                return sunset;
            case GOLDEN_HOUR_START:
                return goldenHourStart;
            case GOLDEN_HOUR_END:
                return goldenHourEnd;
            case BLUE_HOUR_START:
                return blueHourStart;
            case BLUE_HOUR_END:
                return blueHourEnd;
            default:
                throw new IllegalArgumentException("unknown solar event: " + event);
        }
    }

    /**
     * Returns the event closest to {@code instant}.
     *
     * <p>Ties go to the event declared first in {@link SolarEvent}.</p>
     */
    public SolarEvent closestEventTo(Instant instant) {
        Objects.requireNonNull(instant, "instant");
        SolarEvent closest = null;
        Duration bestDistance = null;
        for (SolarEvent event : SolarEvent.values()) {
            Duration distance = Duration.between(eventTime(event).toInstant(), instant).abs();
            if (bestDistance == null || distance.compareTo(bestDistance) < 0) {
                bestDistance = distance;
                closest = event;
            }
        }
        return closest;
    }
}
