package org.scenic.timing.solar;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Immutable solar timing of one capture instant at one latitude.
 *
 * <p>Created fresh per query and fully determined by its inputs: equal inputs always
 * produce equal snapshots.</p>
 */
@Value
@Builder
public class SolarSnapshot {

    /**
     * Instant the snapshot was computed for.
     */
    @NonNull
    Instant captureInstant;

    /**
     * Zone the local day and wall-clock boundaries were resolved in.
     */
    @NonNull
    ZoneId zoneId;

    /**
     * Boundaries of the capture's local day.
     */
    @NonNull
    SolarDaySchedule schedule;

    /**
     * Event with the smallest absolute distance to {@link #captureInstant}.
     */
    @NonNull
    SolarEvent closestEvent;

    /**
     * Signed whole minutes from {@link #closestEvent} to the capture; positive means the
     * photo was taken after the event.
     */
    int relativeMinutesToClosestEvent;

    public double getLatitudeDegrees() {
        return schedule.getLatitudeDegrees();
    }

    public ZonedDateTime getSunriseLocal() {
        return schedule.getSunrise();
    }

    public ZonedDateTime getSunsetLocal() {
        return schedule.getSunset();
    }

    public ZonedDateTime getGoldenHourStart() {
        return schedule.getGoldenHourStart();
    }

    public ZonedDateTime getGoldenHourEnd() {
        return schedule.getGoldenHourEnd();
    }

    public ZonedDateTime getBlueHourStart() {
        return schedule.getBlueHourStart();
    }

    public ZonedDateTime getBlueHourEnd() {
        return schedule.getBlueHourEnd();
    }

    /**
     * Returns the boundary time of one event.
     */
    public ZonedDateTime eventTime(SolarEvent event) {
        return schedule.eventTime(event);
    }

    /**
     * Returns the event closest to {@code instant}; ties go to the earlier-declared event.
     */
    public SolarEvent closestEventTo(Instant instant) {
        return schedule.closestEventTo(instant);
    }
}
