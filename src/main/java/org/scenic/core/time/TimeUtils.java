package org.scenic.core.time;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Shared deterministic time helpers for solar timing and badge phrasing.
 *
 * <p>All calendar math is done in an explicit zone; nothing here reads the system clock
 * or the default zone.</p>
 */
public final class TimeUtils {

    private static final long MILLIS_PER_MINUTE = 60_000L;
    private static final int MINUTES_PER_HOUR = 60;

    /**
     * Prevents instantiation of this utility class.
     */
    private TimeUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Returns the 1-based day-of-year of an instant in the given zone.
     *
     * @param instant instant to resolve.
     * @param zoneId zone used to render the date to the user.
     * @return day-of-year in range {@code [1, 366]}.
     */
    public static int dayOfYear(Instant instant, ZoneId zoneId) {
        return localDate(instant, zoneId).getDayOfYear();
    }

    /**
     * Returns the local calendar date of an instant in the given zone.
     */
    public static LocalDate localDate(Instant instant, ZoneId zoneId) {
        Objects.requireNonNull(instant, "instant");
        Objects.requireNonNull(zoneId, "zoneId");
        return instant.atZone(zoneId).toLocalDate();
    }

    /**
     * Builds a wall-clock time on a local date at second zero.
     *
     * <p>Times that fall into a DST gap are shifted forward by the gap length, as
     * {@link ZonedDateTime#of} does.</p>
     *
     * @param date local calendar date.
     * @param hour hour-of-day in {@code [0, 23]}.
     * @param minute minute-of-hour in {@code [0, 59]}.
     * @param zoneId zone of the wall clock.
     * @return zoned date-time on {@code date}.
     */
    public static ZonedDateTime atLocalTime(LocalDate date, int hour, int minute, ZoneId zoneId) {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(zoneId, "zoneId");
        return ZonedDateTime.of(date.getYear(), date.getMonthValue(), date.getDayOfMonth(), hour, minute, 0, 0, zoneId);
    }

    /**
     * Returns signed whole minutes from {@code reference} to {@code instant}.
     *
     * <p>Positive when {@code instant} is after {@code reference}. Half minutes round away
     * from zero so that the result is symmetric for captures before and after an event.</p>
     *
     * @param reference event time.
     * @param instant capture time.
     * @return rounded signed minutes.
     */
    public static int roundedMinutesBetween(Instant reference, Instant instant) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(instant, "instant");
        long millis = Duration.between(reference, instant).toMillis();
        long magnitude = Math.round((double) Math.abs(millis) / MILLIS_PER_MINUTE);
        return Math.toIntExact(millis < 0 ? -magnitude : magnitude);
    }

    /**
     * Formats a minute count as a human-readable duration, ignoring sign.
     *
     * @param minutes signed minute count.
     * @return text like {@code 1 minute}, {@code 2 hours} or {@code 1 hour and 5 minutes}.
     */
    public static String formatDuration(int minutes) {
        long absMinutes = Math.abs((long) minutes);
        long hours = absMinutes / MINUTES_PER_HOUR;
        long remainingMinutes = absMinutes % MINUTES_PER_HOUR;

        if (hours == 0) {
            return plural(remainingMinutes, "minute");
        }
        if (remainingMinutes == 0) {
            return plural(hours, "hour");
        }
        return plural(hours, "hour") + " and " + plural(remainingMinutes, "minute");
    }

    /**
     * Clamps a value into inclusive {@code [min, max]} bounds.
     */
    public static int clamp(int value, int min, int max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }

    private static String plural(long count, String unit) {
        return count + " " + unit + (count == 1 ? "" : "s");
    }
}
