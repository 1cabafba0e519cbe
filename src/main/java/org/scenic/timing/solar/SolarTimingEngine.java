package org.scenic.timing.solar;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.scenic.core.geo.GeoCoordinate;
import org.scenic.core.time.TimeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Approximate solar timing of photo captures.
 *
 * <p>Sunrise and sunset are derived from a seasonal sine term and a linear latitude term
 * around a 06:00/18:00 baseline at 40 degrees north. This is a display approximation, not a
 * solar-position algorithm. Golden and blue hour are only modelled around sunset.</p>
 *
 * <p>The engine is stateless apart from an optional thread-safe schedule memo, and never
 * reads the clock: equal inputs always yield equal snapshots.</p>
 */
public final class SolarTimingEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(SolarTimingEngine.class);

    public static final String REASON_NON_FINITE_HOURS = "SOLAR_NON_FINITE_HOURS";
    public static final String REASON_LATITUDE_OUT_OF_RANGE = "SOLAR_LATITUDE_OUT_OF_RANGE";
    public static final String REASON_CAPTURE_INSTANT_REQUIRED = "SOLAR_CAPTURE_INSTANT_REQUIRED";
    public static final String REASON_COORDINATE_INVALID = "SOLAR_COORDINATE_INVALID";

    private static final double BASE_SUNRISE_HOUR = 6.0d;
    private static final double BASE_SUNSET_HOUR = 18.0d;
    private static final double SEASONAL_AMPLITUDE_HOURS = 1.5d;
    private static final double SEASONAL_HALF_PERIOD_DAYS = 182.5d;
    private static final int EQUINOX_DAY_OF_YEAR = 80;
    private static final double REFERENCE_LATITUDE = 40.0d;
    private static final double HOURS_PER_LATITUDE_DEGREE = 0.03d;

    private static final long GOLDEN_HOUR_LEAD_MINUTES = 60L;
    private static final long GOLDEN_HOUR_TAIL_MINUTES = 30L;
    private static final long BLUE_HOUR_TAIL_MINUTES = 45L;

    @Getter
    @Accessors(fluent = true)
    private final SolarTimingConfig config;
    private final ZoneId zoneId;
    private final SolarScheduleCache scheduleCache;

    /**
     * Creates an engine bound to one display zone.
     *
     * @param config engine configuration.
     */
    public SolarTimingEngine(SolarTimingConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.zoneId = Objects.requireNonNull(config.getZoneId(), "config.zoneId");
        if (config.getMaxCachedDays() <= 0) {
            throw new IllegalArgumentException("maxCachedDays must be positive");
        }
        this.scheduleCache = config.isCacheEnabled()
                ? new SolarScheduleCache(config.getMaxCachedDays(), this::computeSchedule)
                : null;
    }

    /**
     * Computes the solar snapshot of one capture.
     *
     * @param captureInstant capture time.
     * @param latitudeDegrees spot latitude.
     * @return fully populated snapshot.
     * @throws TimingUnavailableException when the inputs cannot yield a snapshot.
     */
    public SolarSnapshot computeSnapshot(Instant captureInstant, double latitudeDegrees) {
        if (captureInstant == null) {
            throw new TimingUnavailableException(REASON_CAPTURE_INSTANT_REQUIRED, "capture instant is absent");
        }
        SolarDaySchedule schedule = daySchedule(TimeUtils.localDate(captureInstant, zoneId), latitudeDegrees);
        SolarEvent closest = schedule.closestEventTo(captureInstant);
        int relativeMinutes = TimeUtils.roundedMinutesBetween(schedule.eventTime(closest).toInstant(), captureInstant);
        return SolarSnapshot.builder()
                .captureInstant(captureInstant)
                .zoneId(zoneId)
                .schedule(schedule)
                .closestEvent(closest)
                .relativeMinutesToClosestEvent(relativeMinutes)
                .build();
    }

    /**
     * Returns the solar boundaries of one local day, as shown in spot lists.
     *
     * @param date local calendar day in the engine zone.
     * @param latitudeDegrees spot latitude.
     * @return day schedule.
     * @throws TimingUnavailableException when the latitude cannot yield a schedule.
     */
    public SolarDaySchedule daySchedule(LocalDate date, double latitudeDegrees) {
        Objects.requireNonNull(date, "date");
        if (scheduleCache == null) {
            return computeSchedule(date, latitudeDegrees);
        }
        return scheduleCache.schedule(date, latitudeDegrees);
    }

    /**
     * Classifies an instant against a snapshot's boundaries.
     *
     * <p>Golden and blue hour bounds are inclusive. The closest event and description are
     * measured from {@code instant}, so classifying the snapshot's own capture instant
     * reproduces its closest event and minute offset.</p>
     *
     * @param instant instant to classify.
     * @param snapshot snapshot supplying the boundaries.
     * @return classification.
     */
    public TimingClassification classify(Instant instant, SolarSnapshot snapshot) {
        Objects.requireNonNull(instant, "instant");
        Objects.requireNonNull(snapshot, "snapshot");
        SolarDaySchedule schedule = snapshot.getSchedule();

        boolean goldenHour = within(instant, schedule.getGoldenHourStart(), schedule.getGoldenHourEnd());
        boolean blueHour = within(instant, schedule.getBlueHourStart(), schedule.getBlueHourEnd());
        SolarEvent closest = schedule.closestEventTo(instant);
        int relativeMinutes = TimeUtils.roundedMinutesBetween(schedule.eventTime(closest).toInstant(), instant);

        return TimingClassification.builder()
                .goldenHour(goldenHour)
                .blueHour(blueHour)
                .closestEvent(closest)
                .relativeMinutes(relativeMinutes)
                .relativeDescription(describe(relativeMinutes, closest))
                .build();
    }

    /**
     * Classifies the snapshot's own capture instant.
     */
    public TimingClassification classify(SolarSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        return classify(snapshot.getCaptureInstant(), snapshot);
    }

    /**
     * Computes the badge of one photo, recovering to the unavailable state on any timing
     * failure instead of propagating it.
     *
     * @param captureInstant capture time, or {@code null} when unknown.
     * @param coordinate spot coordinate, or {@code null} when unknown.
     * @return available or unavailable badge, never {@code null}.
     */
    public TimingBadge badgeFor(Instant captureInstant, GeoCoordinate coordinate) {
        if (captureInstant == null) {
            LOGGER.debug("No capture instant, timing badge unavailable");
            return TimingBadge.unavailable(REASON_CAPTURE_INSTANT_REQUIRED);
        }
        if (coordinate == null || !coordinate.isValid()) {
            LOGGER.warn("Invalid spot coordinate {}, timing badge unavailable", coordinate);
            return TimingBadge.unavailable(REASON_COORDINATE_INVALID);
        }
        try {
            SolarSnapshot snapshot = computeSnapshot(captureInstant, coordinate.getLatitudeDegrees());
            return TimingBadge.available(snapshot, classify(snapshot));
        } catch (TimingUnavailableException ex) {
            LOGGER.warn("Solar timing unavailable for {} at lat {}: {}",
                    captureInstant, coordinate.getLatitudeDegrees(), ex.getMessage());
            return TimingBadge.unavailable(ex.getReasonCode());
        }
    }

    /**
     * Builds the description shown when neither golden nor blue hour holds.
     *
     * @param relativeMinutes signed minutes; zero and positive read as "after".
     * @param event closest event.
     * @return text like {@code 1 hour and 5 minutes after sunset}.
     */
    public static String describe(int relativeMinutes, SolarEvent event) {
        Objects.requireNonNull(event, "event");
        String direction = relativeMinutes >= 0 ? "after" : "before";
        return TimeUtils.formatDuration(relativeMinutes) + " " + direction + " " + event.shortName();
    }

    /**
     * Returns cached day schedules, or zero when caching is disabled.
     */
    public int cachedDays() {
        return scheduleCache == null ? 0 : scheduleCache.cachedDays();
    }

    private SolarDaySchedule computeSchedule(LocalDate date, double latitudeDegrees) {
        int dayOfYear = date.getDayOfYear();
        double seasonalOffsetHours = Math.sin((dayOfYear - EQUINOX_DAY_OF_YEAR) * Math.PI / SEASONAL_HALF_PERIOD_DAYS)
                * SEASONAL_AMPLITUDE_HOURS;
        double latitudeOffsetHours = (latitudeDegrees - REFERENCE_LATITUDE) * HOURS_PER_LATITUDE_DEGREE;

        double sunriseHours = BASE_SUNRISE_HOUR - seasonalOffsetHours + latitudeOffsetHours;
        double sunsetHours = BASE_SUNSET_HOUR + seasonalOffsetHours - latitudeOffsetHours;

        if (!Double.isFinite(sunriseHours) || !Double.isFinite(sunsetHours)) {
            throw new TimingUnavailableException(
                    REASON_NON_FINITE_HOURS,
                    "non-finite solar hours for latitude " + latitudeDegrees + " on " + date
            );
        }
        if (!GeoCoordinate.isValidLatitude(latitudeDegrees)) {
            throw new TimingUnavailableException(
                    REASON_LATITUDE_OUT_OF_RANGE,
                    "latitude out of range: " + latitudeDegrees
            );
        }

        ZonedDateTime sunrise = toLocalTime(date, sunriseHours);
        ZonedDateTime sunset = toLocalTime(date, sunsetHours);
        return SolarDaySchedule.builder()
                .date(date)
                .latitudeDegrees(latitudeDegrees)
                .sunrise(sunrise)
                .sunset(sunset)
                .goldenHourStart(sunset.minusMinutes(GOLDEN_HOUR_LEAD_MINUTES))
                .goldenHourEnd(sunset.plusMinutes(GOLDEN_HOUR_TAIL_MINUTES))
                .blueHourStart(sunset)
                .blueHourEnd(sunset.plusMinutes(BLUE_HOUR_TAIL_MINUTES))
                .build();
    }

    /**
     * Converts fractional hours into a wall-clock time on {@code date}.
     *
     * <p>The hour is rounded and clamped to {@code [0, 23]}; the minute is the distance
     * between the fractional value and that hour, truncated and clamped to {@code [0, 59]}.</p>
     */
    private ZonedDateTime toLocalTime(LocalDate date, double fractionalHours) {
        int hour = TimeUtils.clamp((int) Math.round(fractionalHours), 0, 23);
        int minute = TimeUtils.clamp((int) (Math.abs(fractionalHours - hour) * 60.0d), 0, 59);
        return TimeUtils.atLocalTime(date, hour, minute, zoneId);
    }

    private static boolean within(Instant instant, ZonedDateTime startInclusive, ZonedDateTime endInclusive) {
        return !instant.isBefore(startInclusive.toInstant()) && !instant.isAfter(endInclusive.toInstant());
    }
}
