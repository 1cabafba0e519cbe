package org.scenic.timing.solar;

import lombok.Builder;
import lombok.Value;

import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Configuration bound once when a {@link SolarTimingEngine} is created.
 */
@Value
@Builder
public class SolarTimingConfig {
    public static final int DEFAULT_MAX_CACHED_DAYS = 512;

    /**
     * Zone used to render capture dates to the user. Day-of-year and the sunrise/sunset
     * wall-clock times are resolved in this zone.
     */
    ZoneId zoneId;

    /**
     * True when per-day solar schedules are memoized.
     */
    @Builder.Default
    boolean cacheEnabled = true;

    /**
     * Upper bound on memoized day schedules before the cache is cleared.
     */
    @Builder.Default
    int maxCachedDays = DEFAULT_MAX_CACHED_DAYS;

    /**
     * Returns convenience config rendering in UTC.
     */
    public static SolarTimingConfig utc() {
        return forZone(ZoneOffset.UTC);
    }

    /**
     * Returns convenience config rendering in {@code zoneId} with default caching.
     *
     * @param zoneId display zone of the host.
     */
    public static SolarTimingConfig forZone(ZoneId zoneId) {
        return SolarTimingConfig.builder()
                .zoneId(zoneId)
                .build();
    }
}
