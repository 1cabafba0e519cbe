package org.scenic.timing.solar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Memo of solar day schedules keyed by local date and exact latitude.
 *
 * <p>The key uses the latitude's bit pattern, so a cached schedule is always identical to a
 * freshly computed one. When the entry bound is reached the whole map is dropped; schedules
 * are cheap to rebuild.</p>
 */
final class SolarScheduleCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(SolarScheduleCache.class);

    /**
     * Computes one schedule on a cache miss.
     */
    @FunctionalInterface
    interface ScheduleLoader {
        SolarDaySchedule load(LocalDate date, double latitudeDegrees);
    }

    private final int maxEntries;
    private final ScheduleLoader loader;
    private final ConcurrentMap<DayKey, SolarDaySchedule> scheduleByDay = new ConcurrentHashMap<>();

    /**
     * Creates an empty cache.
     *
     * @param maxEntries entry bound, must be positive.
     * @param loader schedule computation used on misses.
     */
    SolarScheduleCache(int maxEntries, ScheduleLoader loader) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.maxEntries = maxEntries;
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    /**
     * Returns the cached schedule, computing it on a miss.
     *
     * <p>Loader failures propagate and leave no entry behind.</p>
     */
    SolarDaySchedule schedule(LocalDate date, double latitudeDegrees) {
        DayKey key = new DayKey(date, Double.doubleToLongBits(latitudeDegrees));
        SolarDaySchedule cached = scheduleByDay.get(key);
        if (cached != null) {
            return cached;
        }
        if (scheduleByDay.size() >= maxEntries) {
            LOGGER.debug("Solar schedule cache reached {} entries, clearing", maxEntries);
            scheduleByDay.clear();
        }
        return scheduleByDay.computeIfAbsent(key, k -> loader.load(date, latitudeDegrees));
    }

    /**
     * Returns current number of cached day schedules.
     */
    int cachedDays() {
        return scheduleByDay.size();
    }

    private record DayKey(LocalDate date, long latitudeBits) {
    }
}
