package org.scenic.core.geo;

import lombok.Value;

/**
 * Geographic coordinate of a photo spot in decimal degrees.
 *
 * <p>Construction never validates; use {@link #isValid()} before feeding a coordinate into
 * solar timing, or {@link #requireValid()} where an invalid value is a caller bug.</p>
 */
@Value(staticConstructor = "of")
public class GeoCoordinate {
    private static final double MAX_LATITUDE = 90.0d;
    private static final double MAX_LONGITUDE = 180.0d;

    /**
     * Latitude in {@code [-90, 90]}.
     */
    double latitudeDegrees;

    /**
     * Longitude in {@code [-180, 180]}.
     */
    double longitudeDegrees;

    /**
     * Returns {@code true} when both components are finite and within range.
     */
    public boolean isValid() {
        return isValidLatitude(latitudeDegrees) && isValidLongitude(longitudeDegrees);
    }

    /**
     * Returns this coordinate, or throws when it is not {@link #isValid() valid}.
     *
     * @throws IllegalArgumentException when either component is non-finite or out of range.
     */
    public GeoCoordinate requireValid() {
        if (!isValid()) {
            throw new IllegalArgumentException(
                    "coordinate out of range: lat=" + latitudeDegrees + ", lon=" + longitudeDegrees);
        }
        return this;
    }

    /**
     * Returns {@code true} when latitude is finite and within {@code [-90, 90]}.
     */
    public static boolean isValidLatitude(double latitudeDegrees) {
        return Double.isFinite(latitudeDegrees) && Math.abs(latitudeDegrees) <= MAX_LATITUDE;
    }

    /**
     * Returns {@code true} when longitude is finite and within {@code [-180, 180]}.
     */
    public static boolean isValidLongitude(double longitudeDegrees) {
        return Double.isFinite(longitudeDegrees) && Math.abs(longitudeDegrees) <= MAX_LONGITUDE;
    }
}
