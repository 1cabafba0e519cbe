package org.scenic.core.geo;

import java.util.Optional;

/**
 * Eight-point compass rose used to caption photo headings.
 *
 * <p>Each point owns a 45 degree sector centred on its bearing, so {@code N} covers
 * {@code [337.5, 360)} and {@code [0, 22.5)}.</p>
 */
public enum CompassPoint {
    N,
    NE,
    E,
    SE,
    S,
    SW,
    W,
    NW;

    private static final double SECTOR_DEGREES = 45.0d;
    private static final double HALF_SECTOR_DEGREES = SECTOR_DEGREES / 2.0d;
    private static final CompassPoint[] POINTS = values();

    /**
     * Returns the centre bearing of this point in degrees.
     */
    public double bearingDegrees() {
        return ordinal() * SECTOR_DEGREES;
    }

    /**
     * Resolves the compass point for a heading.
     *
     * @param headingDegrees heading in {@code [0, 360)}, or {@code null}.
     * @return compass point, or empty when the heading is absent, non-finite or out of range.
     */
    public static Optional<CompassPoint> fromHeading(Float headingDegrees) {
        if (!isUsableHeading(headingDegrees)) {
            return Optional.empty();
        }
        int sector = (int) Math.floor((headingDegrees + HALF_SECTOR_DEGREES) / SECTOR_DEGREES) % POINTS.length;
        return Optional.of(POINTS[sector]);
    }

    /**
     * Returns {@code true} when a heading is present, finite and in {@code [0, 360)}.
     */
    public static boolean isUsableHeading(Float headingDegrees) {
        return headingDegrees != null
                && Float.isFinite(headingDegrees)
                && headingDegrees >= 0.0f
                && headingDegrees < 360.0f;
    }
}
