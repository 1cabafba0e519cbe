package org.scenic.core.photo;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.scenic.core.geo.CompassPoint;

import java.time.Instant;
import java.util.Optional;

/**
 * Read-only view of one photo of a spot, as supplied by the host app.
 *
 * <p>Only the fields the timing and gallery logic needs are carried. Equality is by value;
 * {@link #getId()} is the stable identity used for lookups.</p>
 */
@Value
@Builder
public class PhotoRecord {

    /**
     * Opaque stable photo id.
     */
    @NonNull
    String id;

    /**
     * Capture instant from EXIF or upload metadata, or {@code null} when unknown.
     */
    Instant captureInstant;

    /**
     * Camera heading in degrees, or {@code null} when the photo carries no direction.
     */
    Float headingDegrees;

    /**
     * Returns {@code true} when the heading is present, finite and in {@code [0, 360)}.
     *
     * <p>Any other heading value is treated as absent.</p>
     */
    public boolean hasUsableHeading() {
        return CompassPoint.isUsableHeading(headingDegrees);
    }

    /**
     * Returns the capture instant when known.
     */
    public Optional<Instant> captureInstant() {
        return Optional.ofNullable(captureInstant);
    }

    /**
     * Returns the compass point of a usable heading.
     */
    public Optional<CompassPoint> compassPoint() {
        return CompassPoint.fromHeading(headingDegrees);
    }
}
