package org.scenic.session;

import org.scenic.core.geo.GeoCoordinate;
import org.scenic.core.photo.PhotoRecord;
import org.scenic.gallery.CircularGalleryIndex;
import org.scenic.gallery.GalleryOrder;
import org.scenic.gallery.HeadingOrderer;
import org.scenic.timing.solar.SolarTimingEngine;
import org.scenic.timing.solar.TimingBadge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One open photo gallery of a spot.
 *
 * <p>Orders the spot's photos by heading, keeps the wraparound index over that order, and
 * derives the timing badge and heading caption of the committed photo. A session belongs
 * to one UI owner and is not thread-safe; the shared {@link SolarTimingEngine} is.</p>
 */
public final class PhotoGallerySession {
    private static final Logger LOGGER = LoggerFactory.getLogger(PhotoGallerySession.class);

    public static final String NO_HEADING_LABEL = "No heading data";
    public static final String REASON_NO_SELECTION = "GALLERY_NO_SELECTION";

    private final GalleryOrder order;
    private final CircularGalleryIndex index;
    private final GeoCoordinate spotCoordinate;
    private final SolarTimingEngine timingEngine;

    private PhotoGallerySession(GalleryOrder order, GeoCoordinate spotCoordinate, SolarTimingEngine timingEngine) {
        this.order = order;
        this.index = CircularGalleryIndex.open(order);
        this.spotCoordinate = spotCoordinate;
        this.timingEngine = timingEngine;
    }

    /**
     * Opens a session over a spot's photos.
     *
     * @param photos photos in any order.
     * @param spotCoordinate coordinate of the spot, or {@code null} when unknown.
     * @param timingEngine shared timing engine.
     * @return open session.
     */
    public static PhotoGallerySession open(
            List<PhotoRecord> photos,
            GeoCoordinate spotCoordinate,
            SolarTimingEngine timingEngine
    ) {
        Objects.requireNonNull(timingEngine, "timingEngine");
        GalleryOrder order = HeadingOrderer.order(photos);
        PhotoGallerySession session = new PhotoGallerySession(order, spotCoordinate, timingEngine);
        LOGGER.debug("Opened gallery session: {} photos ({} with heading), mode {}",
                order.size(), order.headedCount(), session.index.mode());
        return session;
    }

    public GalleryOrder order() {
        return order;
    }

    public CircularGalleryIndex index() {
        return index;
    }

    public Optional<GeoCoordinate> spotCoordinate() {
        return Optional.ofNullable(spotCoordinate);
    }

    public Optional<PhotoRecord> currentPhoto() {
        return index.currentPhoto();
    }

    /**
     * Returns the timing badge of the committed photo.
     *
     * <p>Unavailable when the gallery is empty, the photo has no capture instant, or the
     * spot coordinate is missing or invalid.</p>
     */
    public TimingBadge currentBadge() {
        Optional<PhotoRecord> photo = index.currentPhoto();
        if (photo.isEmpty()) {
            return TimingBadge.unavailable(REASON_NO_SELECTION);
        }
        return timingEngine.badgeFor(photo.get().getCaptureInstant(), spotCoordinate);
    }

    /**
     * Returns the heading caption of the committed photo, e.g. {@code 90° E}.
     */
    public Optional<String> currentHeadingLabel() {
        return index.currentPhoto().map(PhotoGallerySession::headingLabel);
    }

    /**
     * Formats a photo's heading caption.
     *
     * @return {@code "<whole degrees>° <compass point>"}, or {@link #NO_HEADING_LABEL}.
     */
    public static String headingLabel(PhotoRecord photo) {
        Objects.requireNonNull(photo, "photo");
        return photo.compassPoint()
                .map(point -> (int) Math.floor(photo.getHeadingDegrees()) + "° " + point.name())
                .orElse(NO_HEADING_LABEL);
    }

    public void step(int delta) {
        index.step(delta);
    }

    public void jumpTo(int realIndex) {
        index.jumpTo(realIndex);
    }

    /**
     * Settles the pending move and returns the new selection.
     */
    public OptionalInt settle() {
        return index.settle();
    }

    public boolean selectExternally(int realIndex) {
        return index.selectExternally(realIndex);
    }

    public boolean selectById(String photoId) {
        return index.selectById(photoId);
    }
}
