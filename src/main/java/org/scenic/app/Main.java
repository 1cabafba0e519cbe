package org.scenic.app;

import org.scenic.core.geo.GeoCoordinate;
import org.scenic.core.photo.PhotoRecord;
import org.scenic.session.PhotoGallerySession;
import org.scenic.timing.solar.SolarTimingConfig;
import org.scenic.timing.solar.SolarTimingEngine;

import java.time.Instant;
import java.util.List;

/**
 * Minimal application entry point used for local smoke runs.
 *
 * <p>Opens a gallery over a small sample spot, steps once around it, and prints each
 * photo's heading caption and timing badge.</p>
 */
public class Main {
    private static final GeoCoordinate SAMPLE_SPOT = GeoCoordinate.of(40.0d, -105.0d);

    /**
     * Launches the sample gallery walk.
     *
     * @param args command-line arguments (unused).
     */
    public static void main(String[] args) {
        SolarTimingEngine engine = new SolarTimingEngine(SolarTimingConfig.utc());
        PhotoGallerySession session = PhotoGallerySession.open(samplePhotos(), SAMPLE_SPOT, engine);

        System.out.printf("Gallery of %d photos%n", session.order().size());
        for (int i = 0; i < session.order().size(); i++) {
            PhotoRecord photo = session.currentPhoto().orElseThrow();
            System.out.printf("[%d] %s | %s | %s%n",
                    session.index().selection().orElse(-1),
                    photo.getId(),
                    PhotoGallerySession.headingLabel(photo),
                    session.currentBadge().label());
            session.step(1);
            session.settle();
        }
    }

    static List<PhotoRecord> samplePhotos() {
        return List.of(
                PhotoRecord.builder()
                        .id("IMG_8610")
                        .captureInstant(Instant.parse("2024-03-20T17:15:00Z"))
                        .headingDegrees(180.0f)
                        .build(),
                PhotoRecord.builder()
                        .id("IMG_8608")
                        .captureInstant(Instant.parse("2024-03-20T05:38:00Z"))
                        .headingDegrees(15.0f)
                        .build(),
                PhotoRecord.builder()
                        .id("IMG_8611")
                        .build(),
                PhotoRecord.builder()
                        .id("IMG_8609")
                        .captureInstant(Instant.parse("2024-03-20T18:20:00Z"))
                        .headingDegrees(90.0f)
                        .build()
        );
    }
}
