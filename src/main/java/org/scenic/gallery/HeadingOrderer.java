package org.scenic.gallery;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntComparator;
import lombok.experimental.UtilityClass;
import org.scenic.core.photo.PhotoRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Sorts photo collections into gallery order.
 *
 * <p>Stable partition: photos with a usable heading first, ascending by heading with ties
 * kept in input order, then every other photo in input order. A heading that is
 * non-finite or outside {@code [0, 360)} counts as absent.</p>
 */
@UtilityClass
public class HeadingOrderer {

    /**
     * Orders a photo collection.
     *
     * @param photos photos in any order; {@code null} is treated as empty.
     * @return gallery order.
     * @throws NullPointerException when the list contains a {@code null} element.
     */
    public GalleryOrder order(List<PhotoRecord> photos) {
        if (photos == null || photos.isEmpty()) {
            return GalleryOrder.empty();
        }

        IntArrayList headed = new IntArrayList(photos.size());
        List<PhotoRecord> withoutHeading = new ArrayList<>();
        for (int i = 0; i < photos.size(); i++) {
            PhotoRecord photo = Objects.requireNonNull(photos.get(i), "photos[" + i + "]");
            if (photo.hasUsableHeading()) {
                headed.add(i);
            } else {
                withoutHeading.add(photo);
            }
        }

        // Indices are collected ascending, so the index tie-break keeps equal headings stable.
        IntComparator byHeading = (left, right) -> {
            int cmp = Float.compare(photos.get(left).getHeadingDegrees(), photos.get(right).getHeadingDegrees());
            return cmp != 0 ? cmp : Integer.compare(left, right);
        };
        headed.sort(byHeading);

        List<PhotoRecord> ordered = new ArrayList<>(photos.size());
        for (int i = 0; i < headed.size(); i++) {
            ordered.add(photos.get(headed.getInt(i)));
        }
        ordered.addAll(withoutHeading);
        return new GalleryOrder(ordered, headed.size());
    }

    /**
     * Returns an existing order unchanged; gallery order is idempotent.
     */
    public GalleryOrder order(GalleryOrder order) {
        return Objects.requireNonNull(order, "order");
    }
}
