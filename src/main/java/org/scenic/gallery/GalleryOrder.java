package org.scenic.gallery;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.scenic.core.photo.PhotoRecord;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Canonical display sequence of one photo collection.
 *
 * <p>Photos with a usable heading come first in ascending heading order; the rest follow in
 * their original relative order. Instances are immutable and safe for concurrent reads.
 * Only {@link HeadingOrderer} creates them.</p>
 */
public final class GalleryOrder {
    private static final GalleryOrder EMPTY = new GalleryOrder(List.of(), 0);

    private final List<PhotoRecord> photos;
    private final int headedCount;
    // photo id -> gallery position, first occurrence wins
    private final Object2IntOpenHashMap<String> positionById;

    GalleryOrder(List<PhotoRecord> orderedPhotos, int headedCount) {
        Objects.requireNonNull(orderedPhotos, "orderedPhotos");
        if (headedCount < 0 || headedCount > orderedPhotos.size()) {
            throw new IllegalArgumentException("headedCount out of bounds: " + headedCount);
        }
        this.photos = List.copyOf(orderedPhotos);
        this.headedCount = headedCount;

        this.positionById = new Object2IntOpenHashMap<>(photos.size());
        this.positionById.defaultReturnValue(-1);
        for (int i = 0; i < photos.size(); i++) {
            positionById.putIfAbsent(photos.get(i).getId(), i);
        }
        this.positionById.trim();
    }

    /**
     * Returns the shared empty order.
     */
    public static GalleryOrder empty() {
        return EMPTY;
    }

    /**
     * Returns the ordered photos as an unmodifiable list.
     */
    public List<PhotoRecord> photos() {
        return photos;
    }

    /**
     * Returns the photo at a gallery position.
     *
     * @throws IndexOutOfBoundsException when {@code index} is outside {@code [0, size)}.
     */
    public PhotoRecord get(int index) {
        return photos.get(index);
    }

    public int size() {
        return photos.size();
    }

    public boolean isEmpty() {
        return photos.isEmpty();
    }

    /**
     * Returns the number of leading photos that carry a usable heading.
     */
    public int headedCount() {
        return headedCount;
    }

    /**
     * Returns the position of the first photo with a usable heading.
     *
     * <p>Always {@code 0} when any heading exists, since headed photos lead.</p>
     */
    public OptionalInt firstHeadedIndex() {
        return headedCount > 0 ? OptionalInt.of(0) : OptionalInt.empty();
    }

    /**
     * Returns the gallery position of a photo id, or {@code -1} when absent.
     */
    public int indexOf(String photoId) {
        if (photoId == null) {
            return -1;
        }
        return positionById.getInt(photoId);
    }

    /**
     * Returns {@code true} when a photo id is part of this order.
     */
    public boolean contains(String photoId) {
        return indexOf(photoId) >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GalleryOrder)) {
            return false;
        }
        GalleryOrder other = (GalleryOrder) o;
        return headedCount == other.headedCount && photos.equals(other.photos);
    }

    @Override
    public int hashCode() {
        return 31 * photos.hashCode() + headedCount;
    }

    @Override
    public String toString() {
        return "GalleryOrder(size=" + photos.size() + ", headedCount=" + headedCount + ")";
    }
}
