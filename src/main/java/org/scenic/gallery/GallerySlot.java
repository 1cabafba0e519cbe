package org.scenic.gallery;

import lombok.Value;
import org.scenic.core.photo.PhotoRecord;

/**
 * One rendered item of the gallery window around the internal index.
 */
@Value
public class GallerySlot {

    /**
     * Position in the virtual tripled list.
     */
    int internalPosition;

    /**
     * Real photo index, {@code internalPosition mod N}.
     */
    int realIndex;

    PhotoRecord photo;

    /**
     * True for the slot at the internal index.
     */
    boolean center;
}
