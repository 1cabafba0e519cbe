package org.scenic.gallery;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time copy of a {@link CircularGalleryIndex}'s bookkeeping.
 */
@Value
@Builder
public class CarouselIndexState {

    /**
     * Number of real photos {@code N}.
     */
    int realIndexCount;

    /**
     * Position in the virtual tripled list {@code [copy-1, copy0, copy+1]}.
     */
    int internalIndex;

    /**
     * Last committed real index in {@code [0, N)}, or {@code -1} for an empty gallery.
     */
    int committedRealIndex;

    GalleryMode mode;

    /**
     * True while a step or jump has not yet been committed.
     */
    boolean movePending;
}
