package org.scenic.gallery;

/**
 * Behaviour class of a gallery, fixed by its photo count when it is opened.
 */
public enum GalleryMode {
    /** No photos; every operation is a no-op with no selection. */
    EMPTY,
    /** One photo; no wraparound, selection is always {@code 0}. */
    SINGLE,
    /** Two or more photos; stepping wraps around in both directions. */
    CIRCULAR;

    /**
     * Returns the mode of a gallery with {@code count} photos.
     */
    public static GalleryMode forCount(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative: " + count);
        }
        if (count == 0) {
            return EMPTY;
        }
        return count == 1 ? SINGLE : CIRCULAR;
    }
}
