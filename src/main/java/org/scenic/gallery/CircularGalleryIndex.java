package org.scenic.gallery;

import org.scenic.core.photo.PhotoRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Wraparound selection model over a {@link GalleryOrder}.
 *
 * <p>The index runs over a virtual tripled list {@code [copy-1, copy0, copy+1]} of the
 * {@code N} photos so that stepping past either end is always legal. Moves
 * ({@link #step}, {@link #jumpTo}, {@link #jumpToPosition}) only change the internal index;
 * the externally visible selection changes on {@link #commit()}, and {@link #renormalize()}
 * then shifts the internal index back into the middle copy by whole multiples of {@code N},
 * which renders identically.</p>
 *
 * <p>Instances are owned by one UI session and are not thread-safe.</p>
 */
public final class CircularGalleryIndex {
    private static final int COPIES = 3;

    private final GalleryOrder order;
    private final int count;
    private final GalleryMode mode;

    private int internalIndex;
    private int committedRealIndex;
    private boolean movePending;

    private CircularGalleryIndex(GalleryOrder order) {
        this.order = Objects.requireNonNull(order, "order");
        this.count = order.size();
        this.mode = GalleryMode.forCount(count);

        switch (mode) {
            case EMPTY:
                this.internalIndex = 0;
                this.committedRealIndex = -1;
                break;
            case SINGLE:
                this.internalIndex = 0;
                this.committedRealIndex = 0;
                break;
            default:
                int initialRealIndex = order.firstHeadedIndex().orElse(0);
                this.internalIndex = count + initialRealIndex;
                this.committedRealIndex = initialRealIndex;
                break;
        }
    }

    /**
     * Opens an index over an ordered collection.
     *
     * <p>The initial selection is the first photo with a heading, else photo {@code 0},
     * placed in the middle copy.</p>
     *
     * @param order gallery order.
     * @return new index.
     */
    public static CircularGalleryIndex open(GalleryOrder order) {
        return new CircularGalleryIndex(order);
    }

    public GalleryMode mode() {
        return mode;
    }

    public GalleryOrder order() {
        return order;
    }

    /**
     * Returns the number of real photos.
     */
    public int size() {
        return count;
    }

    /**
     * Returns the length of the virtual list the internal index runs over.
     */
    public int virtualSize() {
        return mode == GalleryMode.CIRCULAR ? count * COPIES : count;
    }

    public int internalIndex() {
        return internalIndex;
    }

    /**
     * Returns {@code true} when a move has been applied but not yet committed.
     */
    public boolean isMovePending() {
        return movePending;
    }

    /**
     * Moves the internal index by {@code delta} slots.
     *
     * <p>No-op unless the gallery is circular.</p>
     *
     * @param delta signed number of slots; negative moves backward.
     */
    public void step(int delta) {
        if (mode != GalleryMode.CIRCULAR || delta == 0) {
            return;
        }
        internalIndex = Math.addExact(internalIndex, delta);
        movePending = true;
    }

    public void next() {
        step(1);
    }

    public void previous() {
        step(-1);
    }

    /**
     * Moves to a real index through whichever copy of it is nearest to the internal index.
     *
     * <p>When two copies are equally near, the one in the middle copy wins, then the lower
     * position.</p>
     *
     * @param realIndex target photo index.
     * @throws IndexOutOfBoundsException when {@code realIndex} is outside {@code [0, N)}.
     */
    public void jumpTo(int realIndex) {
        if (mode == GalleryMode.EMPTY) {
            return;
        }
        Objects.checkIndex(realIndex, count);
        if (mode != GalleryMode.CIRCULAR) {
            return;
        }
        int below = internalIndex - Math.floorMod(internalIndex - realIndex, count);
        int above = below + count;
        int distanceBelow = internalIndex - below;
        int distanceAbove = above - internalIndex;

        int target;
        if (distanceBelow != distanceAbove) {
            target = distanceBelow < distanceAbove ? below : above;
        } else {
            target = isInMiddleCopy(above) ? above : below;
        }
        moveTo(target);
    }

    /**
     * Moves to one rendered slot of the virtual list, as when a visible side item is tapped.
     *
     * @param internalPosition slot position in {@code [0, virtualSize())}.
     * @throws IndexOutOfBoundsException when the position is outside the virtual list.
     */
    public void jumpToPosition(int internalPosition) {
        if (mode == GalleryMode.EMPTY) {
            return;
        }
        Objects.checkIndex(internalPosition, virtualSize());
        if (mode != GalleryMode.CIRCULAR) {
            return;
        }
        moveTo(internalPosition);
    }

    /**
     * Publishes the internal index as the selected real index once a move settles.
     *
     * <p>Without a pending move this is a no-op, so a half-finished gesture is never
     * committed twice.</p>
     *
     * @return selection after the commit.
     */
    public OptionalInt commit() {
        if (movePending) {
            committedRealIndex = Math.floorMod(internalIndex, count);
            movePending = false;
        }
        return selection();
    }

    /**
     * Shifts the internal index back into the middle copy {@code [N, 2N)}.
     *
     * <p>The shift is a whole multiple of {@code N}, so the rendered photo and the committed
     * index are unchanged.</p>
     */
    public void renormalize() {
        if (mode != GalleryMode.CIRCULAR) {
            return;
        }
        if (!isInMiddleCopy(internalIndex)) {
            internalIndex = count + Math.floorMod(internalIndex, count);
        }
    }

    /**
     * Commits and renormalizes; the single call a host makes when a gesture or move
     * animation ends.
     *
     * @return selection after settling.
     */
    public OptionalInt settle() {
        OptionalInt selection = commit();
        renormalize();
        return selection;
    }

    /**
     * Applies a selection made outside the gallery, e.g. by a map or list view.
     *
     * <p>The internal index advances by the signed difference between the requested and
     * committed real indices, so an animated host moves the fewest slots consistent with the
     * request. Ignored while a move is pending.</p>
     *
     * @param realIndex requested photo index.
     * @return {@code true} when the selection changed.
     * @throws IndexOutOfBoundsException when {@code realIndex} is outside {@code [0, N)}.
     */
    public boolean selectExternally(int realIndex) {
        if (mode == GalleryMode.EMPTY) {
            return false;
        }
        Objects.checkIndex(realIndex, count);
        if (mode != GalleryMode.CIRCULAR || movePending || realIndex == committedRealIndex) {
            return false;
        }
        internalIndex += realIndex - committedRealIndex;
        committedRealIndex = realIndex;
        return true;
    }

    /**
     * Applies an external selection by photo id.
     *
     * @param photoId id of the photo to select.
     * @return {@code true} when the selection changed; {@code false} for unknown ids.
     */
    public boolean selectById(String photoId) {
        int realIndex = order.indexOf(photoId);
        if (realIndex < 0) {
            return false;
        }
        return selectExternally(realIndex);
    }

    /**
     * Returns the committed real index, or empty for an empty gallery.
     */
    public OptionalInt selection() {
        return mode == GalleryMode.EMPTY ? OptionalInt.empty() : OptionalInt.of(committedRealIndex);
    }

    /**
     * Returns the photo at the committed index.
     */
    public Optional<PhotoRecord> currentPhoto() {
        OptionalInt selection = selection();
        return selection.isPresent() ? Optional.of(order.get(selection.getAsInt())) : Optional.empty();
    }

    /**
     * Returns the slots within {@code radius} of the internal index, clipped to the virtual
     * list.
     *
     * @param radius number of slots on each side of the center.
     * @return slots in ascending position order.
     */
    public List<GallerySlot> visibleWindow(int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("radius must be non-negative: " + radius);
        }
        if (mode == GalleryMode.EMPTY) {
            return List.of();
        }
        if (mode == GalleryMode.SINGLE) {
            return List.of(new GallerySlot(0, 0, order.get(0), true));
        }
        long first = Math.max(0L, (long) internalIndex - radius);
        long last = Math.min(virtualSize() - 1L, (long) internalIndex + radius);
        List<GallerySlot> slots = new ArrayList<>();
        for (long position = first; position <= last; position++) {
            int slotPosition = (int) position;
            int realIndex = Math.floorMod(slotPosition, count);
            slots.add(new GallerySlot(slotPosition, realIndex, order.get(realIndex), slotPosition == internalIndex));
        }
        return slots;
    }

    /**
     * Returns a snapshot of the current bookkeeping.
     */
    public CarouselIndexState state() {
        return CarouselIndexState.builder()
                .realIndexCount(count)
                .internalIndex(internalIndex)
                .committedRealIndex(committedRealIndex)
                .mode(mode)
                .movePending(movePending)
                .build();
    }

    private void moveTo(int target) {
        if (target != internalIndex) {
            internalIndex = target;
            movePending = true;
        }
    }

    private boolean isInMiddleCopy(int position) {
        return position >= count && position < 2 * count;
    }
}
