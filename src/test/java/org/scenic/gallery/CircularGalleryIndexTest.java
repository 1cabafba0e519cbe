package org.scenic.gallery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.scenic.core.photo.PhotoRecord;

import java.util.List;
import java.util.OptionalInt;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.scenic.testutil.PhotoFixtures.headed;
import static org.scenic.testutil.PhotoFixtures.headedRun;
import static org.scenic.testutil.PhotoFixtures.unheaded;

@DisplayName("CircularGalleryIndex Tests")
class CircularGalleryIndexTest {

    private static CircularGalleryIndex openRun(int count) {
        return CircularGalleryIndex.open(HeadingOrderer.order(headedRun(count)));
    }

    @Nested
    @DisplayName("Opening")
    class Opening {

        @Test
        @DisplayName("Circular gallery starts in the middle copy at the first headed photo")
        void testCircularInit() {
            CircularGalleryIndex index = openRun(5);
            assertEquals(GalleryMode.CIRCULAR, index.mode());
            assertEquals(5, index.internalIndex());
            assertEquals(OptionalInt.of(0), index.selection());
            assertEquals(15, index.virtualSize());
            assertFalse(index.isMovePending());
            assertEquals("p0", index.currentPhoto().orElseThrow().getId());
        }

        @Test
        @DisplayName("Gallery without headings starts at photo zero")
        void testNoHeadingInit() {
            CircularGalleryIndex index = CircularGalleryIndex.open(
                    HeadingOrderer.order(List.of(unheaded("a"), unheaded("b"), unheaded("c"))));
            assertEquals(3, index.internalIndex());
            assertEquals(OptionalInt.of(0), index.selection());
        }

        @Test
        @DisplayName("Empty gallery has no selection and every operation is a no-op")
        void testEmptyGallery() {
            CircularGalleryIndex index = CircularGalleryIndex.open(GalleryOrder.empty());
            assertEquals(GalleryMode.EMPTY, index.mode());
            assertTrue(index.selection().isEmpty());
            assertTrue(index.currentPhoto().isEmpty());

            index.step(3);
            index.jumpTo(7);
            index.jumpToPosition(1);
            assertTrue(index.settle().isEmpty());
            assertFalse(index.selectExternally(0));
            assertFalse(index.selectById("a"));
            assertTrue(index.visibleWindow(2).isEmpty());
            assertEquals(-1, index.state().getCommittedRealIndex());
            assertEquals(0, index.internalIndex());
        }

        @Test
        @DisplayName("Single photo never wraps and stays selected")
        void testSingleGallery() {
            CircularGalleryIndex index = CircularGalleryIndex.open(HeadingOrderer.order(List.of(headed("only", 10.0f))));
            assertEquals(GalleryMode.SINGLE, index.mode());

            index.step(1);
            index.step(-4);
            index.jumpTo(0);
            assertFalse(index.isMovePending());
            assertEquals(OptionalInt.of(0), index.settle());
            assertFalse(index.selectExternally(0));
            assertEquals(0, index.internalIndex());

            List<GallerySlot> window = index.visibleWindow(3);
            assertEquals(1, window.size());
            assertEquals(new GallerySlot(0, 0, index.order().get(0), true), window.get(0));
            assertThrows(IndexOutOfBoundsException.class, () -> index.jumpTo(1));
        }
    }

    @Nested
    @DisplayName("Stepping")
    class Stepping {

        @Test
        @DisplayName("Stepping back from the first photo wraps to the last")
        void testBackwardWrap() {
            CircularGalleryIndex index = openRun(5);
            index.step(-1);
            assertTrue(index.isMovePending());
            assertEquals(OptionalInt.of(0), index.selection());

            assertEquals(OptionalInt.of(4), index.settle());
            assertEquals(9, index.internalIndex());
        }

        @Test
        @DisplayName("Stepping forward past the last photo wraps to the first")
        void testForwardWrap() {
            CircularGalleryIndex index = openRun(3);
            index.jumpTo(2);
            index.settle();
            index.next();
            assertEquals(OptionalInt.of(0), index.settle());
            assertEquals(3, index.internalIndex());
        }

        @Test
        @DisplayName("Commit without a pending move changes nothing")
        void testCommitWithoutMove() {
            CircularGalleryIndex index = openRun(4);
            CarouselIndexState before = index.state();
            index.commit();
            index.renormalize();
            assertEquals(before, index.state());
        }

        @Test
        @DisplayName("Commit publishes before renormalize shifts the internal index")
        void testCommitThenRenormalize() {
            CircularGalleryIndex index = openRun(4);
            index.step(5);
            assertEquals(9, index.internalIndex());
            assertEquals(OptionalInt.of(1), index.commit());
            assertEquals(9, index.internalIndex());
            index.renormalize();
            assertEquals(5, index.internalIndex());
            assertEquals(OptionalInt.of(1), index.selection());
        }

        @Test
        @DisplayName("Random step sequences keep selection equal to the wrapped sum")
        void testRandomSteps() {
            Random random = new Random(7L);
            for (int round = 0; round < 100; round++) {
                int count = 2 + random.nextInt(12);
                CircularGalleryIndex index = openRun(count);
                int expected = 0;
                for (int move = 0; move < 40; move++) {
                    int delta = random.nextInt(2 * count + 1) - count;
                    index.step(delta);
                    expected = Math.floorMod(expected + delta, count);
                    if (random.nextBoolean()) {
                        index.settle();
                        assertEquals(OptionalInt.of(expected), index.selection());
                        assertTrue(index.internalIndex() >= count && index.internalIndex() < 2 * count);
                        assertEquals(expected, Math.floorMod(index.internalIndex(), count));
                    }
                }
                index.settle();
                assertEquals(OptionalInt.of(expected), index.selection());
            }
        }
    }

    @Nested
    @DisplayName("Jumping")
    class Jumping {

        @Test
        @DisplayName("Jump takes the nearer copy of the target")
        void testJumpNearestCopy() {
            CircularGalleryIndex index = openRun(5);
            index.jumpTo(4);
            assertEquals(4, index.internalIndex());
            assertEquals(OptionalInt.of(4), index.settle());
            assertEquals(9, index.internalIndex());

            CircularGalleryIndex other = openRun(5);
            other.jumpTo(1);
            assertEquals(6, other.internalIndex());
        }

        @Test
        @DisplayName("Equidistant copies resolve to the middle copy")
        void testJumpTie() {
            CircularGalleryIndex index = openRun(4);
            index.jumpTo(2);
            assertEquals(6, index.internalIndex());

            CircularGalleryIndex outside = openRun(4);
            outside.step(-2);
            assertEquals(2, outside.internalIndex());
            outside.jumpTo(0);
            assertEquals(4, outside.internalIndex());
        }

        @Test
        @DisplayName("Jump to the current photo is not a move")
        void testJumpToSelf() {
            CircularGalleryIndex index = openRun(5);
            index.jumpTo(0);
            assertFalse(index.isMovePending());
        }

        @Test
        @DisplayName("Jump rejects indices outside the collection")
        void testJumpBounds() {
            CircularGalleryIndex index = openRun(3);
            assertThrows(IndexOutOfBoundsException.class, () -> index.jumpTo(3));
            assertThrows(IndexOutOfBoundsException.class, () -> index.jumpTo(-1));
            assertThrows(IndexOutOfBoundsException.class, () -> index.jumpToPosition(9));
        }

        @Test
        @DisplayName("Tapping a side slot commits its real photo")
        void testJumpToPosition() {
            CircularGalleryIndex index = openRun(3);
            index.jumpToPosition(2);
            assertEquals(OptionalInt.of(2), index.settle());
            assertEquals(5, index.internalIndex());
        }
    }

    @Nested
    @DisplayName("External selection")
    class ExternalSelection {

        @Test
        @DisplayName("External selection moves by the signed real-index difference")
        void testSelectExternally() {
            CircularGalleryIndex index = openRun(5);
            assertTrue(index.selectExternally(3));
            assertEquals(8, index.internalIndex());
            assertEquals(OptionalInt.of(3), index.selection());
            assertFalse(index.isMovePending());

            assertTrue(index.selectExternally(1));
            assertEquals(6, index.internalIndex());
        }

        @Test
        @DisplayName("Selecting the current photo is ignored")
        void testSelectSame() {
            CircularGalleryIndex index = openRun(5);
            assertFalse(index.selectExternally(0));
            assertEquals(5, index.internalIndex());
        }

        @Test
        @DisplayName("Pending user move wins over an external selection")
        void testPendingMoveBlocks() {
            CircularGalleryIndex index = openRun(5);
            index.step(1);
            assertFalse(index.selectExternally(3));
            assertEquals(OptionalInt.of(1), index.settle());
            assertTrue(index.selectExternally(3));
        }

        @Test
        @DisplayName("Selection by id uses the gallery position")
        void testSelectById() {
            CircularGalleryIndex index = openRun(4);
            assertTrue(index.selectById("p2"));
            assertEquals("p2", index.currentPhoto().map(PhotoRecord::getId).orElseThrow());
            assertFalse(index.selectById("nope"));
            assertFalse(index.selectById(null));
            assertThrows(IndexOutOfBoundsException.class, () -> index.selectExternally(4));
        }
    }

    @Nested
    @DisplayName("Visible window")
    class VisibleWindow {

        @Test
        @DisplayName("Window maps slot positions to real indices around the center")
        void testWindow() {
            CircularGalleryIndex index = openRun(3);
            List<GallerySlot> window = index.visibleWindow(2);

            assertEquals(5, window.size());
            int[] expectedReal = {1, 2, 0, 1, 2};
            for (int i = 0; i < window.size(); i++) {
                GallerySlot slot = window.get(i);
                assertEquals(1 + i, slot.getInternalPosition());
                assertEquals(expectedReal[i], slot.getRealIndex());
                assertEquals(index.order().get(expectedReal[i]), slot.getPhoto());
                assertEquals(i == 2, slot.isCenter());
            }
        }

        @Test
        @DisplayName("Window is clipped to the virtual list")
        void testWindowClipped() {
            CircularGalleryIndex index = openRun(2);
            List<GallerySlot> window = index.visibleWindow(100);
            assertEquals(6, window.size());
            assertEquals(0, window.get(0).getInternalPosition());
            assertEquals(5, window.get(5).getInternalPosition());
        }

        @Test
        @DisplayName("Negative radius is rejected")
        void testNegativeRadius() {
            CircularGalleryIndex index = openRun(2);
            assertThrows(IllegalArgumentException.class, () -> index.visibleWindow(-1));
        }
    }
}
