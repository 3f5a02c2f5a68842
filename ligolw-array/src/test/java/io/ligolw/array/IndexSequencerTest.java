package io.ligolw.array;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndexSequencerTest {

	@Test
	void positionZeroVariesFastest() {
		IndexSequencer sequencer = new IndexSequencer(2, 3);
		int[][] expected = {
			{0, 0}, {1, 0},
			{0, 1}, {1, 1},
			{0, 2}, {1, 2},
		};
		for (int[] index : expected) {
			assertTrue(sequencer.hasNext());
			assertArrayEquals(index, sequencer.next());
		}
		assertFalse(sequencer.hasNext());
		assertThrows(NoSuchElementException.class, sequencer::next);
	}

	@Test
	void lengthIsProductOfSizes() {
		assertEquals(2 * 3 * 4, drain(new IndexSequencer(2, 3, 4)).size());
		assertEquals(5, drain(new IndexSequencer(5)).size());
		assertEquals(1, drain(new IndexSequencer(1, 1, 1)).size());
	}

	@Test
	void zeroSizeDimensionIsEmpty() {
		assertFalse(new IndexSequencer(3, 0, 2).hasNext());
		assertFalse(new IndexSequencer(0).hasNext());
	}

	@Test
	void emptyShapeHasOneIndex() {
		List<int[]> indexes = drain(new IndexSequencer());
		assertEquals(1, indexes.size());
		assertArrayEquals(new int[]{}, indexes.get(0));
	}

	@Test
	void returnedIndexesAreIndependent() {
		IndexSequencer sequencer = new IndexSequencer(2);
		int[] first = sequencer.next();
		sequencer.next();
		assertArrayEquals(new int[]{0}, first);
	}

	@Test
	void shapeIsCopied() {
		int[] shape = {2};
		IndexSequencer sequencer = new IndexSequencer(shape);
		shape[0] = 100;
		assertEquals(2, drain(sequencer).size());
	}

	@Test
	void negativeSize() {
		assertThrows(IllegalArgumentException.class, () -> new IndexSequencer(2, -1));
	}

	private static List<int[]> drain(IndexSequencer sequencer) {
		List<int[]> result = new ArrayList<>();
		while (sequencer.hasNext()) {
			result.add(sequencer.next());
		}
		return result;
	}
}
