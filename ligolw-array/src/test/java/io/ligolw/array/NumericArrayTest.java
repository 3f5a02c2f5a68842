package io.ligolw.array;

import org.junit.jupiter.api.Test;

import static io.ligolw.types.ScalarType.INT_2S;
import static io.ligolw.types.ScalarType.INT_4S;
import static io.ligolw.types.ScalarType.REAL_8;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NumericArrayTest {

	@Test
	void zerosAreZero() {
		NumericArray array = NumericArray.zeros(REAL_8, 2, 2);
		assertEquals(4, array.size());
		assertEquals(2, array.rank());
		assertEquals(0.0, array.get(1, 1));
	}

	@Test
	void valuesAreInSequencerOrder() {
		NumericArray array = NumericArray.of(INT_4S, new int[]{2, 3}, 1, 4, 2, 5, 3, 6);
		assertEquals(1, array.get(0, 0));
		assertEquals(4, array.get(1, 0));
		assertEquals(2, array.get(0, 1));
		assertEquals(6, array.get(1, 2));
	}

	@Test
	void setNarrows() {
		NumericArray array = NumericArray.zeros(INT_2S, 1);
		array.set(new int[]{0}, 2.9);
		assertEquals((short) 2, array.get(0));
	}

	@Test
	void shapeIsDefensivelyCopied() {
		int[] shape = {2};
		NumericArray array = NumericArray.zeros(INT_4S, shape);
		shape[0] = 5;
		array.shape()[0] = 7;
		assertArrayEquals(new int[]{2}, array.shape());
	}

	@Test
	void outOfBounds() {
		NumericArray array = NumericArray.zeros(INT_4S, 2, 3);
		assertThrows(IndexOutOfBoundsException.class, () -> array.get(2, 0));
		assertThrows(IndexOutOfBoundsException.class, () -> array.get(0, -1));
		assertThrows(IndexOutOfBoundsException.class, () -> array.get(0));
	}

	@Test
	void wrongNumberOfValues() {
		assertThrows(IllegalArgumentException.class, () -> NumericArray.of(INT_4S, new int[]{2, 2}, 1, 2, 3));
	}

	@Test
	void equality() {
		NumericArray a = NumericArray.of(REAL_8, new int[]{2}, 1.0, Double.NaN);
		NumericArray b = NumericArray.of(REAL_8, new int[]{2}, 1.0, Double.NaN);
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertNotEquals(a, NumericArray.of(REAL_8, new int[]{1, 2}, 1.0, Double.NaN));
		assertNotEquals(a, NumericArray.of(INT_4S, new int[]{2}, 1, 0));
	}

	@Test
	void toStringListsValues() {
		assertEquals("NumericArray(int_4s, shape=[2], [7, 8])", NumericArray.of(INT_4S, new int[]{2}, 7, 8).toString());
	}
}
