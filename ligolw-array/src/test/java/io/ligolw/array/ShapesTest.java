package io.ligolw.array;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ShapesTest {

	@Test
	void lastDimensionVariesFastest() {
		assertArrayEquals(new int[]{2, 3, 5}, Shapes.resolveShape(new int[]{5, 3, 2}));
		assertArrayEquals(new int[]{5, 3, 2}, Shapes.dimensionsFromShape(new int[]{2, 3, 5}));
	}

	@ParameterizedTest
	@MethodSource("dimensionLists")
	void dimensionsAndShapeAreDual(int[] dimensions) {
		int[] shape = Shapes.resolveShape(dimensions);
		assertArrayEquals(shape, Shapes.resolveShape(Shapes.dimensionsFromShape(shape)));
		assertArrayEquals(dimensions, Shapes.dimensionsFromShape(shape));
	}

	static Stream<int[]> dimensionLists() {
		return Stream.of(
			new int[]{},
			new int[]{7},
			new int[]{1, 1},
			new int[]{3, 0},
			new int[]{4, 2},
			new int[]{2, 3, 4, 5}
		);
	}

	@Test
	void resolveShapeDoesNotModifyItsArgument() {
		int[] dimensions = {1, 2};
		Shapes.resolveShape(dimensions);
		assertArrayEquals(new int[]{1, 2}, dimensions);
	}

	@Test
	void size() {
		assertEquals(1, Shapes.size(new int[]{}));
		assertEquals(0, Shapes.size(new int[]{4, 0, 3}));
		assertEquals(24, Shapes.size(new int[]{2, 3, 4}));
		assertThrows(ArithmeticException.class, () -> Shapes.size(new int[]{1 << 16, 1 << 16}));
	}
}
