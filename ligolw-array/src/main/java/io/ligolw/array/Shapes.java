package io.ligolw.array;

/**
 * Converts between the dimension sizes declared by {@code Dim} elements
 * and the shape of the in-memory array.
 * <p>
 * The two are reversed: a document lists dimensions slowest-varying first,
 * while a shape lists them fastest-varying first.
 * The last {@code Dim} is therefore position 0 of the shape,
 * which is the position {@link IndexSequencer} increments first.
 */
public final class Shapes {
	private Shapes() { }

	public static int[] resolveShape(int[] dimensions) {
		return reversed(dimensions);
	}

	public static int[] dimensionsFromShape(int[] shape) {
		return reversed(shape);
	}

	/**
	 * @return the number of elements in an array of the given shape
	 */
	public static int size(int[] shape) {
		int result = 1;
		for (int s : shape) {
			result = Math.multiplyExact(result, s);
		}
		return result;
	}

	private static int[] reversed(int[] values) {
		int[] result = new int[values.length];
		for (int i = 0; i < values.length; i++) {
			result[i] = values[values.length - 1 - i];
		}
		return result;
	}
}
