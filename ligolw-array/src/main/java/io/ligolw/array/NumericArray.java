package io.ligolw.array;

import io.ligolw.types.ScalarType;
import io.ligolw.types.TypeClassifier;
import java.util.Arrays;
import java.util.Objects;

/**
 * An in-memory N-dimensional array of numbers, all of one {@link ScalarType}.
 * <p>
 * Storage is a single primitive array in which position 0 of the shape has stride 1,
 * so walking the storage from start to end visits indexes in {@link IndexSequencer} order.
 */
public final class NumericArray {
	private final ScalarType type;
	private final int[] shape;
	private final int[] strides;
	private final int size;
	private final Object storage;

	private NumericArray(ScalarType type, int[] shape) {
		this.type = type;
		this.shape = shape.clone();
		this.size = Shapes.size(shape);
		this.strides = new int[shape.length];
		int stride = 1;
		for (int i = 0; i < shape.length; i++) {
			strides[i] = stride;
			stride *= shape[i];
		}
		this.storage = type.newStorage(size);
	}

	/**
	 * @throws IllegalArgumentException if any size is negative
	 */
	public static NumericArray zeros(ScalarType type, int... shape) {
		for (int s : shape) {
			if (s < 0) {
				throw new IllegalArgumentException("Negative size in shape " + Arrays.toString(shape));
			}
		}
		return new NumericArray(type, shape);
	}

	/**
	 * @param values in {@link IndexSequencer} order
	 * @throws IllegalArgumentException if the number of values doesn't match the shape
	 */
	public static NumericArray of(ScalarType type, int[] shape, Number... values) {
		NumericArray result = zeros(type, shape);
		if (values.length != result.size) {
			throw new IllegalArgumentException("Shape " + Arrays.toString(shape) + " needs " + result.size + " values; got " + values.length);
		}
		IndexSequencer indexes = new IndexSequencer(shape);
		for (Number value : values) {
			result.set(indexes.next(), value);
		}
		return result;
	}

	public ScalarType type() {
		return type;
	}

	public int[] shape() {
		return shape.clone();
	}

	public int rank() {
		return shape.length;
	}

	public int size() {
		return size;
	}

	public Number get(int... index) {
		return type.get(storage, offsetOf(index));
	}

	/**
	 * Stores {@code value}, narrowed to this array's scalar type.
	 */
	public void set(int[] index, Number value) {
		type.set(storage, offsetOf(index), value);
	}

	private int offsetOf(int[] index) {
		if (index.length != shape.length) {
			throw new IndexOutOfBoundsException("Index " + Arrays.toString(index) + " has wrong rank for shape " + Arrays.toString(shape));
		}
		int offset = 0;
		for (int i = 0; i < index.length; i++) {
			if (index[i] < 0 || index[i] >= shape[i]) {
				throw new IndexOutOfBoundsException("Index " + Arrays.toString(index) + " out of bounds for shape " + Arrays.toString(shape));
			}
			offset += index[i] * strides[i];
		}
		return offset;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		NumericArray that = (NumericArray) o;
		return type == that.type
			&& Arrays.equals(shape, that.shape)
			&& Objects.deepEquals(storage, that.storage);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, Arrays.hashCode(shape), Arrays.deepHashCode(new Object[]{storage}));
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("NumericArray(")
			.append(TypeClassifier.nameFor(type))
			.append(", shape=").append(Arrays.toString(shape))
			.append(", [");
		IndexSequencer indexes = new IndexSequencer(shape);
		String separator = "";
		while (indexes.hasNext()) {
			sb.append(separator).append(type.format(get(indexes.next())));
			separator = ", ";
		}
		return sb.append("])").toString();
	}
}
