package io.ligolw.array;

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Enumerates every index of an array with a given shape, in odometer order:
 * position 0 varies fastest, and each position carries into the next when it
 * reaches its size.
 * <p>
 * For shape {@code (2,3)} the sequence is
 * {@code (0,0) (1,0) (0,1) (1,1) (0,2) (1,2)}.
 * If any dimension has size zero, the sequence is empty.
 * <p>
 * A sequencer makes a single pass; create a new one to start over.
 */
public final class IndexSequencer {
	private final int[] shape;
	private final int[] index;
	private boolean exhausted;

	public IndexSequencer(int... shape) {
		for (int s : shape) {
			if (s < 0) {
				throw new IllegalArgumentException("Negative size in shape " + Arrays.toString(shape));
			}
		}
		this.shape = shape.clone();
		this.index = new int[shape.length];
		this.exhausted = Arrays.stream(shape).anyMatch(s -> s == 0);
	}

	public boolean hasNext() {
		return !exhausted;
	}

	/**
	 * @return a newly allocated array holding the next index
	 * @throws NoSuchElementException if {@link #hasNext()} is false
	 */
	public int[] next() {
		if (exhausted) {
			throw new NoSuchElementException("All indexes of shape " + Arrays.toString(shape) + " have been produced");
		}
		int[] result = index.clone();
		advance();
		return result;
	}

	private void advance() {
		for (int i = 0; i < index.length; i++) {
			if (++index[i] < shape[i]) {
				return;
			}
			index[i] = 0;
		}
		exhausted = true;
	}
}
