package io.ligolw.array;

import static java.util.Objects.requireNonNull;

/**
 * @param delimiter separates values in the {@code Stream} of an array built by
 *                  {@link TypedArray#fromArray}; arrays read from a document keep their own
 * @param rejectUnderfill if true, a {@code Stream} that ends before filling its array
 *                        throws {@link io.ligolw.exceptions.ArrayUnderflowException};
 *                        otherwise the unfilled positions are left as zero
 */
public record ArraySettings(
	String delimiter,
	boolean rejectUnderfill
) {
	public static final ArraySettings DEFAULT = new ArraySettings(" ", false);

	public ArraySettings {
		requireNonNull(delimiter);
		if (delimiter.isEmpty()) {
			throw new IllegalArgumentException("Delimiter can't be empty");
		}
		for (int i = 0; i < delimiter.length(); i++) {
			char c = delimiter.charAt(i);
			// These can occur inside a formatted value, including NaN and Infinity
			if (Character.isLetterOrDigit(c) || c == '-' || c == '+' || c == '.') {
				throw new IllegalArgumentException("Delimiter can't contain '" + c + "': \"" + delimiter + "\"");
			}
		}
	}

	public ArraySettings withDelimiter(String delimiter) {
		return new ArraySettings(delimiter, rejectUnderfill);
	}

	public ArraySettings withRejectUnderfill(boolean rejectUnderfill) {
		return new ArraySettings(delimiter, rejectUnderfill);
	}
}
