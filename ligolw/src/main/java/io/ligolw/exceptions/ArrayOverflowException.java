package io.ligolw.exceptions;

/**
 * A {@code Stream} supplied more values than its {@code Array}'s dimensions can hold.
 */
public final class ArrayOverflowException extends ElementException {
	public ArrayOverflowException(String message) {
		super(message);
	}
}
