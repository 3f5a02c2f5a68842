package io.ligolw.exceptions;

/**
 * A {@code Stream} ended before supplying a value for every position of its {@code Array}.
 * Only thrown when the reader has been asked to reject partially filled arrays;
 * otherwise the missing positions simply keep their zero value.
 */
public final class ArrayUnderflowException extends ElementException {
	public ArrayUnderflowException(String message) {
		super(message);
	}
}
