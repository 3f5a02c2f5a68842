package io.ligolw.exceptions;

/**
 * Base of all the unchecked exceptions thrown while building, loading or writing
 * a LIGO Light Weight document.
 */
public sealed abstract class LigoLwException extends RuntimeException permits ElementException, UnknownTypeException {
	protected LigoLwException(String message) {
		super(message);
	}

	protected LigoLwException(Throwable cause) {
		super(cause);
	}

	protected LigoLwException(String message, Throwable cause) {
		super(message, cause);
	}
}
