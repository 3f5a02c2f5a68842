package io.ligolw.exceptions;

/**
 * A token of delimited character data could not be converted to the expected scalar type.
 */
public final class MalformedTokenException extends ElementException {
	public MalformedTokenException(String message, Throwable cause) {
		super(message, cause);
	}
}
