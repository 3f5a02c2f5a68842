package io.ligolw.exceptions;

/**
 * The content of an element is invalid.
 * <p>
 * This class is concrete so that it can be thrown for problems that have
 * no more specific subclass, like a malformed {@code Dim} size
 * or character data inside an element that doesn't accept any.
 */
public sealed class ElementException extends LigoLwException permits
	ArrayOverflowException,
	ArrayUnderflowException,
	MalformedTokenException
{
	public ElementException(String message) {
		super(message);
	}

	public ElementException(Throwable cause) {
		super(cause);
	}

	public ElementException(String message, Throwable cause) {
		super(message, cause);
	}
}
