package io.ligolw.exceptions;

/**
 * A {@code Type} attribute names a type that {@link io.ligolw.types.TypeClassifier} doesn't recognize.
 */
public final class UnknownTypeException extends LigoLwException {
	private final String typeName;

	public UnknownTypeException(String typeName) {
		super("Unknown type: \"" + typeName + "\"");
		this.typeName = typeName;
	}

	public String typeName() {
		return typeName;
	}
}
