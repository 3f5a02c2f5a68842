package io.ligolw.types;

import java.util.Locale;

import static io.ligolw.types.StorageKind.FLOAT;
import static io.ligolw.types.StorageKind.INTEGER;

/**
 * The concrete in-memory representation of one scalar value of a LIGO Light Weight type.
 * <p>
 * Java has no unsigned primitives, so each unsigned type is stored in the
 * next wider signed primitive, except {@link #INT_8U}, which is stored in a {@code long}
 * and interpreted as unsigned when parsed and formatted.
 * <p>
 * The storage methods operate on an untyped {@code Object} that must be
 * a primitive array previously returned by {@link #newStorage}
 * for the same scalar type.
 */
public enum ScalarType {
	INT_2S(INTEGER),
	INT_2U(INTEGER),
	INT_4S(INTEGER),
	INT_4U(INTEGER),
	INT_8S(INTEGER),
	INT_8U(INTEGER),
	REAL_4(FLOAT),
	REAL_8(FLOAT);

	private final StorageKind kind;

	ScalarType(StorageKind kind) {
		this.kind = kind;
	}

	public StorageKind kind() {
		return kind;
	}

	/**
	 * @return a zero-filled primitive array of the given length
	 */
	public Object newStorage(int size) {
		return switch (this) {
			case INT_2S -> new short[size];
			case INT_2U, INT_4S -> new int[size];
			case INT_4U, INT_8S, INT_8U -> new long[size];
			case REAL_4 -> new float[size];
			case REAL_8 -> new double[size];
		};
	}

	public Number get(Object storage, int offset) {
		return switch (this) {
			case INT_2S -> ((short[]) storage)[offset];
			case INT_2U, INT_4S -> ((int[]) storage)[offset];
			case INT_4U, INT_8S, INT_8U -> ((long[]) storage)[offset];
			case REAL_4 -> ((float[]) storage)[offset];
			case REAL_8 -> ((double[]) storage)[offset];
		};
	}

	/**
	 * Narrows {@code value} to this type's storage primitive, the way a Java cast would.
	 */
	public void set(Object storage, int offset, Number value) {
		switch (this) {
			case INT_2S -> ((short[]) storage)[offset] = value.shortValue();
			case INT_2U, INT_4S -> ((int[]) storage)[offset] = value.intValue();
			case INT_4U, INT_8S, INT_8U -> ((long[]) storage)[offset] = value.longValue();
			case REAL_4 -> ((float[]) storage)[offset] = value.floatValue();
			case REAL_8 -> ((double[]) storage)[offset] = value.doubleValue();
		}
	}

	/**
	 * @throws NumberFormatException if {@code text} is not a valid literal of this type,
	 * or is outside the range of an unsigned type
	 */
	public Number parse(String text) {
		return switch (this) {
			case INT_2S -> Short.parseShort(text);
			case INT_2U -> unsigned(Integer.parseInt(text), 0xFFFF, text);
			case INT_4S -> Integer.parseInt(text);
			case INT_4U -> unsigned(Long.parseLong(text), 0xFFFF_FFFFL, text);
			case INT_8S -> Long.parseLong(text);
			case INT_8U -> Long.parseUnsignedLong(text);
			case REAL_4 -> parseFloat(text);
			case REAL_8 -> parseDouble(text);
		};
	}

	/**
	 * @return the text representation of {@code value} that {@link #parse} turns back into the same value
	 */
	public String format(Number value) {
		return switch (this) {
			case INT_2S, INT_2U, INT_4S, INT_4U, INT_8S -> Long.toString(value.longValue());
			case INT_8U -> Long.toUnsignedString(value.longValue());
			case REAL_4 -> Float.toString(value.floatValue());
			case REAL_8 -> Double.toString(value.doubleValue());
		};
	}

	private static int unsigned(int value, int max, String text) {
		if (value < 0 || value > max) {
			throw new NumberFormatException("Value out of range: \"" + text + "\"");
		}
		return value;
	}

	private static long unsigned(long value, long max, String text) {
		if (value < 0 || value > max) {
			throw new NumberFormatException("Value out of range: \"" + text + "\"");
		}
		return value;
	}

	/**
	 * Other writers spell the special values the C way, so accept those
	 * in addition to Java's own spellings.
	 */
	private static float parseFloat(String text) {
		return switch (text.toLowerCase(Locale.ROOT)) {
			case "inf", "+inf", "infinity", "+infinity" -> Float.POSITIVE_INFINITY;
			case "-inf", "-infinity" -> Float.NEGATIVE_INFINITY;
			case "nan", "+nan", "-nan" -> Float.NaN;
			default -> Float.parseFloat(text);
		};
	}

	private static double parseDouble(String text) {
		return switch (text.toLowerCase(Locale.ROOT)) {
			case "inf", "+inf", "infinity", "+infinity" -> Double.POSITIVE_INFINITY;
			case "-inf", "-infinity" -> Double.NEGATIVE_INFINITY;
			case "nan", "+nan", "-nan" -> Double.NaN;
			default -> Double.parseDouble(text);
		};
	}
}
