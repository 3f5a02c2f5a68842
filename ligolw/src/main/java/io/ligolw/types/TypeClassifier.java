package io.ligolw.types;

import io.ligolw.exceptions.UnknownTypeException;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

import static io.ligolw.types.ScalarType.INT_2S;
import static io.ligolw.types.ScalarType.INT_2U;
import static io.ligolw.types.ScalarType.INT_4S;
import static io.ligolw.types.ScalarType.INT_4U;
import static io.ligolw.types.ScalarType.INT_8S;
import static io.ligolw.types.ScalarType.INT_8U;
import static io.ligolw.types.ScalarType.REAL_4;
import static io.ligolw.types.ScalarType.REAL_8;

/**
 * Maps the type names that appear in {@code Type} attributes
 * to {@link ScalarType}s and back.
 * <p>
 * Several names can map to the same scalar type ({@code int} is {@code int_4s};
 * {@code float} and {@code double} are both {@code real_8}).
 * {@link #nameFor} always returns the canonical name.
 */
public final class TypeClassifier {
	private static final Map<String, ScalarType> SCALAR_TYPES_BY_NAME;
	private static final Map<ScalarType, String> CANONICAL_NAMES = new EnumMap<>(ScalarType.class);

	static {
		Map<String, ScalarType> map = new LinkedHashMap<>();
		map.put("int_2s", INT_2S);
		map.put("int_2u", INT_2U);
		map.put("int_4s", INT_4S);
		map.put("int_4u", INT_4U);
		map.put("int_8s", INT_8S);
		map.put("int_8u", INT_8U);
		map.put("real_4", REAL_4);
		map.put("real_8", REAL_8);
		map.forEach((name, type) -> CANONICAL_NAMES.put(type, name));

		// Aliases
		map.put("int", INT_4S);
		map.put("float", REAL_8);
		map.put("double", REAL_8);
		SCALAR_TYPES_BY_NAME = Map.copyOf(map);
	}

	private TypeClassifier() { }

	/**
	 * @throws UnknownTypeException if {@code typeName} is not a recognized numeric type
	 */
	public static ScalarType storageScalarType(@Nullable String typeName) {
		ScalarType result = (typeName == null)? null : SCALAR_TYPES_BY_NAME.get(typeName);
		if (result == null) {
			throw new UnknownTypeException(typeName);
		}
		return result;
	}

	/**
	 * @throws UnknownTypeException if {@code typeName} is not a recognized numeric type
	 */
	public static StorageKind classify(@Nullable String typeName) {
		return storageScalarType(typeName).kind();
	}

	public static String nameFor(ScalarType type) {
		return CANONICAL_NAMES.get(type);
	}

	public static boolean isKnown(@Nullable String typeName) {
		return typeName != null && SCALAR_TYPES_BY_NAME.containsKey(typeName);
	}

	public static Set<String> knownNames() {
		return SCALAR_TYPES_BY_NAME.keySet();
	}
}
