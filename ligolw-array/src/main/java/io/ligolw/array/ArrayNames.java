package io.ligolw.array;

import io.ligolw.Element;
import io.ligolw.exceptions.ElementException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Array naming conventions.
 * <p>
 * By convention, an array's {@code Name} attribute looks like
 * {@code [prefix:]name:array}. Only the {@code name} part is significant
 * when looking arrays up. Names that don't follow the convention are used verbatim.
 */
public final class ArrayNames {
	private static final Pattern ARRAY_PATTERN = Pattern.compile("(?:\\A[a-z0-9_]+:|\\A)(?<Name>[a-z0-9_]+):array\\z");

	private ArrayNames() { }

	public static String stripArrayName(String name) {
		Matcher matcher = ARRAY_PATTERN.matcher(name);
		if (matcher.find()) {
			return matcher.group("Name");
		} else {
			return name;
		}
	}

	public static int compareArrayNames(String name1, String name2) {
		return stripArrayName(name1).compareTo(stripArrayName(name2));
	}

	/**
	 * @return every {@link TypedArray} in the subtree rooted at {@code root}
	 * whose name matches {@code name}, in document order
	 */
	public static List<TypedArray> getArraysByName(Element root, String name) {
		String wanted = stripArrayName(name);
		return root.getElements(e -> e instanceof TypedArray a
				&& a.name() != null
				&& stripArrayName(a.name()).equals(wanted))
			.stream()
			.map(TypedArray.class::cast)
			.toList();
	}

	/**
	 * @throws ElementException unless exactly one array matches {@code name}
	 */
	public static TypedArray getArray(Element root, String name) {
		List<TypedArray> arrays = getArraysByName(root, name);
		if (arrays.size() != 1) {
			throw new ElementException("Expected exactly one Array named \"" + stripArrayName(name) + "\"; found " + arrays.size());
		}
		return arrays.get(0);
	}
}
