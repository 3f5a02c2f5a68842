package io.ligolw;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Metadata for a multi-dimensional array: its name and type attributes,
 * some {@link Dim} children, and a {@link Stream} child holding the values.
 * <p>
 * This class doesn't interpret the values;
 * see the {@code ligolw-array} module for an element that does.
 */
public class Array extends Element {
	public static final String TAG_NAME = "Array";
	public static final String NAME = "Name";
	public static final String TYPE = "Type";

	public Array(Map<String, String> attributes) {
		super(TAG_NAME, attributes);
	}

	public @Nullable String name() {
		return getAttribute(NAME);
	}

	public @Nullable String type() {
		return getAttribute(TYPE);
	}

	public List<Dim> dims() {
		return childrenOfType(Dim.class);
	}

	/**
	 * @return the dimension sizes in document order
	 */
	public int[] dimensions() {
		return dims().stream().mapToInt(Dim::size).toArray();
	}

	public @Nullable Stream stream() {
		List<Stream> streams = childrenOfType(Stream.class);
		return streams.isEmpty()? null : streams.get(0);
	}
}
