package io.ligolw;

import io.ligolw.exceptions.ElementException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * The size of one dimension of an {@link Array}, as character data.
 */
public class Dim extends TextElement {
	public static final String TAG_NAME = "Dim";

	public Dim(Map<String, String> attributes) {
		super(TAG_NAME, attributes);
	}

	public Dim(int size) {
		this(null, size);
	}

	public Dim(@Nullable String name, int size) {
		this(nameAttribute(name));
		if (size < 0) {
			throw new IllegalArgumentException("Dimension size can't be negative: " + size);
		}
		setText(Integer.toString(size));
	}

	private static Map<String, String> nameAttribute(@Nullable String name) {
		Map<String, String> result = new LinkedHashMap<>();
		if (name != null) {
			result.put("Name", name);
		}
		return result;
	}

	public @Nullable String name() {
		return getAttribute("Name");
	}

	/**
	 * @throws ElementException if the character data is not a non-negative integer
	 */
	public int size() {
		String text = text().strip();
		int result;
		try {
			result = Integer.parseInt(text);
		} catch (NumberFormatException e) {
			throw new ElementException("Invalid <" + TAG_NAME + "> size: \"" + text + "\"", e);
		}
		if (result < 0) {
			throw new ElementException("Negative <" + TAG_NAME + "> size: " + result);
		}
		return result;
	}

	@Override
	public void endOfElement() {
		size();
	}
}
