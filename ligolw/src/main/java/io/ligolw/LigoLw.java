package io.ligolw;

import java.util.Map;

/**
 * The document element of every LIGO Light Weight file.
 */
public class LigoLw extends Element {
	public static final String TAG_NAME = "LIGO_LW";

	public LigoLw() {
		this(Map.of());
	}

	public LigoLw(Map<String, String> attributes) {
		super(TAG_NAME, attributes);
	}
}
