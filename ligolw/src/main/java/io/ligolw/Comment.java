package io.ligolw;

import java.util.Map;

public class Comment extends TextElement {
	public static final String TAG_NAME = "Comment";

	public Comment(Map<String, String> attributes) {
		super(TAG_NAME, attributes);
	}

	public Comment(String text) {
		this(Map.of());
		setText(text);
	}
}
