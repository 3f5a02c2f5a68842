package io.ligolw;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;

/**
 * Delimited character data holding the contents of its parent element.
 * This generic version keeps the text as-is.
 */
public class Stream extends Element {
	public static final String TAG_NAME = "Stream";
	public static final String TYPE = "Type";
	public static final String DELIMITER = "Delimiter";
	public static final String LOCAL = "Local";
	public static final String DEFAULT_DELIMITER = ",";

	private final StringBuilder pcdata = new StringBuilder();

	public Stream(Map<String, String> attributes) {
		super(TAG_NAME, attributes);
	}

	public String delimiter() {
		return getAttribute(DELIMITER, DEFAULT_DELIMITER);
	}

	public String type() {
		return getAttribute(TYPE, LOCAL);
	}

	@Override
	public void appendData(CharSequence content) {
		pcdata.append(content);
	}

	public String text() {
		return pcdata.toString();
	}

	@Override
	public void write(Writer out, String indent) throws IOException {
		out.write(startTag(indent));
		out.write(escape(pcdata));
		out.write(endTag(""));
		out.write('\n');
	}
}
