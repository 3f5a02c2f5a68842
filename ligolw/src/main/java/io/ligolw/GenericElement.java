package io.ligolw;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;

/**
 * Stands in for any tag that has no more specific element class,
 * keeping its attributes, children and character data so that it can be written back out unchanged.
 */
public class GenericElement extends Element {
	private final StringBuilder pcdata = new StringBuilder();

	public GenericElement(String tagName, Map<String, String> attributes) {
		super(tagName, attributes);
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
		if (children().isEmpty()) {
			out.write(startTag(indent));
			out.write(escape(pcdata.toString().strip()));
			out.write(endTag(""));
			out.write('\n');
		} else {
			// Character data interleaved with children is not preserved
			super.write(out, indent);
		}
	}
}
