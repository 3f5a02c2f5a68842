package io.ligolw;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;

/**
 * An element whose content is character data rather than child elements.
 * Written on a single line.
 */
public abstract class TextElement extends Element {
	private final StringBuilder pcdata = new StringBuilder();

	protected TextElement(String tagName, Map<String, String> attributes) {
		super(tagName, attributes);
	}

	@Override
	public void appendData(CharSequence content) {
		pcdata.append(content);
	}

	public String text() {
		return pcdata.toString();
	}

	public void setText(String text) {
		pcdata.setLength(0);
		pcdata.append(text);
	}

	@Override
	public void write(Writer out, String indent) throws IOException {
		out.write(startTag(indent));
		out.write(escape(pcdata));
		out.write(endTag(""));
		out.write('\n');
	}
}
