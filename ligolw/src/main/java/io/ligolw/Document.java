package io.ligolw;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;

/**
 * The root of a document tree. Its only child is normally a {@link LigoLw} element.
 */
public final class Document extends Element {
	public static final String XML_HEADER = "<?xml version='1.0' encoding='utf-8' ?>";
	public static final String DOCTYPE = "<!DOCTYPE LIGO_LW SYSTEM \"http://ldas-sw.ligo.caltech.edu/doc/ligolwAPI/html/ligolw_dtd.txt\">";

	public Document() {
		super("#document", Map.of());
	}

	public void write(Writer out) throws IOException {
		write(out, "");
	}

	/**
	 * Writes the XML declaration and the doctype, followed by the children at {@code indent}.
	 */
	@Override
	public void write(Writer out, String indent) throws IOException {
		out.write(XML_HEADER);
		out.write('\n');
		out.write(DOCTYPE);
		out.write('\n');
		for (Element child : children()) {
			child.write(out, indent);
		}
	}
}
