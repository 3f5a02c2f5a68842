package io.ligolw;

import io.ligolw.exceptions.ElementException;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A node of an in-memory LIGO Light Weight document.
 * <p>
 * Elements have a tag name, attributes in document order, ordered children,
 * and a link to their parent.
 * While a document is being loaded, {@link ContentHandler} calls
 * {@link #appendData} with each piece of character data inside the element
 * and {@link #endOfElement} when its end tag is reached;
 * subclasses override these to interpret their content.
 */
public abstract class Element {
	/**
	 * Added once per nesting level when writing.
	 */
	public static final String INDENT = "\t";

	private final String tagName;
	private final Map<String, String> attributes;
	private final List<Element> children = new ArrayList<>();
	private @Nullable Element parent;

	protected Element(String tagName, Map<String, String> attributes) {
		this.tagName = requireNonNull(tagName);
		this.attributes = new LinkedHashMap<>(attributes);
	}

	public final String tagName() {
		return tagName;
	}

	public @Nullable String getAttribute(String name) {
		return attributes.get(name);
	}

	public String getAttribute(String name, String defaultValue) {
		return attributes.getOrDefault(name, defaultValue);
	}

	public void setAttribute(String name, String value) {
		attributes.put(requireNonNull(name), requireNonNull(value));
	}

	public Map<String, String> attributes() {
		return Collections.unmodifiableMap(attributes);
	}

	public List<Element> children() {
		return Collections.unmodifiableList(children);
	}

	public @Nullable Element parent() {
		return parent;
	}

	/**
	 * @return {@code child}, for convenience
	 * @throws IllegalArgumentException if {@code child} already has a parent
	 */
	public <E extends Element> E appendChild(E child) {
		Element element = child;
		if (element.parent != null) {
			throw new IllegalArgumentException("<" + element.tagName + "> already has a parent");
		}
		children.add(element);
		element.parent = this;
		return child;
	}

	/**
	 * Detaches {@code child} from this element without {@link #unlink unlinking} it.
	 */
	public void removeChild(Element child) {
		if (!children.remove(child)) {
			throw new IllegalArgumentException("<" + child.tagName + "> is not a child of <" + tagName + ">");
		}
		child.parent = null;
	}

	/**
	 * Called with each piece of character data that appears directly inside this element.
	 * The default implementation accepts only whitespace.
	 */
	public void appendData(CharSequence content) {
		if (!isBlank(content)) {
			throw new ElementException("<" + tagName + "> does not accept character data: \"" + content + "\"");
		}
	}

	/**
	 * Called once this element's end tag has been read.
	 */
	public void endOfElement() {
	}

	/**
	 * Detaches this element from its parent and breaks all the references within
	 * the subtree rooted here, releasing any resources the elements hold.
	 * The elements must not be used afterward.
	 */
	public void unlink() {
		if (parent != null) {
			parent.removeChild(this);
		}
		for (Element child : List.copyOf(children)) {
			child.unlink();
		}
	}

	/**
	 * @return all elements in the subtree rooted here, including this one,
	 * that satisfy {@code filter}, in document order
	 */
	public List<Element> getElements(Predicate<? super Element> filter) {
		List<Element> result = new ArrayList<>();
		collect(filter, result);
		return result;
	}

	private void collect(Predicate<? super Element> filter, List<Element> result) {
		if (filter.test(this)) {
			result.add(this);
		}
		for (Element child : children) {
			child.collect(filter, result);
		}
	}

	public List<Element> getElementsByTagName(String name) {
		return getElements(e -> e.tagName.equals(name));
	}

	/**
	 * @return the children that are instances of the given class, in order
	 */
	public <E extends Element> List<E> childrenOfType(Class<E> type) {
		return children.stream()
			.filter(type::isInstance)
			.map(type::cast)
			.toList();
	}

	public void write(Writer out, String indent) throws IOException {
		out.write(startTag(indent));
		out.write('\n');
		for (Element child : children) {
			child.write(out, indent + INDENT);
		}
		out.write(endTag(indent));
		out.write('\n');
	}

	public String startTag(String indent) {
		StringBuilder sb = new StringBuilder(indent).append('<').append(tagName);
		attributes.forEach((name, value) -> sb
			.append(' ').append(name)
			.append("=\"").append(escapeAttribute(value)).append('"'));
		return sb.append('>').toString();
	}

	public String endTag(String indent) {
		return indent + "</" + tagName + ">";
	}

	protected static String escape(CharSequence text) {
		StringBuilder sb = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
				case '&' -> sb.append("&amp;");
				case '<' -> sb.append("&lt;");
				case '>' -> sb.append("&gt;");
				case '"' -> sb.append("&quot;");
				default -> sb.append(c);
			}
		}
		return sb.toString();
	}

	/**
	 * Also escapes whitespace other than spaces, which XML parsers would
	 * otherwise normalize to spaces when reading the attribute back.
	 */
	protected static String escapeAttribute(CharSequence value) {
		String escaped = escape(value);
		StringBuilder sb = new StringBuilder(escaped.length());
		for (int i = 0; i < escaped.length(); i++) {
			char c = escaped.charAt(i);
			switch (c) {
				case '\t' -> sb.append("&#9;");
				case '\n' -> sb.append("&#10;");
				case '\r' -> sb.append("&#13;");
				default -> sb.append(c);
			}
		}
		return sb.toString();
	}

	protected static boolean isBlank(CharSequence text) {
		for (int i = 0; i < text.length(); i++) {
			if (!Character.isWhitespace(text.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	@Override
	public String toString() {
		return "<" + tagName + " " + attributes + ">";
	}
}
