package io.ligolw;

import java.io.StringReader;
import java.nio.CharBuffer;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.helpers.DefaultHandler;

import static java.util.Objects.requireNonNull;

/**
 * Builds a tree of {@link Element}s from SAX events.
 * <p>
 * Each start tag is dispatched to a factory method according to its name
 * ({@link #startArray}, {@link #startStream}, and so on),
 * so subclasses can substitute more capable element classes
 * by overriding those methods.
 * Likewise, end tags go to {@link #endStream} for streams,
 * and to {@link #endOther} for everything else.
 * <p>
 * External entities, including the LIGO Light Weight DTD named in the doctype,
 * are never fetched.
 */
public class ContentHandler extends DefaultHandler {
	private final Document document;
	private Element current;

	public ContentHandler(Document document) {
		this.document = requireNonNull(document);
		this.current = document;
	}

	public Document document() {
		return document;
	}

	/**
	 * @return the element whose content is currently being read
	 */
	protected Element current() {
		return current;
	}

	@Override
	public void startElement(String uri, String localName, String qName, Attributes attributes) {
		Map<String, String> attrs = new LinkedHashMap<>();
		for (int i = 0; i < attributes.getLength(); i++) {
			attrs.put(attributes.getQName(i), attributes.getValue(i));
		}
		Element child = switch (qName) {
			case LigoLw.TAG_NAME -> startLigoLw(attrs);
			case Comment.TAG_NAME -> startComment(attrs);
			case Array.TAG_NAME -> startArray(attrs);
			case Dim.TAG_NAME -> startDim(attrs);
			case Stream.TAG_NAME -> startStream(attrs);
			default -> startOther(qName, attrs);
		};
		LOGGER.trace("Beginning {} in {}", child, current);
		current.appendChild(child);
		current = child;
	}

	@Override
	public void endElement(String uri, String localName, String qName) {
		if (Stream.TAG_NAME.equals(qName)) {
			endStream();
		} else {
			endOther();
		}
		Element parent = current.parent();
		assert parent != null: "End tag without matching start tag: " + qName;
		current = parent;
	}

	@Override
	public void characters(char[] ch, int start, int length) {
		current.appendData(CharBuffer.wrap(ch, start, length));
	}

	@Override
	public InputSource resolveEntity(String publicId, String systemId) {
		LOGGER.debug("Not resolving external entity {} {}", publicId, systemId);
		return new InputSource(new StringReader(""));
	}

	protected Element startLigoLw(Map<String, String> attributes) {
		return new LigoLw(attributes);
	}

	protected Element startComment(Map<String, String> attributes) {
		return new Comment(attributes);
	}

	protected Element startArray(Map<String, String> attributes) {
		return new Array(attributes);
	}

	protected Element startDim(Map<String, String> attributes) {
		return new Dim(attributes);
	}

	protected Element startStream(Map<String, String> attributes) {
		return new Stream(attributes);
	}

	protected Element startOther(String tagName, Map<String, String> attributes) {
		return new GenericElement(tagName, attributes);
	}

	protected void endStream() {
		current.endOfElement();
	}

	protected void endOther() {
		current.endOfElement();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ContentHandler.class);
}
