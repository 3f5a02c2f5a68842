package io.ligolw.array;

import io.ligolw.ContentHandler;
import io.ligolw.Document;
import io.ligolw.Element;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A {@link ContentHandler} that reads {@code Array} elements as {@link TypedArray}s
 * and their {@code Stream}s as {@link ArrayStream}s, so that loading a document
 * produces the arrays' values in memory.
 * <p>
 * Use it with {@link io.ligolw.Documents#load(java.io.InputStream, java.util.function.Function)}:
 * <pre>
 * Document doc = Documents.load(in, ArrayContentHandler::new);
 * </pre>
 */
public class ArrayContentHandler extends ContentHandler {
	private final ArraySettings settings;

	public ArrayContentHandler(Document document) {
		this(document, ArraySettings.DEFAULT);
	}

	public ArrayContentHandler(Document document, ArraySettings settings) {
		super(document);
		this.settings = requireNonNull(settings);
	}

	@Override
	protected Element startArray(Map<String, String> attributes) {
		return new TypedArray(attributes, settings);
	}

	@Override
	protected Element startStream(Map<String, String> attributes) {
		if (current() instanceof TypedArray) {
			return new ArrayStream(attributes);
		}
		return super.startStream(attributes);
	}

	/**
	 * The tokenizer only emits a value once it sees the delimiter that follows it,
	 * and the last value has none; so feed it one.
	 */
	@Override
	protected void endStream() {
		if (current() instanceof ArrayStream stream) {
			stream.appendData(stream.delimiter());
		}
		super.endStream();
	}
}
