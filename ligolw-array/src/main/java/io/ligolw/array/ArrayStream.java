package io.ligolw.array;

import io.ligolw.Element;
import io.ligolw.Stream;
import io.ligolw.exceptions.ArrayOverflowException;
import io.ligolw.exceptions.ArrayUnderflowException;
import io.ligolw.tokenizer.Tokenizer;
import java.io.IOException;
import java.io.Writer;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link Stream} inside a {@link TypedArray}.
 * Parses its character data into the parent's {@link NumericArray},
 * and writes that array back out as character data.
 * <p>
 * Values appear in {@link IndexSequencer} order, separated by the {@code Delimiter}
 * attribute. When writing, a line break follows each complete run of the
 * fastest-varying dimension.
 */
public class ArrayStream extends Stream {
	private final Tokenizer tokenizer;
	private @Nullable IndexSequencer cursor;

	public ArrayStream(Map<String, String> attributes) {
		super(attributes);
		this.tokenizer = new Tokenizer(delimiter());
	}

	/**
	 * The first call allocates the parent's array, so all the {@code Dim}
	 * elements must already be present.
	 * <p>
	 * The last value is not stored until a delimiter follows it.
	 * Whoever supplies the character data must therefore finish with one
	 * extra {@link #delimiter()}, as {@link ArrayContentHandler} does.
	 *
	 * @throws ArrayOverflowException if there are more values than the array can hold
	 */
	@Override
	public void appendData(CharSequence content) {
		TypedArray parent = parentArray();
		IndexSequencer indexes = cursor;
		if (indexes == null) {
			parent.allocate();
			tokenizer.setType(parent.scalarType());
			indexes = cursor = new IndexSequencer(parent.shape());
		}
		NumericArray array = parent.array();
		Iterator<Number> tokens = tokenizer.feed(content);
		while (tokens.hasNext()) {
			Number token = tokens.next();
			if (!indexes.hasNext()) {
				throw new ArrayOverflowException("Too many values in Array \"" + parent.name() + "\" with shape " + Arrays.toString(array.shape()));
			}
			array.set(indexes.next(), token);
		}
	}

	/**
	 * @throws ArrayUnderflowException if {@link ArraySettings#rejectUnderfill()}
	 * is set and the array has not been filled
	 */
	@Override
	public void endOfElement() {
		TypedArray parent = parentArray();
		if (cursor == null) {
			// Never received any character data
			appendData(delimiter());
		}
		assert cursor != null;
		if (tokenizer.hasPartialToken()) {
			LOGGER.warn("Array \"{}\" ends with an unterminated value", parent.name());
		}
		if (parent.settings().rejectUnderfill() && cursor.hasNext()) {
			throw new ArrayUnderflowException("Too few values in Array \"" + parent.name() + "\" with shape " + Arrays.toString(parent.shape()));
		}
		parent.complete();
	}

	@Override
	public void write(Writer out, String indent) throws IOException {
		TypedArray parent = parentArray();
		NumericArray array = parent.array();
		String delimiter = escape(delimiter());
		String rowIndent = indent + INDENT;

		out.write(startTag(indent));
		out.write('\n');
		IndexSequencer indexes = new IndexSequencer(array.shape());
		if (indexes.hasNext()) {
			out.write(rowIndent);
			int[] index = indexes.next();
			while (true) {
				out.write(array.type().format(array.get(index)));
				if (!indexes.hasNext()) {
					break;
				}
				index = indexes.next();
				out.write(delimiter);
				if (index[0] == 0) {
					// Finished a run of the fastest-varying dimension
					out.write('\n');
					out.write(rowIndent);
				}
			}
		}
		out.write('\n');
		out.write(endTag(indent));
		out.write('\n');
	}

	@Override
	public void unlink() {
		cursor = null;
		super.unlink();
	}

	private TypedArray parentArray() {
		Element parent = parent();
		if (parent instanceof TypedArray t) {
			return t;
		}
		throw new IllegalStateException("ArrayStream must be inside a TypedArray; parent is " + parent);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ArrayStream.class);
}
