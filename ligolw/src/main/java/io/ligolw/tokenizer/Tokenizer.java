package io.ligolw.tokenizer;

import io.ligolw.exceptions.MalformedTokenException;
import io.ligolw.types.ScalarType;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Splits delimited character data into scalar tokens,
 * one chunk at a time.
 * <p>
 * Character data arrives in arbitrary pieces, so a token can be split across
 * calls to {@link #feed}. A token is only produced once the delimiter that ends it
 * has been seen; any characters after the last delimiter are held until the next call.
 * To flush the final token, feed one more delimiter after the last chunk.
 * <p>
 * Whitespace around a token is insignificant.
 * If the delimiter is itself whitespace, then any run of whitespace separates tokens.
 * Blank tokens are skipped.
 */
public final class Tokenizer {
	private final String delimiter;
	private final boolean whitespaceDelimited;
	private final StringBuilder pending = new StringBuilder();
	private @Nullable ScalarType type;

	public Tokenizer(String delimiter) {
		if (delimiter.isEmpty()) {
			throw new IllegalArgumentException("Delimiter can't be empty");
		}
		this.delimiter = delimiter;
		this.whitespaceDelimited = delimiter.isBlank();
	}

	public String delimiter() {
		return delimiter;
	}

	public void setType(ScalarType type) {
		this.type = requireNonNull(type);
	}

	/**
	 * Adds {@code text} to the input, and returns the tokens it completes.
	 * <p>
	 * The returned iterator is lazy: it parses tokens as they are requested,
	 * and must be exhausted before the next call to {@link #feed}.
	 *
	 * @throws IllegalStateException if {@link #setType} has not been called
	 */
	public Iterator<Number> feed(CharSequence text) {
		if (type == null) {
			throw new IllegalStateException("Must set the type before feeding text");
		}
		pending.append(text);
		return new TokenIterator(type);
	}

	/**
	 * @return true if there are non-whitespace characters that have not yet been terminated by a delimiter
	 */
	public boolean hasPartialToken() {
		for (int i = 0; i < pending.length(); i++) {
			if (!Character.isWhitespace(pending.charAt(i))) {
				return true;
			}
		}
		return false;
	}

	private int delimiterAt(int start) {
		if (whitespaceDelimited) {
			for (int i = start; i < pending.length(); i++) {
				if (Character.isWhitespace(pending.charAt(i))) {
					return i;
				}
			}
			return -1;
		} else {
			return pending.indexOf(delimiter, start);
		}
	}

	private int delimiterLength() {
		return whitespaceDelimited? 1 : delimiter.length();
	}

	private final class TokenIterator implements Iterator<Number> {
		final ScalarType type;
		int pos = 0;
		@Nullable Number next;
		boolean done = false;

		TokenIterator(ScalarType type) {
			this.type = type;
		}

		@Override
		public boolean hasNext() {
			if (next == null && !done) {
				next = computeNext();
			}
			return next != null;
		}

		@Override
		public Number next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			Number result = next;
			next = null;
			return result;
		}

		private @Nullable Number computeNext() {
			while (true) {
				int end = delimiterAt(pos);
				if (end == -1) {
					// Keep the unterminated remainder for the next chunk
					pending.delete(0, pos);
					done = true;
					return null;
				}
				String token = pending.substring(pos, end).strip();
				pos = end + delimiterLength();
				if (!token.isEmpty()) {
					return cast(token);
				}
			}
		}

		private Number cast(String token) {
			LOGGER.trace("cast({}) |{}|", type, token);
			try {
				return type.parse(token);
			} catch (NumberFormatException e) {
				throw new MalformedTokenException("Invalid " + type + " value: \"" + token + "\"", e);
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Tokenizer.class);
}
