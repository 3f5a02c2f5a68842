package io.ligolw.tokenizer;

import io.ligolw.exceptions.MalformedTokenException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.Test;

import static io.ligolw.types.ScalarType.INT_4S;
import static io.ligolw.types.ScalarType.REAL_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenizerTest {

	@Test
	void commaDelimited() {
		Tokenizer tokenizer = new Tokenizer(",");
		tokenizer.setType(INT_4S);
		assertEquals(List.of(1, 2), drain(tokenizer.feed("1,2,3")));
		assertEquals(List.of(3), drain(tokenizer.feed(",")));
	}

	@Test
	void lastTokenIsWithheldUntilDelimiter() {
		Tokenizer tokenizer = new Tokenizer(",");
		tokenizer.setType(INT_4S);
		assertEquals(List.of(), drain(tokenizer.feed("12")));
		assertTrue(tokenizer.hasPartialToken());
		assertEquals(List.of(), drain(tokenizer.feed("34")));
		assertEquals(List.of(1234), drain(tokenizer.feed(",")));
		assertFalse(tokenizer.hasPartialToken());
	}

	@Test
	void surroundingWhitespaceIsIgnored() {
		Tokenizer tokenizer = new Tokenizer(",");
		tokenizer.setType(INT_4S);
		assertEquals(List.of(1, 4, 2, 5), drain(tokenizer.feed("\n\t\t1,4,\n\t\t2,5\n\t,")));
	}

	@Test
	void whitespaceDelimiterMatchesAnyWhitespaceRun() {
		Tokenizer tokenizer = new Tokenizer(" ");
		tokenizer.setType(REAL_8);
		assertEquals(List.of(1.5, -2.0, 3e10), drain(tokenizer.feed("\n\t 1.5  -2.0\n\t\t3e10\n ")));
	}

	@Test
	void multiCharacterDelimiterSplitAcrossChunks() {
		Tokenizer tokenizer = new Tokenizer("||");
		tokenizer.setType(INT_4S);
		assertEquals(List.of(), drain(tokenizer.feed("7|")));
		assertEquals(List.of(7, 8), drain(tokenizer.feed("|8||")));
	}

	@Test
	void blankTokensAreSkipped() {
		Tokenizer tokenizer = new Tokenizer(",");
		tokenizer.setType(INT_4S);
		assertEquals(List.of(1, 2), drain(tokenizer.feed("1,, ,2,\n,")));
	}

	@Test
	void iteratorIsLazy() {
		Tokenizer tokenizer = new Tokenizer(",");
		tokenizer.setType(INT_4S);
		Iterator<Number> tokens = tokenizer.feed("1,oops,");
		assertEquals(1, tokens.next());
		assertThrows(MalformedTokenException.class, tokens::hasNext);
	}

	@Test
	void malformedToken() {
		Tokenizer tokenizer = new Tokenizer(",");
		tokenizer.setType(INT_4S);
		MalformedTokenException e = assertThrows(MalformedTokenException.class, () -> drain(tokenizer.feed("1.5,")));
		assertTrue(e.getMessage().contains("1.5"), e.getMessage());
	}

	@Test
	void typeIsRequired() {
		Tokenizer tokenizer = new Tokenizer(",");
		assertThrows(IllegalStateException.class, () -> tokenizer.feed("1,"));
	}

	@Test
	void emptyDelimiter() {
		assertThrows(IllegalArgumentException.class, () -> new Tokenizer(""));
	}

	private static List<Number> drain(Iterator<Number> tokens) {
		List<Number> result = new ArrayList<>();
		tokens.forEachRemaining(result::add);
		return result;
	}
}
