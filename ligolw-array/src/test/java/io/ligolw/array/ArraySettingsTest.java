package io.ligolw.array;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArraySettingsTest {

	@Test
	void defaults() {
		assertEquals(" ", ArraySettings.DEFAULT.delimiter());
		assertFalse(ArraySettings.DEFAULT.rejectUnderfill());
	}

	@Test
	void withCopies() {
		ArraySettings settings = ArraySettings.DEFAULT.withDelimiter(",").withRejectUnderfill(true);
		assertEquals(",", settings.delimiter());
		assertTrue(settings.rejectUnderfill());
		assertEquals(" ", ArraySettings.DEFAULT.delimiter());
	}

	@ParameterizedTest
	@ValueSource(strings = {",", " ", "\t", ";", "&", " < ", "||"})
	void acceptedDelimiters(String delimiter) {
		assertEquals(delimiter, ArraySettings.DEFAULT.withDelimiter(delimiter).delimiter());
	}

	@ParameterizedTest
	@ValueSource(strings = {"", "-", "+", ".", "e", "E", "0", "7", "N", "a", "I", "y", ",x"})
	void delimitersThatCanOccurInValuesAreRejected(String delimiter) {
		assertThrows(IllegalArgumentException.class, () -> ArraySettings.DEFAULT.withDelimiter(delimiter));
	}
}
