package works.jsonfsm.machine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.jsonfsm.exceptions.JsonSyntaxException.END_OF_INPUT;

class CharactersTest {
	@ParameterizedTest
	@ValueSource(ints = {0x20, 0x0A, 0x0D, 0x09})
	void whitespace(int codePoint) {
		assertTrue(Characters.isWhitespace(codePoint));
	}

	@Test
	void nothingElseIsWhitespace() {
		for (int codePoint = -1; codePoint < 0x3000; codePoint++) {
			boolean expected = codePoint == 0x20 || codePoint == 0x0A || codePoint == 0x0D || codePoint == 0x09;
			assertEquals(expected, Characters.isWhitespace(codePoint), "Code point " + codePoint);
		}
		// Same low six bits as the real whitespace characters
		assertFalse(Characters.isWhitespace(0x20 + 64));
		assertFalse(Characters.isWhitespace(0x0A + 128));
		assertFalse(Characters.isWhitespace(Integer.MIN_VALUE + 0x20));
	}

	@ParameterizedTest
	@ValueSource(ints = {',', ']', '}', ' ', '\n'})
	void endsNumber(int codePoint) {
		assertTrue(Characters.endsNumber(codePoint));
	}

	@ParameterizedTest
	@ValueSource(ints = {'.', 'e', '0', ':', '[', '{'})
	void doesNotEndNumber(int codePoint) {
		assertFalse(Characters.endsNumber(codePoint));
	}

	@Test
	void digitsAreAsciiOnly() {
		assertTrue(Characters.isDigit('7'));
		assertFalse(Characters.isDigit('٣')); // Arabic-Indic digit three
		assertTrue(Characters.isHexDigit('F'));
		assertTrue(Characters.isHexDigit('a'));
		assertFalse(Characters.isHexDigit('g'));
		assertFalse(Characters.isHexDigit('Ａ')); // Fullwidth A
		assertEquals(11, Characters.hexValue('b'));
	}

	@Test
	void describe() {
		assertEquals("'x'", Characters.describe('x'));
		assertEquals("U+000A", Characters.describe('\n'));
		assertEquals("U+1F60E", Characters.describe(0x1F60E));
		assertEquals("end of input", Characters.describe(END_OF_INPUT));
	}
}
