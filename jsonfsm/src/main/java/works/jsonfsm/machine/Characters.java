package works.jsonfsm.machine;

import java.util.stream.LongStream;

import static works.jsonfsm.exceptions.JsonSyntaxException.END_OF_INPUT;

public final class Characters {
	private static final long WHITESPACE_CHARS = LongStream
		.of(0x20, 0x0A, 0x0D, 0x09)
		.map(n -> 1L << n)
		.sum();

	private Characters() { }

	/**
	 * JSON's four insignificant whitespace characters. Nothing else counts,
	 * not even other Unicode spaces.
	 */
	public static boolean isWhitespace(int codePoint) {
		// The position to check in WHITESPACE_CHARS
		long bit = 1L << codePoint;

		// Zero if definitely not whitespace; can have false positives
		long bitIsSet = WHITESPACE_CHARS & bit;

		// All ones if codePoint is negative or beyond the largest whitespace char
		long isNegative = (long)codePoint >> 63;
		long isTooBig = (63L - codePoint) >> 63;

		boolean result = (bitIsSet & ~(isNegative | isTooBig)) != 0;
		assert result == (codePoint == 0x20 || codePoint == 0x0A || codePoint == 0x0D || codePoint == 0x09);
		return result;
	}

	/**
	 * ASCII digits only; {@link Character#isDigit} accepts far more.
	 */
	public static boolean isDigit(int codePoint) {
		return '0' <= codePoint && codePoint <= '9';
	}

	/**
	 * Characters that end a number inside an array or object.
	 * Either closer counts, so that a container can report a mismatched one itself.
	 */
	public static boolean endsNumber(int codePoint) {
		return codePoint == ',' || codePoint == ']' || codePoint == '}' || isWhitespace(codePoint);
	}

	public static boolean isHexDigit(int codePoint) {
		return isDigit(codePoint)
			|| ('a' <= codePoint && codePoint <= 'f')
			|| ('A' <= codePoint && codePoint <= 'F');
	}

	/**
	 * @return the value of a character for which {@link #isHexDigit} is true
	 */
	public static int hexValue(int codePoint) {
		assert isHexDigit(codePoint);
		return Character.digit(codePoint, 16);
	}

	/**
	 * @return a rendering of {@code codePoint} suitable for error messages
	 */
	public static String describe(int codePoint) {
		if (codePoint == END_OF_INPUT) {
			return "end of input";
		} else if (!Character.isValidCodePoint(codePoint)) {
			return "invalid code point " + codePoint;
		} else if (0x20 <= codePoint && codePoint < 0x7F) {
			return "'" + (char)codePoint + "'";
		} else {
			return String.format("U+%04X", codePoint);
		}
	}
}
