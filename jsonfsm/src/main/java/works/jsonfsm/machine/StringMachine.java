package works.jsonfsm.machine;

import works.jsonfsm.codec.DecoderSettings;
import works.jsonfsm.exceptions.JsonProcessingException;
import works.jsonfsm.value.JsonString;

import static java.util.Objects.requireNonNull;
import static works.jsonfsm.exceptions.ErrorKind.EXPECTED_QUOTE;
import static works.jsonfsm.exceptions.ErrorKind.INVALID_ESCAPE;
import static works.jsonfsm.exceptions.ErrorKind.INVALID_UNICODE_ESCAPE;
import static works.jsonfsm.exceptions.ErrorKind.UNEXPECTED_CHARACTER;
import static works.jsonfsm.exceptions.ErrorKind.UNTERMINATED_STRING;
import static works.jsonfsm.exceptions.JsonSyntaxException.END_OF_INPUT;
import static works.jsonfsm.machine.Characters.describe;
import static works.jsonfsm.machine.Characters.hexValue;
import static works.jsonfsm.machine.Characters.isHexDigit;
import static works.jsonfsm.machine.Outcome.PENDING;

/**
 * Decodes a JSON string literal, quotes included.
 * <p>
 * Each {@code \}{@code uXXXX} escape contributes one UTF-16 code unit.
 * Two consecutive escapes forming a surrogate pair therefore
 * end up as one supplementary character in the resulting {@link String},
 * but no attempt is made to pair them up unless
 * {@link DecoderSettings#combineSurrogatePairs()} is set,
 * in which case an escape for an unpaired surrogate is rejected.
 */
public final class StringMachine extends AbstractMachine {
	private final DecoderSettings settings;
	private final StringBuilder sb = new StringBuilder();
	private State state = State.EXPECT_OPEN_QUOTE;
	private int hexDigitsConsumed;
	private int escapedCodeUnit;

	/**
	 * Set after a high surrogate escape when {@link DecoderSettings#combineSurrogatePairs()} is on.
	 */
	private boolean awaitingLowSurrogate = false;

	enum State {
		EXPECT_OPEN_QUOTE,
		IN_BODY,
		IN_ESCAPE,
		IN_UNICODE_ESCAPE,
		CLOSED,
	}

	public StringMachine() {
		this(DecoderSettings.DEFAULT);
	}

	public StringMachine(DecoderSettings settings) {
		this.settings = requireNonNull(settings);
	}

	@Override
	protected Outcome accept(int codePoint) {
		return switch (state) {
			case EXPECT_OPEN_QUOTE -> {
				if (codePoint == '"') {
					state = State.IN_BODY;
					yield PENDING;
				} else {
					yield Outcome.rejected(EXPECTED_QUOTE, codePoint,
						"Strings must start with '\"', not " + describe(codePoint));
				}
			}
			case IN_BODY -> inBody(codePoint);
			case IN_ESCAPE -> inEscape(codePoint);
			case IN_UNICODE_ESCAPE -> inUnicodeEscape(codePoint);
			case CLOSED -> throw new JsonProcessingException("String is already closed");
		};
	}

	private Outcome inBody(int codePoint) {
		if (awaitingLowSurrogate && codePoint != '\\') {
			return unpairedHighSurrogate(codePoint);
		}
		if (codePoint == '"') {
			state = State.CLOSED;
			return new Outcome.Done(new JsonString(sb.toString()));
		} else if (codePoint == '\\') {
			state = State.IN_ESCAPE;
			return PENDING;
		} else if (!Character.isValidCodePoint(codePoint)) {
			return Outcome.rejected(UNEXPECTED_CHARACTER, codePoint, "Not a Unicode code point: " + codePoint);
		} else if (codePoint < 0x20 && settings.strictControlCharacters()) {
			return Outcome.rejected(UNEXPECTED_CHARACTER, codePoint,
				"Control character " + describe(codePoint) + " must be escaped");
		} else {
			sb.appendCodePoint(codePoint);
			return PENDING;
		}
	}

	private Outcome inEscape(int codePoint) {
		if (awaitingLowSurrogate && codePoint != 'u') {
			return unpairedHighSurrogate(codePoint);
		}
		if (codePoint == 'u') {
			state = State.IN_UNICODE_ESCAPE;
			hexDigitsConsumed = 0;
			escapedCodeUnit = 0;
			return PENDING;
		}
		int decoded = switch (codePoint) {
			case '"', '\\', '/' -> codePoint;
			case 'b' -> '\b';
			case 'f' -> '\f';
			case 'n' -> '\n';
			case 'r' -> '\r';
			case 't' -> '\t';
			default -> -1;
		};
		if (decoded == -1) {
			return Outcome.rejected(INVALID_ESCAPE, codePoint, "Invalid escape: \\" + describe(codePoint));
		}
		sb.append((char)decoded);
		state = State.IN_BODY;
		return PENDING;
	}

	private Outcome inUnicodeEscape(int codePoint) {
		if (!isHexDigit(codePoint)) {
			return Outcome.rejected(INVALID_UNICODE_ESCAPE, codePoint,
				"Expected hexadecimal digit in \\u escape but got " + describe(codePoint));
		}
		escapedCodeUnit = (escapedCodeUnit << 4) | hexValue(codePoint);
		if (++hexDigitsConsumed < 4) {
			return PENDING;
		}

		char unit = (char)escapedCodeUnit;
		if (settings.combineSurrogatePairs()) {
			if (Character.isHighSurrogate(unit)) {
				if (awaitingLowSurrogate) {
					return unpairedHighSurrogate(codePoint);
				}
				awaitingLowSurrogate = true;
			} else if (Character.isLowSurrogate(unit)) {
				if (!awaitingLowSurrogate) {
					return Outcome.rejected(INVALID_UNICODE_ESCAPE, codePoint,
						String.format("Low surrogate \\u%04X without a preceding high surrogate", escapedCodeUnit));
				}
				awaitingLowSurrogate = false;
			} else if (awaitingLowSurrogate) {
				return unpairedHighSurrogate(codePoint);
			}
		}
		sb.append(unit);
		state = State.IN_BODY;
		return PENDING;
	}

	private Outcome unpairedHighSurrogate(int codePoint) {
		return Outcome.rejected(INVALID_UNICODE_ESCAPE, codePoint,
			"High surrogate escape must be followed by a low surrogate escape");
	}

	@Override
	protected Outcome finish() {
		return switch (state) {
			case EXPECT_OPEN_QUOTE -> Outcome.rejected(EXPECTED_QUOTE, END_OF_INPUT, "Input ended before the string began");
			default -> Outcome.rejected(UNTERMINATED_STRING, END_OF_INPUT, "Input ended inside a string");
		};
	}
}
