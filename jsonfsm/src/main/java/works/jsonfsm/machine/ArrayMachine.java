package works.jsonfsm.machine;

import java.util.ArrayList;
import java.util.List;
import works.jsonfsm.codec.DecoderSettings;
import works.jsonfsm.exceptions.JsonProcessingException;
import works.jsonfsm.value.JsonArray;
import works.jsonfsm.value.JsonValue;

import static java.util.Objects.requireNonNull;
import static works.jsonfsm.exceptions.ErrorKind.INCOMPLETE_INPUT;
import static works.jsonfsm.exceptions.ErrorKind.NESTING_TOO_DEEP;
import static works.jsonfsm.exceptions.ErrorKind.TRAILING_COMMA;
import static works.jsonfsm.exceptions.ErrorKind.UNEXPECTED_CHARACTER;
import static works.jsonfsm.exceptions.ErrorKind.UNEXPECTED_CLOSE_OR_COMMA;
import static works.jsonfsm.exceptions.JsonSyntaxException.END_OF_INPUT;
import static works.jsonfsm.machine.Characters.describe;
import static works.jsonfsm.machine.Characters.endsNumber;
import static works.jsonfsm.machine.Characters.isWhitespace;
import static works.jsonfsm.machine.Outcome.PENDING;

/**
 * Decodes a JSON array, spawning a fresh {@link ValueMachine} for each element.
 * Whitespace is skipped between tokens but never inside them.
 */
public final class ArrayMachine extends AbstractMachine {
	private final DecoderSettings settings;
	private final int depth;
	private final List<JsonValue> elements = new ArrayList<>();
	private State state = State.EXPECT_OPEN_BRACKET;

	private ValueMachine element;

	/**
	 * The last thing {@link #element} returned.
	 */
	private Outcome elementOutcome;

	enum State {
		EXPECT_OPEN_BRACKET,
		EXPECT_ELEMENT_OR_CLOSE, // Might be absent, for an empty array
		EXPECT_ELEMENT,          // Can't be absent: we've seen a comma
		IN_ELEMENT,
		EXPECT_COMMA_OR_CLOSE,
		CLOSED,
	}

	/**
	 * @param depth number of arrays and objects enclosing this one
	 */
	public ArrayMachine(DecoderSettings settings, int depth) {
		this.settings = requireNonNull(settings);
		this.depth = depth;
	}

	@Override
	protected Outcome accept(int codePoint) {
		switch (state) {
			case EXPECT_OPEN_BRACKET:
				if (codePoint != '[') {
					return Outcome.rejected(UNEXPECTED_CHARACTER, codePoint,
						"Arrays must start with '[', not " + describe(codePoint));
				} else if (depth >= settings.maxDepth()) {
					return Outcome.rejected(NESTING_TOO_DEEP, codePoint,
						"Arrays and objects nested more than " + settings.maxDepth() + " deep");
				}
				state = State.EXPECT_ELEMENT_OR_CLOSE;
				return PENDING;
			case EXPECT_ELEMENT_OR_CLOSE:
				if (isWhitespace(codePoint)) {
					return PENDING;
				} else if (codePoint == ']') {
					return close();
				} else if (codePoint == ',') {
					return Outcome.rejected(UNEXPECTED_CLOSE_OR_COMMA, codePoint, "Expected array element before ','");
				}
				return startElement(codePoint);
			case EXPECT_ELEMENT:
				if (isWhitespace(codePoint)) {
					return PENDING;
				} else if (codePoint == ']') {
					return Outcome.rejected(TRAILING_COMMA, codePoint, "Trailing comma in array");
				} else if (codePoint == ',') {
					return Outcome.rejected(UNEXPECTED_CLOSE_OR_COMMA, codePoint, "Expected array element between commas");
				}
				return startElement(codePoint);
			case IN_ELEMENT:
				// A number can't tell when it has ended, so delimiters must be
				// checked here before they're forwarded.
				if (elementOutcome instanceof Outcome.Partial && endsNumber(codePoint)) {
					Outcome finished = element.endOfInput();
					if (finished instanceof Outcome.Done done) {
						addElement(done.value());
						return accept(codePoint);
					}
					return finished;
				}
				return forwardToElement(codePoint);
			case EXPECT_COMMA_OR_CLOSE:
				if (isWhitespace(codePoint)) {
					return PENDING;
				} else if (codePoint == ',') {
					state = State.EXPECT_ELEMENT;
					return PENDING;
				} else if (codePoint == ']') {
					return close();
				}
				return Outcome.rejected(UNEXPECTED_CHARACTER, codePoint,
					"Expected ',' or ']' after array element but got " + describe(codePoint));
			default:
				throw new JsonProcessingException("Unexpected state " + state);
		}
	}

	private Outcome startElement(int codePoint) {
		element = new ValueMachine(settings, depth + 1);
		elementOutcome = null;
		state = State.IN_ELEMENT;
		return forwardToElement(codePoint);
	}

	private Outcome forwardToElement(int codePoint) {
		Outcome outcome = element.feed(codePoint);
		if (outcome instanceof Outcome.Done done) {
			addElement(done.value());
			return PENDING;
		} else if (outcome instanceof Outcome.Rejected) {
			return outcome;
		} else {
			elementOutcome = outcome;
			return PENDING;
		}
	}

	private void addElement(JsonValue value) {
		elements.add(value);
		element = null;
		elementOutcome = null;
		state = State.EXPECT_COMMA_OR_CLOSE;
	}

	private Outcome close() {
		state = State.CLOSED;
		return new Outcome.Done(new JsonArray(elements));
	}

	@Override
	protected Outcome finish() {
		if (state == State.IN_ELEMENT) {
			Outcome outcome = element.endOfInput();
			if (outcome instanceof Outcome.Rejected) {
				return outcome;
			}
		}
		return Outcome.rejected(INCOMPLETE_INPUT, END_OF_INPUT, "Input ended inside an array");
	}
}
