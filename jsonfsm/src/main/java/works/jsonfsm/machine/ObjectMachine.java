package works.jsonfsm.machine;

import java.util.LinkedHashMap;
import java.util.Map;
import works.jsonfsm.codec.DecoderSettings;
import works.jsonfsm.exceptions.JsonProcessingException;
import works.jsonfsm.value.JsonObject;
import works.jsonfsm.value.JsonString;
import works.jsonfsm.value.JsonValue;

import static java.util.Objects.requireNonNull;
import static works.jsonfsm.exceptions.ErrorKind.INCOMPLETE_INPUT;
import static works.jsonfsm.exceptions.ErrorKind.MISSING_COLON;
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
 * Decodes a JSON object, using a fresh {@link StringMachine} for each member name
 * and a fresh {@link ValueMachine} for each member value.
 * When a name repeats, the last value wins.
 */
public final class ObjectMachine extends AbstractMachine {
	private final DecoderSettings settings;
	private final int depth;
	private final Map<String, JsonValue> members = new LinkedHashMap<>();
	private State state = State.EXPECT_OPEN_BRACE;

	private StringMachine nameMachine;
	private String name;
	private ValueMachine valueMachine;
	private Outcome valueOutcome;

	enum State {
		EXPECT_OPEN_BRACE,
		EXPECT_MEMBER_OR_CLOSE, // Might be absent, for an empty object
		EXPECT_MEMBER,          // Can't be absent: we've seen a comma
		IN_NAME,
		EXPECT_COLON,
		EXPECT_VALUE,
		IN_VALUE,
		EXPECT_COMMA_OR_CLOSE,
		CLOSED,
	}

	/**
	 * @param depth number of arrays and objects enclosing this one
	 */
	public ObjectMachine(DecoderSettings settings, int depth) {
		this.settings = requireNonNull(settings);
		this.depth = depth;
	}

	@Override
	protected Outcome accept(int codePoint) {
		switch (state) {
			case EXPECT_OPEN_BRACE:
				if (codePoint != '{') {
					return Outcome.rejected(UNEXPECTED_CHARACTER, codePoint,
						"Objects must start with '{', not " + describe(codePoint));
				} else if (depth >= settings.maxDepth()) {
					return Outcome.rejected(NESTING_TOO_DEEP, codePoint,
						"Arrays and objects nested more than " + settings.maxDepth() + " deep");
				}
				state = State.EXPECT_MEMBER_OR_CLOSE;
				return PENDING;
			case EXPECT_MEMBER_OR_CLOSE:
				if (isWhitespace(codePoint)) {
					return PENDING;
				} else if (codePoint == '}') {
					return close();
				} else if (codePoint == ',') {
					return Outcome.rejected(UNEXPECTED_CLOSE_OR_COMMA, codePoint, "Expected object member before ','");
				}
				return startName(codePoint);
			case EXPECT_MEMBER:
				if (isWhitespace(codePoint)) {
					return PENDING;
				} else if (codePoint == '}') {
					return Outcome.rejected(TRAILING_COMMA, codePoint, "Trailing comma in object");
				} else if (codePoint == ',') {
					return Outcome.rejected(UNEXPECTED_CLOSE_OR_COMMA, codePoint, "Expected object member between commas");
				}
				return startName(codePoint);
			case IN_NAME: {
				Outcome outcome = nameMachine.feed(codePoint);
				if (outcome instanceof Outcome.Done done && done.value() instanceof JsonString string) {
					name = string.value();
					nameMachine = null;
					state = State.EXPECT_COLON;
					return PENDING;
				}
				// Strings are never partial, so this is either Pending or Rejected
				return outcome;
			}
			case EXPECT_COLON:
				if (isWhitespace(codePoint)) {
					return PENDING;
				} else if (codePoint == ':') {
					state = State.EXPECT_VALUE;
					return PENDING;
				}
				return Outcome.rejected(MISSING_COLON, codePoint,
					"Expected ':' after member name \"" + name + "\" but got " + describe(codePoint));
			case EXPECT_VALUE:
				if (isWhitespace(codePoint)) {
					return PENDING;
				} else if (codePoint == '}' || codePoint == ',') {
					return Outcome.rejected(UNEXPECTED_CLOSE_OR_COMMA, codePoint,
						"Expected value for member \"" + name + "\" but got " + describe(codePoint));
				}
				valueMachine = new ValueMachine(settings, depth + 1);
				valueOutcome = null;
				state = State.IN_VALUE;
				return forwardToValue(codePoint);
			case IN_VALUE:
				// Same delimiter check as ArrayMachine: numbers need to be told when they've ended
				if (valueOutcome instanceof Outcome.Partial && endsNumber(codePoint)) {
					Outcome finished = valueMachine.endOfInput();
					if (finished instanceof Outcome.Done done) {
						addMember(done.value());
						return accept(codePoint);
					}
					return finished;
				}
				return forwardToValue(codePoint);
			case EXPECT_COMMA_OR_CLOSE:
				if (isWhitespace(codePoint)) {
					return PENDING;
				} else if (codePoint == ',') {
					state = State.EXPECT_MEMBER;
					return PENDING;
				} else if (codePoint == '}') {
					return close();
				}
				return Outcome.rejected(UNEXPECTED_CHARACTER, codePoint,
					"Expected ',' or '}' after object member but got " + describe(codePoint));
			default:
				throw new JsonProcessingException("Unexpected state " + state);
		}
	}

	private Outcome startName(int codePoint) {
		nameMachine = new StringMachine(settings);
		state = State.IN_NAME;
		return accept(codePoint);
	}

	private Outcome forwardToValue(int codePoint) {
		Outcome outcome = valueMachine.feed(codePoint);
		if (outcome instanceof Outcome.Done done) {
			addMember(done.value());
			return PENDING;
		} else if (outcome instanceof Outcome.Rejected) {
			return outcome;
		} else {
			valueOutcome = outcome;
			return PENDING;
		}
	}

	private void addMember(JsonValue value) {
		members.put(name, value);
		name = null;
		valueMachine = null;
		valueOutcome = null;
		state = State.EXPECT_COMMA_OR_CLOSE;
	}

	private Outcome close() {
		state = State.CLOSED;
		return new Outcome.Done(new JsonObject(members));
	}

	@Override
	protected Outcome finish() {
		Outcome outcome = switch (state) {
			case IN_NAME -> nameMachine.endOfInput();
			case IN_VALUE -> valueMachine.endOfInput();
			default -> null;
		};
		if (outcome instanceof Outcome.Rejected) {
			return outcome;
		}
		return Outcome.rejected(INCOMPLETE_INPUT, END_OF_INPUT, "Input ended inside an object");
	}
}
