package works.jsonfsm.machine;

import works.jsonfsm.value.JsonValue;

import static java.util.Objects.requireNonNull;
import static works.jsonfsm.exceptions.ErrorKind.INCOMPLETE_INPUT;
import static works.jsonfsm.exceptions.ErrorKind.UNEXPECTED_CHARACTER;
import static works.jsonfsm.exceptions.JsonSyntaxException.END_OF_INPUT;
import static works.jsonfsm.machine.Characters.describe;
import static works.jsonfsm.machine.Outcome.PENDING;

/**
 * Matches a fixed sequence of characters, like {@code true}, and produces a fixed value.
 */
public final class LiteralMachine extends AbstractMachine {
	private final String literal;
	private final int[] expected;
	private final JsonValue value;
	private int matched = 0;

	public LiteralMachine(String literal, JsonValue value) {
		if (literal.isEmpty()) {
			throw new IllegalArgumentException("Literal must not be empty");
		}
		this.literal = literal;
		this.expected = literal.codePoints().toArray();
		this.value = requireNonNull(value);
	}

	@Override
	protected Outcome accept(int codePoint) {
		if (codePoint != expected[matched]) {
			return Outcome.rejected(UNEXPECTED_CHARACTER, codePoint,
				"Expected " + describe(expected[matched]) + " of literal \"" + literal + "\" but got " + describe(codePoint));
		}
		matched++;
		if (matched == expected.length) {
			return new Outcome.Done(value);
		} else {
			return PENDING;
		}
	}

	@Override
	protected Outcome finish() {
		return Outcome.rejected(INCOMPLETE_INPUT, END_OF_INPUT,
			"Input ended after \"" + new String(expected, 0, matched) + "\"; expected \"" + literal + "\"");
	}
}
