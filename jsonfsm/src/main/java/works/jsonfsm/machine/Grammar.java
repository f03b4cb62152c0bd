package works.jsonfsm.machine;

import works.jsonfsm.codec.DecoderSettings;
import works.jsonfsm.value.JsonBoolean;
import works.jsonfsm.value.JsonNull;
import works.jsonfsm.value.JsonValue;

/**
 * The alternatives for a JSON value, in the order {@link ValueMachine} tries them.
 * If more than one accepts the first character, the earliest one wins.
 */
public enum Grammar {
	NUMBER,
	OBJECT,
	ARRAY,
	STRING,
	NULL,
	FALSE,
	TRUE;

	/**
	 * @param depth number of arrays and objects enclosing the value
	 */
	public Machine newMachine(DecoderSettings settings, int depth) {
		return switch (this) {
			case NUMBER -> new NumberMachine();
			case OBJECT -> new ObjectMachine(settings, depth);
			case ARRAY -> new ArrayMachine(settings, depth);
			case STRING -> new StringMachine(settings);
			case NULL, FALSE, TRUE -> new LiteralMachine(fixedRepresentation(), literalValue());
		};
	}

	/**
	 * JSON values can be told apart by their first character,
	 * which is what makes dispatching on it sound.
	 *
	 * @return the alternative that can start with {@code codePoint},
	 * or null if no JSON value can
	 */
	public static Grammar startingWith(int codePoint) {
		return switch (codePoint) {
			case 'n' -> NULL;
			case 'f' -> FALSE;
			case 't' -> TRUE;
			case '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', '-' -> NUMBER;
			case '{' -> OBJECT;
			case '[' -> ARRAY;
			case '"' -> STRING;
			default -> null;
		};
	}

	/**
	 * @return true for alternatives that are always represented in JSON with the same sequence of characters
	 */
	public boolean hasFixedRepresentation() {
		return switch (this) {
			case NULL, FALSE, TRUE -> true;
			default -> false;
		};
	}

	public String fixedRepresentation() {
		return switch (this) {
			case NULL -> "null";
			case FALSE -> "false";
			case TRUE -> "true";
			default ->
				throw new IllegalArgumentException("Grammar has no fixed representation: " + this);
		};
	}

	private JsonValue literalValue() {
		return switch (this) {
			case NULL -> JsonNull.INSTANCE;
			case FALSE -> JsonBoolean.FALSE;
			case TRUE -> JsonBoolean.TRUE;
			default ->
				throw new IllegalArgumentException("Grammar has no literal value: " + this);
		};
	}
}
