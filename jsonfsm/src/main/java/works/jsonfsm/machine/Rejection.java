package works.jsonfsm.machine;

import works.jsonfsm.exceptions.ErrorKind;
import works.jsonfsm.exceptions.JsonSyntaxException;

import static java.util.Objects.requireNonNull;

/**
 * Why a machine refused its input.
 *
 * @param codePoint the refused code point, or {@link JsonSyntaxException#END_OF_INPUT}
 */
public record Rejection(ErrorKind kind, int codePoint, String detail) {
	public Rejection {
		requireNonNull(kind);
		requireNonNull(detail);
	}

	public JsonSyntaxException toException(long offset) {
		return new JsonSyntaxException(kind, codePoint, offset, detail);
	}
}
