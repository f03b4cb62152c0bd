package works.jsonfsm.exceptions;

/**
 * Something unexpected has gone wrong during decoding.
 * <p>
 * This does not indicate a problem with the input JSON.
 * It means a machine or decoder was used in a way its contract forbids,
 * such as being fed more input after it reached a terminal state.
 * A correct caller never sees this exception.
 */
public final class JsonProcessingException extends JsonException {
	public JsonProcessingException(String message) {
		super(message);
	}

	public JsonProcessingException(String message, Throwable cause) {
		super(message, cause);
	}
}
