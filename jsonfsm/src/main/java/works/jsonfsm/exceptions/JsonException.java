package works.jsonfsm.exceptions;

public sealed abstract class JsonException extends RuntimeException permits JsonSyntaxException, JsonProcessingException {
	protected JsonException(String message) {
		super(message);
	}

	protected JsonException(String message, Throwable cause) {
		super(message, cause);
	}
}
