package works.jsonfsm.exceptions;

/**
 * The reasons decoding can fail. All of them are fatal:
 * the first one encountered aborts the whole decode.
 */
public enum ErrorKind {
	UNEXPECTED_CHARACTER,
	EXPECTED_QUOTE,
	UNTERMINATED_STRING,
	INVALID_ESCAPE,
	INVALID_UNICODE_ESCAPE,
	INVALID_NUMBER_FORMAT,

	/**
	 * A number's integer part has more than one digit and starts with {@code 0}.
	 */
	LEADING_ZERO_VIOLATION,

	MISSING_COLON,

	/**
	 * A comma is followed directly by the closing bracket or brace.
	 */
	TRAILING_COMMA,

	/**
	 * A comma or closing bracket or brace appears where a value or member must start.
	 */
	UNEXPECTED_CLOSE_OR_COMMA,

	/**
	 * The first character of a value can't start any JSON value.
	 */
	NO_MATCHING_GRAMMAR,

	INCOMPLETE_INPUT,

	/**
	 * Something other than whitespace follows a complete top-level value.
	 */
	TRAILING_CONTENT,

	NESTING_TOO_DEEP,
}
