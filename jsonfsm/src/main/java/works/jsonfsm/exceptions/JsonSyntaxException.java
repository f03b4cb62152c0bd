package works.jsonfsm.exceptions;

import static java.util.Objects.requireNonNull;

/**
 * The input text is not valid JSON.
 * <p>
 * Carries the {@link ErrorKind} of the first problem encountered,
 * the offending code point, and its offset in code points from the start of the input.
 */
public final class JsonSyntaxException extends JsonException {
	/**
	 * Value of {@link #codePoint()} when the problem was the input ending too soon.
	 */
	public static final int END_OF_INPUT = -1;

	private final ErrorKind kind;
	private final int codePoint;
	private final long offset;

	public JsonSyntaxException(ErrorKind kind, int codePoint, long offset, String detail) {
		super(kind + " at offset " + offset + ": " + detail);
		this.kind = requireNonNull(kind);
		this.codePoint = codePoint;
		this.offset = offset;
	}

	public ErrorKind kind() {
		return kind;
	}

	/**
	 * @return the code point that could not be accepted, or {@link #END_OF_INPUT}
	 */
	public int codePoint() {
		return codePoint;
	}

	public long offset() {
		return offset;
	}
}
