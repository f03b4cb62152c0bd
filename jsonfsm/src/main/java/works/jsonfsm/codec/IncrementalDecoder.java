package works.jsonfsm.codec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.jsonfsm.exceptions.JsonProcessingException;
import works.jsonfsm.exceptions.JsonSyntaxException;
import works.jsonfsm.machine.Outcome;
import works.jsonfsm.machine.Rejection;
import works.jsonfsm.machine.ValueMachine;
import works.jsonfsm.value.JsonValue;

import static java.util.Objects.requireNonNull;
import static works.jsonfsm.exceptions.ErrorKind.INCOMPLETE_INPUT;
import static works.jsonfsm.exceptions.ErrorKind.TRAILING_CONTENT;
import static works.jsonfsm.exceptions.JsonSyntaxException.END_OF_INPUT;
import static works.jsonfsm.machine.Characters.describe;
import static works.jsonfsm.machine.Characters.isWhitespace;

/**
 * Decodes one JSON text fed a code point at a time.
 * <p>
 * Whitespace before and after the value is skipped.
 * Call {@link #feed} for each code point, then {@link #endOfInput} to get the value.
 * The first problem encountered throws {@link JsonSyntaxException},
 * after which the decoder can't be used any more.
 * <p>
 * Provisional number values are never exposed; only the final value is returned.
 * <p>
 * Not thread-safe.
 */
public final class IncrementalDecoder {
	private final DecoderSettings settings;
	private State state = State.BEFORE_VALUE;
	private ValueMachine root;
	private Outcome lastOutcome;
	private JsonValue result;
	private long offset = 0;

	enum State {
		BEFORE_VALUE,
		IN_VALUE,
		AFTER_VALUE,
		FINISHED,
		FAILED,
	}

	public IncrementalDecoder(DecoderSettings settings) {
		this.settings = requireNonNull(settings);
	}

	public void feed(int codePoint) {
		switch (state) {
			case BEFORE_VALUE -> {
				if (!isWhitespace(codePoint)) {
					root = new ValueMachine(settings, 0);
					state = State.IN_VALUE;
					feedRoot(codePoint);
				}
			}
			case IN_VALUE -> {
				if (lastOutcome instanceof Outcome.Partial && isWhitespace(codePoint)) {
					// Only a number can be partial, and whitespace ends it
					finishRoot();
				} else {
					feedRoot(codePoint);
				}
			}
			case AFTER_VALUE -> {
				if (!isWhitespace(codePoint)) {
					throw fail(new Rejection(TRAILING_CONTENT, codePoint,
						"Unexpected " + describe(codePoint) + " after the end of the value"));
				}
			}
			case FINISHED -> throw new JsonProcessingException("Can't feed a decoder after endOfInput");
			case FAILED -> throw new JsonProcessingException("Can't feed a decoder that has already failed");
		}
		offset++;
	}

	private void feedRoot(int codePoint) {
		Outcome outcome = root.feed(codePoint);
		if (outcome instanceof Outcome.Done done) {
			complete(done.value());
		} else if (outcome instanceof Outcome.Rejected rejected) {
			throw fail(rejected.rejection());
		} else {
			lastOutcome = outcome;
		}
	}

	private void finishRoot() {
		Outcome outcome = root.endOfInput();
		if (outcome instanceof Outcome.Done done) {
			complete(done.value());
		} else if (outcome instanceof Outcome.Rejected rejected) {
			throw fail(rejected.rejection());
		} else {
			throw new JsonProcessingException("Unexpected outcome at end of input: " + outcome);
		}
	}

	private void complete(JsonValue value) {
		result = value;
		root = null;
		lastOutcome = null;
		state = State.AFTER_VALUE;
	}

	/**
	 * @return the decoded value
	 * @throws JsonSyntaxException if the input so far is not a complete JSON text
	 */
	public JsonValue endOfInput() {
		switch (state) {
			case BEFORE_VALUE -> throw fail(new Rejection(INCOMPLETE_INPUT, END_OF_INPUT, "Input contains no value"));
			// A number whose last outcome was partial finishes successfully here
			case IN_VALUE -> finishRoot();
			case AFTER_VALUE -> { }
			case FINISHED -> throw new JsonProcessingException("endOfInput already called");
			case FAILED -> throw new JsonProcessingException("Decoder has already failed");
		}
		state = State.FINISHED;
		return result;
	}

	/**
	 * @return true if a complete value has been decoded,
	 * so that only whitespace may follow
	 */
	public boolean isDone() {
		return state == State.AFTER_VALUE || state == State.FINISHED;
	}

	/**
	 * @return the number of code points fed so far
	 */
	public long offset() {
		return offset;
	}

	private JsonSyntaxException fail(Rejection rejection) {
		state = State.FAILED;
		root = null;
		JsonSyntaxException exception = rejection.toException(offset);
		LOGGER.debug("Decoding failed: {}", exception.getMessage());
		return exception;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(IncrementalDecoder.class);
}
