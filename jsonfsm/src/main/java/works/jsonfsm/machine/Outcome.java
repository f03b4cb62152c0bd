package works.jsonfsm.machine;

import works.jsonfsm.exceptions.ErrorKind;
import works.jsonfsm.value.JsonValue;

import static java.util.Objects.requireNonNull;

/**
 * The result of feeding one code point to a {@link Machine}.
 * <p>
 * "No value yet" is a type of its own ({@link Pending}),
 * so no decoded value, not even {@code null} or {@code false}, can be mistaken for it.
 */
public sealed interface Outcome permits Outcome.Pending, Outcome.Partial, Outcome.Done, Outcome.Rejected {
	Pending PENDING = new Pending();

	static Rejected rejected(ErrorKind kind, int codePoint, String detail) {
		return new Rejected(new Rejection(kind, codePoint, detail));
	}

	/**
	 * @return true if the machine that produced this outcome must not be fed again
	 */
	default boolean isTerminal() {
		return false;
	}

	/**
	 * The code point was consumed, and there's no value yet.
	 */
	record Pending() implements Outcome {
		@Override
		public String toString() {
			return "Pending";
		}
	}

	/**
	 * The input so far forms a complete value, but more input could still change it.
	 * Only numbers produce this, because they have no closing delimiter.
	 */
	record Partial(JsonValue value) implements Outcome {
		public Partial {
			requireNonNull(value);
		}
	}

	record Done(JsonValue value) implements Outcome {
		public Done {
			requireNonNull(value);
		}

		@Override
		public boolean isTerminal() {
			return true;
		}
	}

	record Rejected(Rejection rejection) implements Outcome {
		public Rejected {
			requireNonNull(rejection);
		}

		public ErrorKind kind() {
			return rejection.kind();
		}

		@Override
		public boolean isTerminal() {
			return true;
		}
	}
}
