package works.jsonfsm.machine;

/**
 * Incrementally decodes one JSON grammar rule, one code point at a time.
 * <p>
 * A machine returns {@link Outcome.Pending} or {@link Outcome.Partial} while it can accept more input.
 * Once it returns {@link Outcome.Done} or {@link Outcome.Rejected}, it is finished,
 * and calling either method again throws {@link works.jsonfsm.exceptions.JsonProcessingException}.
 * <p>
 * Machines are not thread-safe. Each one is owned by whoever created it.
 */
public interface Machine {
	Outcome feed(int codePoint);

	/**
	 * Tells the machine that no more input is coming.
	 * Afterward, the machine is finished regardless of the result.
	 *
	 * @return {@link Outcome.Done} if the input fed so far is a complete value,
	 * or else {@link Outcome.Rejected} explaining what's missing
	 */
	Outcome endOfInput();
}
