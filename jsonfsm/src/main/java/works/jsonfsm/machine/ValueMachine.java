package works.jsonfsm.machine;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.jsonfsm.codec.DecoderSettings;

import static java.util.Objects.requireNonNull;
import static works.jsonfsm.exceptions.ErrorKind.INCOMPLETE_INPUT;
import static works.jsonfsm.exceptions.ErrorKind.NESTING_TOO_DEEP;
import static works.jsonfsm.exceptions.ErrorKind.NO_MATCHING_GRAMMAR;
import static works.jsonfsm.exceptions.JsonSyntaxException.END_OF_INPUT;
import static works.jsonfsm.machine.Characters.describe;

/**
 * Decodes any JSON value.
 * <p>
 * The first code point is fed to a fresh machine for every {@link Grammar} alternative.
 * Those that reject it are discarded, and the first survivor in {@link Grammar} order
 * receives all subsequent input. From then on, this machine's outcomes are the survivor's.
 */
public final class ValueMachine extends AbstractMachine {
	private final DecoderSettings settings;
	private final int depth;

	/**
	 * Null until the first code point has been fed.
	 */
	private Machine survivor;
	private Grammar grammar;

	public ValueMachine() {
		this(DecoderSettings.DEFAULT, 0);
	}

	/**
	 * @param depth number of arrays and objects enclosing this value
	 */
	public ValueMachine(DecoderSettings settings, int depth) {
		this.settings = requireNonNull(settings);
		this.depth = depth;
	}

	/**
	 * @return the alternative chosen by the first code point, or null if none has been fed yet
	 */
	public Grammar grammar() {
		return grammar;
	}

	@Override
	protected Outcome accept(int codePoint) {
		if (survivor == null) {
			return dispatch(codePoint);
		} else {
			return survivor.feed(codePoint);
		}
	}

	private Outcome dispatch(int codePoint) {
		Grammar[] alternatives = Grammar.values();
		List<Outcome.Rejected> rejections = new ArrayList<>(alternatives.length);
		Outcome result = null;
		for (Grammar alternative : alternatives) {
			Machine candidate = alternative.newMachine(settings, depth);
			Outcome outcome = candidate.feed(codePoint);
			if (outcome instanceof Outcome.Rejected rejected) {
				rejections.add(rejected);
			} else if (survivor == null) {
				survivor = candidate;
				grammar = alternative;
				result = outcome;
			} else {
				LOGGER.trace("Also accepted by {}, discarding: {}", alternative, describe(codePoint));
			}
		}

		if (survivor == null) {
			LOGGER.trace("No alternative accepts {}", describe(codePoint));
			// A container refusing to open because of its depth is more informative than the generic error
			for (Outcome.Rejected rejected : rejections) {
				if (rejected.kind() == NESTING_TOO_DEEP) {
					return rejected;
				}
			}
			return Outcome.rejected(NO_MATCHING_GRAMMAR, codePoint,
				"No JSON value can start with " + describe(codePoint));
		}

		LOGGER.trace("{} at depth {} dispatched to {}", describe(codePoint), depth, grammar);
		assert grammar == Grammar.startingWith(codePoint): "Dispatch disagrees with first-character table for " + describe(codePoint);
		return result;
	}

	@Override
	protected Outcome finish() {
		if (survivor == null) {
			return Outcome.rejected(INCOMPLETE_INPUT, END_OF_INPUT, "Input ended before a value began");
		} else {
			return survivor.endOfInput();
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ValueMachine.class);
}
