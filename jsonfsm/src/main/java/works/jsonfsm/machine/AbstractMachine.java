package works.jsonfsm.machine;

import works.jsonfsm.exceptions.JsonProcessingException;

import static works.jsonfsm.exceptions.ErrorKind.INCOMPLETE_INPUT;
import static works.jsonfsm.exceptions.JsonSyntaxException.END_OF_INPUT;
import static works.jsonfsm.machine.Characters.describe;

/**
 * Enforces that a finished machine is never fed again.
 */
abstract sealed class AbstractMachine implements Machine permits
	LiteralMachine,
	StringMachine,
	NumberMachine,
	ArrayMachine,
	ObjectMachine,
	ValueMachine
{
	private boolean finished = false;

	@Override
	public final Outcome feed(int codePoint) {
		if (finished) {
			throw new JsonProcessingException(
				getClass().getSimpleName() + " is finished; can't accept " + describe(codePoint));
		}
		Outcome result = accept(codePoint);
		finished = result.isTerminal();
		return result;
	}

	@Override
	public final Outcome endOfInput() {
		if (finished) {
			throw new JsonProcessingException(getClass().getSimpleName() + " is already finished");
		}
		finished = true;
		return finish();
	}

	protected abstract Outcome accept(int codePoint);

	protected Outcome finish() {
		return Outcome.rejected(INCOMPLETE_INPUT, END_OF_INPUT, "Unexpected end of input");
	}
}
