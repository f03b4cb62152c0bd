package works.jsonfsm.machine;

import works.jsonfsm.exceptions.JsonProcessingException;
import works.jsonfsm.value.JsonNumber;

import static works.jsonfsm.exceptions.ErrorKind.INVALID_NUMBER_FORMAT;
import static works.jsonfsm.exceptions.ErrorKind.LEADING_ZERO_VIOLATION;
import static works.jsonfsm.exceptions.JsonSyntaxException.END_OF_INPUT;
import static works.jsonfsm.machine.Characters.describe;
import static works.jsonfsm.machine.Characters.isDigit;
import static works.jsonfsm.machine.Outcome.PENDING;

/**
 * Decodes a JSON number: {@code -? int (. frac)? ([eE] [+-]? exp)?}.
 * <p>
 * Numbers have no closing delimiter, so this machine never returns {@link Outcome.Done} from {@link #feed}.
 * Whenever the input so far is a complete number, it returns {@link Outcome.Partial} with that number;
 * it's up to the caller to stop at a delimiter and call {@link #endOfInput} for the final value.
 * So {@code 12.45} produces 1.0, 12.0, Pending, 12.4, and 12.45.
 * <p>
 * Partial values are computed incrementally and are exact only up to
 * {@value #EXACT_DIGITS} significant digits and a power of ten up to {@value #EXACT_POWER};
 * beyond that they are approximations. The {@link Outcome.Done} value from
 * {@link #endOfInput} is always the correctly rounded {@code double}.
 */
public final class NumberMachine extends AbstractMachine {
	private final StringBuilder text = new StringBuilder();
	private State state = State.START;

	private boolean negative = false;
	private long mantissa = 0;
	private int significantDigits = 0;

	/**
	 * Power of ten applied to {@link #mantissa}, not counting the exponent part.
	 */
	private int scale = 0;
	private boolean negativeExponent = false;
	private int exponentValue = 0;

	/**
	 * Names refer to what has just been consumed.
	 */
	enum State {
		START,
		MINUS,
		ZERO,             // Integer part is exactly 0
		INT_DIGITS,
		DOT,
		FRAC_DIGITS,
		EXP_MARK,
		EXP_SIGN,
		EXP_DIGITS,
		;

		boolean isAccepting() {
			return switch (this) {
				case ZERO, INT_DIGITS, FRAC_DIGITS, EXP_DIGITS -> true;
				default -> false;
			};
		}
	}

	@Override
	protected Outcome accept(int codePoint) {
		State next = nextState(codePoint);
		if (next == null) {
			if (state == State.ZERO && isDigit(codePoint)) {
				return Outcome.rejected(LEADING_ZERO_VIOLATION, codePoint,
					"A number can't have a leading zero followed by " + describe(codePoint));
			}
			return Outcome.rejected(INVALID_NUMBER_FORMAT, codePoint,
				"Unexpected " + describe(codePoint) + " in number after \"" + text + "\"");
		}
		text.append((char)codePoint);
		track(next, codePoint);
		state = next;
		if (next.isAccepting()) {
			return new Outcome.Partial(new JsonNumber(provisionalValue()));
		} else {
			return PENDING;
		}
	}

	private void track(State next, int c) {
		switch (next) {
			case MINUS -> negative = true;
			case ZERO, INT_DIGITS -> addDigit(c - '0', false);
			case FRAC_DIGITS -> addDigit(c - '0', true);
			case EXP_SIGN -> negativeExponent = (c == '-');
			case EXP_DIGITS -> exponentValue = Math.min(exponentValue * 10 + (c - '0'), MAX_EXPONENT);
			default -> { }
		}
	}

	private void addDigit(int digit, boolean fraction) {
		if (significantDigits < EXACT_DIGITS) {
			mantissa = mantissa * 10 + digit;
			if (mantissa != 0) {
				significantDigits++;
			}
			if (fraction) {
				scale--;
			}
		} else if (!fraction) {
			// Dropped integer digit still counts toward the magnitude
			scale++;
		}
	}

	private double provisionalValue() {
		assert state.isAccepting();
		double magnitude;
		int power = scale + (negativeExponent ? -exponentValue : exponentValue);
		if (mantissa == 0) {
			magnitude = 0.0;
		} else if (power == 0) {
			magnitude = mantissa;
		} else if (0 < power && power <= EXACT_POWER) {
			magnitude = mantissa * POWERS_OF_TEN[power];
		} else if (-EXACT_POWER <= power && power < 0) {
			magnitude = mantissa / POWERS_OF_TEN[-power];
		} else {
			magnitude = mantissa * Math.pow(10, power);
		}
		return negative ? -magnitude : magnitude;
	}

	/**
	 * @return null if the grammar can't accept {@code codePoint} here
	 */
	private State nextState(int c) {
		return switch (state) {
			case START -> {
				if (c == '-') {
					yield State.MINUS;
				}
				yield integerStart(c);
			}
			case MINUS -> integerStart(c);
			case ZERO -> fractionOrExponent(c);
			case INT_DIGITS -> isDigit(c) ? State.INT_DIGITS : fractionOrExponent(c);
			case DOT -> isDigit(c) ? State.FRAC_DIGITS : null;
			case FRAC_DIGITS -> isDigit(c) ? State.FRAC_DIGITS : exponent(c);
			case EXP_MARK -> {
				if (c == '+' || c == '-') {
					yield State.EXP_SIGN;
				}
				yield isDigit(c) ? State.EXP_DIGITS : null;
			}
			case EXP_SIGN, EXP_DIGITS -> isDigit(c) ? State.EXP_DIGITS : null;
		};
	}

	private static State integerStart(int c) {
		if (c == '0') {
			return State.ZERO;
		} else if (isDigit(c)) {
			return State.INT_DIGITS;
		} else {
			return null;
		}
	}

	private static State fractionOrExponent(int c) {
		return (c == '.') ? State.DOT : exponent(c);
	}

	private static State exponent(int c) {
		return (c == 'e' || c == 'E') ? State.EXP_MARK : null;
	}

	private JsonNumber finalValue() {
		try {
			return new JsonNumber(Double.parseDouble(text.toString()));
		} catch (NumberFormatException e) {
			throw new JsonProcessingException("Validated number text was not parseable: " + text, e);
		}
	}

	@Override
	protected Outcome finish() {
		if (state.isAccepting()) {
			return new Outcome.Done(finalValue());
		} else {
			return Outcome.rejected(INVALID_NUMBER_FORMAT, END_OF_INPUT,
				"Input ended with incomplete number \"" + text + "\"");
		}
	}

	/**
	 * Mantissas with this many digits are exactly representable as a {@code double}.
	 */
	static final int EXACT_DIGITS = 15;

	/**
	 * Powers of ten up to this one are exactly representable as a {@code double}.
	 */
	static final int EXACT_POWER = 22;

	private static final int MAX_EXPONENT = 100_000;

	private static final double[] POWERS_OF_TEN = new double[EXACT_POWER + 1];

	static {
		double power = 1.0;
		for (int i = 0; i <= EXACT_POWER; i++) {
			POWERS_OF_TEN[i] = power;
			power *= 10;
		}
	}
}
