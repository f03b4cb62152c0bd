package works.jsonfsm.machine;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.jsonfsm.exceptions.ErrorKind;
import works.jsonfsm.value.JsonNumber;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.jsonfsm.TestUtils.feedAll;
import static works.jsonfsm.TestUtils.lastOutcome;
import static works.jsonfsm.exceptions.ErrorKind.INVALID_NUMBER_FORMAT;
import static works.jsonfsm.exceptions.ErrorKind.LEADING_ZERO_VIOLATION;
import static works.jsonfsm.machine.Outcome.PENDING;

class NumberMachineTest {
	@Test
	void partialResultsAsDigitsArrive() {
		assertEquals(List.of(
			partial(1.0),
			partial(12.0),
			PENDING,
			partial(12.4),
			partial(12.45)
		), feedAll(new NumberMachine(), "12.45"));
	}

	@Test
	void exponentWithSign() {
		assertEquals(List.of(
			partial(5.0),
			partial(52.0),
			PENDING,
			PENDING,
			partial(0.52)
		), feedAll(new NumberMachine(), "52e-2"));
	}

	@Test
	void zeroIsAValue() {
		assertEquals(List.of(partial(0.0)), feedAll(new NumberMachine(), "0"));
	}

	@Test
	void negativeZero() {
		assertEquals(partial(-0.0), lastOutcome(new NumberMachine(), "-0"));
	}

	@ParameterizedTest
	@ValueSource(strings = {"1", "0", "0.04", "1.02", "35.2e1", "52e-2", "-7", "1E+3", "1e03", "123456789012"})
	void validNumbers(String json) {
		NumberMachine machine = new NumberMachine();
		assertEquals(partial(Double.parseDouble(json)), lastOutcome(machine, json));
		assertEquals(new Outcome.Done(new JsonNumber(Double.parseDouble(json))), machine.endOfInput());
	}

	@ParameterizedTest
	@ValueSource(strings = {"01", "00", "-01", "-00"})
	void leadingZeros(String json) {
		assertEquals(LEADING_ZERO_VIOLATION, kindOf(lastOutcome(new NumberMachine(), json)));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		".45",      // No integer part
		"1e-0.2",   // Fraction in exponent
		"12.34.5",  // Two decimal points
		"1.e5",     // No fraction digits
		"--1",      // Two signs
		"+1",       // Leading plus
		"1e+-1",    // Two exponent signs
		"1x",       // Letter other than e
		"0x10",     // Hex
	})
	void invalidCharacters(String json) {
		assertEquals(INVALID_NUMBER_FORMAT, kindOf(lastOutcome(new NumberMachine(), json)));
	}

	@ParameterizedTest
	@ValueSource(strings = {"-", "1.", "0.01e", "1e+", "1E-"})
	void incompleteAtEndOfInput(String json) {
		NumberMachine machine = new NumberMachine();
		Outcome last = lastOutcome(machine, json);
		assertEquals(PENDING, last);
		assertEquals(INVALID_NUMBER_FORMAT, kindOf(machine.endOfInput()));
	}

	@Test
	void overflowIsInfinite() {
		Outcome outcome = lastOutcome(new NumberMachine(), "1e400");
		double value = ((JsonNumber) assertInstanceOf(Outcome.Partial.class, outcome).value()).value();
		assertTrue(Double.isInfinite(value));
	}

	@Test
	void longDigitRunTakesLinearTime() {
		String digits = "7".repeat(200_000);
		Outcome done = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
			NumberMachine machine = new NumberMachine();
			for (int i = 0; i < digits.length(); i++) {
				assertInstanceOf(Outcome.Partial.class, machine.feed(digits.charAt(i)));
			}
			return machine.endOfInput();
		});
		assertEquals(new Outcome.Done(new JsonNumber(Double.POSITIVE_INFINITY)), done);
	}

	@Test
	void longFractionTakesLinearTime() {
		String json = "0." + "3".repeat(200_000) + "e-5";
		Outcome done = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
			NumberMachine machine = new NumberMachine();
			lastOutcome(machine, json);
			return machine.endOfInput();
		});
		assertEquals(new Outcome.Done(new JsonNumber(Double.parseDouble(json))), done);
	}

	@Test
	void endOfInputIsExactWherePartialsAreNot() {
		// 2^53 + 1: the partial drops the last digit, the final value rounds correctly
		NumberMachine machine = new NumberMachine();
		lastOutcome(machine, "9007199254740993");
		assertEquals(new Outcome.Done(new JsonNumber(9007199254740992.0)), machine.endOfInput());
	}

	@Test
	void hugeExponentsDoNotWrapAround() {
		NumberMachine machine = new NumberMachine();
		Outcome outcome = lastOutcome(machine, "1e99999999999");
		double value = ((JsonNumber) assertInstanceOf(Outcome.Partial.class, outcome).value()).value();
		assertTrue(Double.isInfinite(value));
		assertEquals(new Outcome.Done(new JsonNumber(Double.POSITIVE_INFINITY)), machine.endOfInput());

		assertEquals(partial(0.0), lastOutcome(new NumberMachine(), "5e-99999999999"));
	}

	@Test
	void delimitersAreNotPartOfNumbers() {
		for (char delimiter : new char[] {',', ']', '}', ' '}) {
			NumberMachine machine = new NumberMachine();
			machine.feed('1');
			assertEquals(INVALID_NUMBER_FORMAT, kindOf(machine.feed(delimiter)));
		}
	}

	private static Outcome.Partial partial(double value) {
		return new Outcome.Partial(new JsonNumber(value));
	}

	private static ErrorKind kindOf(Outcome outcome) {
		return assertInstanceOf(Outcome.Rejected.class, outcome).kind();
	}
}
