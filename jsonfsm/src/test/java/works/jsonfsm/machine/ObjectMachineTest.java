package works.jsonfsm.machine;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.jsonfsm.codec.DecoderSettings;
import works.jsonfsm.exceptions.ErrorKind;
import works.jsonfsm.value.JsonNull;
import works.jsonfsm.value.JsonObject;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static works.jsonfsm.TestUtils.arr;
import static works.jsonfsm.TestUtils.feedAll;
import static works.jsonfsm.TestUtils.lastOutcome;
import static works.jsonfsm.TestUtils.num;
import static works.jsonfsm.TestUtils.obj;
import static works.jsonfsm.TestUtils.str;
import static works.jsonfsm.exceptions.ErrorKind.EXPECTED_QUOTE;
import static works.jsonfsm.exceptions.ErrorKind.INCOMPLETE_INPUT;
import static works.jsonfsm.exceptions.ErrorKind.MISSING_COLON;
import static works.jsonfsm.exceptions.ErrorKind.NESTING_TOO_DEEP;
import static works.jsonfsm.exceptions.ErrorKind.TRAILING_COMMA;
import static works.jsonfsm.exceptions.ErrorKind.UNEXPECTED_CHARACTER;
import static works.jsonfsm.exceptions.ErrorKind.UNEXPECTED_CLOSE_OR_COMMA;
import static works.jsonfsm.exceptions.ErrorKind.UNTERMINATED_STRING;
import static works.jsonfsm.machine.Outcome.PENDING;

class ObjectMachineTest {
	@Test
	void empty() {
		assertEquals(List.of(PENDING, new Outcome.Done(JsonObject.EMPTY)), feedAll(newMachine(), "{}"));
	}

	@Test
	void members() {
		assertEquals(done(obj("one", num(1))), lastOutcome(newMachine(), "{\"one\": 1}"));
		assertEquals(done(obj("one", num(1), "two", num(2))), lastOutcome(newMachine(), "{ \"one\" :1, \"two\": 2}"));
		assertEquals(done(obj("one", num(1))), lastOutcome(newMachine(), "{ \"one\" : 1 }"));
	}

	@Test
	void delimiterInsideString() {
		assertEquals(done(obj("delimiter", str("}"))), lastOutcome(newMachine(), "{\"delimiter\": \"}\" }"));
	}

	@Test
	void nested() {
		assertEquals(done(obj("nested", obj("object", str("here")))),
			lastOutcome(newMachine(), "{\"nested\": {\"object\": \"here\"}}"));
		assertEquals(done(obj("a", arr(num(1), obj()), "b", JsonNull.INSTANCE)),
			lastOutcome(newMachine(), "{\"a\":[1,{}],\"b\":null}"));
	}

	@Test
	void lastDuplicateWins() {
		Outcome outcome = lastOutcome(newMachine(), "{\"a\":1,\"b\":0,\"a\":2}");
		JsonObject object = (JsonObject) assertInstanceOf(Outcome.Done.class, outcome).value();
		assertEquals(obj("a", num(2), "b", num(0)), object);
		assertEquals(List.of("a", "b"), List.copyOf(object.members().keySet()), "First occurrence keeps its position");
	}

	@Test
	void emptyName() {
		assertEquals(done(obj("", num(0))), lastOutcome(newMachine(), "{\"\":0}"));
	}

	@Test
	void trailingComma() {
		assertEquals(TRAILING_COMMA, kindOf(lastOutcome(newMachine(), "{\"a\":1,}")));
		assertEquals(TRAILING_COMMA, kindOf(lastOutcome(newMachine(), "{\"extra\" : \"comma\",}")));
	}

	@ParameterizedTest
	@ValueSource(strings = {"{,}", "{\"key\":}", "{\"key\":,\"b\":1}", "{\"a\":1,,\"b\":2}"})
	void misplacedCommaOrClose(String json) {
		assertEquals(UNEXPECTED_CLOSE_OR_COMMA, kindOf(lastOutcome(newMachine(), json)));
	}

	@Test
	void nameMustBeAString() {
		assertEquals(EXPECTED_QUOTE, kindOf(lastOutcome(newMachine(), "{:\"value\"}")));
		assertEquals(EXPECTED_QUOTE, kindOf(lastOutcome(newMachine(), "{one: 1}")));
	}

	@Test
	void missingColon() {
		assertEquals(MISSING_COLON, kindOf(lastOutcome(newMachine(), "{\"a\" 1}")));
		assertEquals(MISSING_COLON, kindOf(lastOutcome(newMachine(), "{\"a\"}")));
	}

	@Test
	void missingComma() {
		assertEquals(UNEXPECTED_CHARACTER, kindOf(lastOutcome(newMachine(), "{\"a\":1 \"b\":2}")));
	}

	@ParameterizedTest
	@ValueSource(strings = {"{\"a\":1]", "{\"a\":-2e5]", "{\"a\":null]", "{\"a\":{}]"})
	void mismatchedCloserIsReportedTheSameWayForEveryValue(String json) {
		assertEquals(UNEXPECTED_CHARACTER, kindOf(lastOutcome(newMachine(), json)));
	}

	@Test
	void numberValuesAreCorrectlyRounded() {
		assertEquals(done(obj("big", num(Double.parseDouble("12345678901234567890")))),
			lastOutcome(newMachine(), "{\"big\":12345678901234567890}"));
	}

	@Test
	void endOfInput() {
		ObjectMachine machine = newMachine();
		feedAll(machine, "{\"a\":1");
		assertEquals(INCOMPLETE_INPUT, kindOf(machine.endOfInput()));

		machine = newMachine();
		feedAll(machine, "{\"abc");
		assertEquals(UNTERMINATED_STRING, kindOf(machine.endOfInput()));

		machine = newMachine();
		feedAll(machine, "{\"a\": \"abc");
		assertEquals(UNTERMINATED_STRING, kindOf(machine.endOfInput()));
	}

	@Test
	void depthLimit() {
		DecoderSettings settings = DecoderSettings.DEFAULT.withMaxDepth(1);
		assertEquals(done(obj("a", num(1))), lastOutcome(new ObjectMachine(settings, 0), "{\"a\":1}"));
		assertEquals(NESTING_TOO_DEEP, kindOf(lastOutcome(new ObjectMachine(settings, 0), "{\"a\":{}}")));
		assertEquals(NESTING_TOO_DEEP, kindOf(lastOutcome(new ObjectMachine(settings, 0), "{\"a\":[]}")));
	}

	private static ObjectMachine newMachine() {
		return new ObjectMachine(DecoderSettings.DEFAULT, 0);
	}

	private static Outcome.Done done(JsonObject object) {
		return new Outcome.Done(object);
	}

	private static ErrorKind kindOf(Outcome outcome) {
		return assertInstanceOf(Outcome.Rejected.class, outcome).kind();
	}
}
