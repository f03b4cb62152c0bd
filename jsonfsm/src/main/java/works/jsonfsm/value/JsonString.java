package works.jsonfsm.value;

import static java.util.Objects.requireNonNull;

public record JsonString(String value) implements JsonValue {
	public JsonString {
		requireNonNull(value);
	}

	@Override
	public String toString() {
		return '"' + value + '"';
	}
}
