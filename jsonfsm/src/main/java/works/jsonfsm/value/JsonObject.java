package works.jsonfsm.value;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * An immutable mapping from member names to values.
 * Iteration follows insertion order. Names are unique;
 * when the decoded text repeats a name, the last value wins
 * but the member keeps the position of its first occurrence.
 */
public record JsonObject(Map<String, JsonValue> members) implements JsonValue {
	public static final JsonObject EMPTY = new JsonObject(Map.of());

	public JsonObject {
		Map<String, JsonValue> copy = new LinkedHashMap<>(members);
		copy.forEach((name, value) -> {
			requireNonNull(name);
			requireNonNull(value, name);
		});
		members = unmodifiableMap(copy);
	}

	/**
	 * @return the member's value, or Java {@code null} if there's no member with that name
	 * (as opposed to {@link JsonNull#INSTANCE}, which means the member is present with a null value)
	 */
	public JsonValue get(String name) {
		return members.get(name);
	}

	public boolean has(String name) {
		return members.containsKey(name);
	}

	public int size() {
		return members.size();
	}

	@Override
	public String toString() {
		return members.toString();
	}
}
