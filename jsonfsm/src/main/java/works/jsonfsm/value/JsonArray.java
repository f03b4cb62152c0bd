package works.jsonfsm.value;

import java.util.List;

/**
 * An immutable, ordered sequence of elements.
 */
public record JsonArray(List<JsonValue> elements) implements JsonValue {
	public static final JsonArray EMPTY = new JsonArray(List.of());

	public JsonArray {
		elements = List.copyOf(elements);
	}

	public static JsonArray of(JsonValue... elements) {
		return new JsonArray(List.of(elements));
	}

	public JsonValue get(int index) {
		return elements.get(index);
	}

	public int size() {
		return elements.size();
	}

	@Override
	public String toString() {
		return elements.toString();
	}
}
