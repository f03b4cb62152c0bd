package works.jsonfsm.value;

public enum JsonNull implements JsonValue {
	INSTANCE;

	@Override
	public String toString() {
		return "null";
	}
}
