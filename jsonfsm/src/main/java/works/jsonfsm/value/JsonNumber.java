package works.jsonfsm.value;

/**
 * All JSON numbers are normalized to {@code double}.
 * Formatting such as exponent style and trailing zeros is not preserved.
 * <p>
 * Equality follows {@link Double#compare}, so {@code -0.0} and {@code 0.0} differ.
 */
public record JsonNumber(double value) implements JsonValue {
	@Override
	public String toString() {
		return Double.toString(value);
	}
}
