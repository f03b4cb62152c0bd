package works.jsonfsm.value;

/**
 * A decoded JSON value.
 * <p>
 * Every legitimate JSON value, including {@code null}, {@code false}, {@code 0},
 * and empty strings, arrays and objects, is represented by a non-null instance.
 * Java {@code null} never stands for a JSON value.
 */
public sealed interface JsonValue permits
	JsonNull,
	JsonBoolean,
	JsonNumber,
	JsonString,
	JsonArray,
	JsonObject
{
}
