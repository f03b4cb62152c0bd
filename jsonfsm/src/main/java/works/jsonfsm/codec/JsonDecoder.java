package works.jsonfsm.codec;

import java.util.Arrays;
import java.util.PrimitiveIterator;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.jsonfsm.exceptions.JsonSyntaxException;
import works.jsonfsm.value.JsonValue;

import static java.util.Objects.requireNonNull;

/**
 * Decodes complete JSON texts into {@link JsonValue} trees.
 * <p>
 * Input is supplied as Unicode code points, or as a {@link CharSequence}
 * whose code points are used. Turning bytes into characters is the caller's business.
 * <p>
 * Instances are immutable and can be shared; each decode uses fresh machines.
 */
public final class JsonDecoder {
	private final DecoderSettings settings;

	private static final JsonDecoder DEFAULT = new JsonDecoder(DecoderSettings.DEFAULT);

	public JsonDecoder(DecoderSettings settings) {
		this.settings = requireNonNull(settings);
	}

	/**
	 * @throws JsonSyntaxException if {@code text} is not a valid JSON text
	 */
	public static JsonValue decode(CharSequence text) {
		return DEFAULT.read(text);
	}

	/**
	 * @throws JsonSyntaxException if {@code codePoints} is not a valid JSON text
	 */
	public static JsonValue decode(int[] codePoints) {
		return DEFAULT.read(codePoints);
	}

	/**
	 * @throws JsonSyntaxException if {@code codePoints} is not a valid JSON text
	 */
	public static JsonValue decode(IntStream codePoints) {
		return DEFAULT.read(codePoints);
	}

	public DecoderSettings settings() {
		return settings;
	}

	public IncrementalDecoder newIncrementalDecoder() {
		return new IncrementalDecoder(settings);
	}

	public JsonValue read(CharSequence text) {
		LOGGER.debug("Decoding {} chars", text.length());
		return read(text.codePoints());
	}

	public JsonValue read(int[] codePoints) {
		return read(Arrays.stream(codePoints));
	}

	public JsonValue read(IntStream codePoints) {
		IncrementalDecoder decoder = newIncrementalDecoder();
		PrimitiveIterator.OfInt iter = codePoints.iterator();
		while (iter.hasNext()) {
			decoder.feed(iter.nextInt());
		}
		return decoder.endOfInput();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonDecoder.class);
}
