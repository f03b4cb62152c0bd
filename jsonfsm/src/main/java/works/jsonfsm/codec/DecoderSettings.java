package works.jsonfsm.codec;

/**
 * Tunable decoding behaviour.
 *
 * @param maxDepth how deeply arrays and objects may nest; the top-level container counts as 1.
 *                 Decoding recurses on the Java stack once per level, so this can't exceed
 *                 {@value #MAX_SUPPORTED_DEPTH}, a depth a thread with the default stack size survives.
 * @param combineSurrogatePairs reject {@code \}{@code u} escapes for surrogates that don't form a pair
 * @param strictControlCharacters reject unescaped characters below U+0020 inside strings
 */
public record DecoderSettings(
	int maxDepth,
	boolean combineSurrogatePairs,
	boolean strictControlCharacters
) {
	public static final DecoderSettings DEFAULT = new DecoderSettings(512, false, false);

	/**
	 * Also rejects unescaped control characters and unpaired surrogate escapes.
	 */
	public static final DecoderSettings STRICT = new DecoderSettings(512, true, true);

	public static final int MAX_SUPPORTED_DEPTH = 1000;

	public DecoderSettings {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
		} else if (maxDepth > MAX_SUPPORTED_DEPTH) {
			throw new IllegalArgumentException("maxDepth can't exceed " + MAX_SUPPORTED_DEPTH + ", got " + maxDepth);
		}
	}

	public DecoderSettings withMaxDepth(int maxDepth) {
		return new DecoderSettings(maxDepth, combineSurrogatePairs, strictControlCharacters);
	}

	public DecoderSettings withCombineSurrogatePairs(boolean combineSurrogatePairs) {
		return new DecoderSettings(maxDepth, combineSurrogatePairs, strictControlCharacters);
	}

	public DecoderSettings withStrictControlCharacters(boolean strictControlCharacters) {
		return new DecoderSettings(maxDepth, combineSurrogatePairs, strictControlCharacters);
	}
}
