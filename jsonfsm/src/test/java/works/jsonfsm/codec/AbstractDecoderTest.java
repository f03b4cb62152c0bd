package works.jsonfsm.codec;

import java.util.stream.Stream;
import org.junit.jupiter.params.Parameter;
import works.jsonfsm.value.JsonValue;

public class AbstractDecoderTest {
	@Parameter
	DecoderSettings settings;

	protected JsonValue decode(String json) {
		return new JsonDecoder(settings).read(json);
	}

	@SuppressWarnings("unused") // Subclasses use this to parameterize tests
	static Stream<DecoderSettings> settingsVariants() {
		return Stream.of(
			DecoderSettings.DEFAULT,
			DecoderSettings.STRICT,
			DecoderSettings.DEFAULT.withMaxDepth(64)
		);
	}
}
