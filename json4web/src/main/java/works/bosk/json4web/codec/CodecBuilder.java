package works.bosk.json4web.codec;

import works.bosk.json4web.model.Deserializer;
import works.bosk.json4web.model.Serializer;

import static java.util.Objects.requireNonNull;

/**
 * Builds a {@link Codec} according to the user's instructions.
 */
public class CodecBuilder {
	private final Settings settings;

	private CodecBuilder(Settings settings) {
		this.settings = settings;
	}

	public static CodecBuilder withSettings(Settings settings) {
		return new CodecBuilder(requireNonNull(settings));
	}

	public static CodecBuilder withDefaults() {
		return withSettings(Settings.DEFAULT);
	}

	public CodecBuilder withMaxDepth(int maxDepth) {
		return new CodecBuilder(settings.withMaxDepth(maxDepth));
	}

	public CodecBuilder withAllowTrailingCharacters(boolean allowTrailingCharacters) {
		return new CodecBuilder(settings.withAllowTrailingCharacters(allowTrailingCharacters));
	}

	public Codec build() {
		Settings settings = this.settings;
		return new Codec() {
			@Override
			public Settings settings() {
				return settings;
			}

			@Override
			public <T> Parser<T> parserFor(Deserializer<T> deserializer) {
				return new Parser<>() {
					@Override
					public T parse(char[] utf16Chars) {
						return new JsonDecoder(utf16Chars, settings).decodeDocument(deserializer);
					}

					@Override
					public T parse(byte[] utf8Bytes) {
						return JsonDecoder.forUtf8(utf8Bytes, settings).decodeDocument(deserializer);
					}
				};
			}

			@Override
			public <T> Generator<T> generatorFor(Serializer<? super T> serializer) {
				return (out, value) -> new JsonEncoder(out, settings).encodeDocument(value, serializer);
			}
		};
	}
}
