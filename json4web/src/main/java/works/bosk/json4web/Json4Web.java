package works.bosk.json4web;

import works.bosk.json4web.codec.Codec;
import works.bosk.json4web.codec.CodecBuilder;
import works.bosk.json4web.codec.Settings;
import works.bosk.json4web.model.Deserializer;
import works.bosk.json4web.model.Serializer;

/**
 * One-line conversions using {@link Settings#DEFAULT}.
 * For other settings, or to reuse parsers and generators,
 * use {@link CodecBuilder}.
 */
public final class Json4Web {
	private static final Codec DEFAULT_CODEC = CodecBuilder.withDefaults().build();

	private Json4Web() { }

	public static <T> T fromString(String text, Deserializer<T> deserializer) {
		return DEFAULT_CODEC.parserFor(deserializer).parse(text);
	}

	/**
	 * Unescaped strings in the result may share {@code chars};
	 * see {@link works.bosk.json4web.model.Decoder#decodeStr()}.
	 */
	public static <T> T fromChars(char[] chars, Deserializer<T> deserializer) {
		return DEFAULT_CODEC.parserFor(deserializer).parse(chars);
	}

	public static <T> T fromBytes(byte[] utf8Bytes, Deserializer<T> deserializer) {
		return DEFAULT_CODEC.parserFor(deserializer).parse(utf8Bytes);
	}

	public static <T> String toString(T value, Serializer<? super T> serializer) {
		return DEFAULT_CODEC.<T>generatorFor(serializer).generate(value);
	}

	public static <T> void write(Appendable out, T value, Serializer<? super T> serializer) {
		DEFAULT_CODEC.<T>generatorFor(serializer).generate(out, value);
	}
}
