package works.bosk.json4web.codec;

import works.bosk.json4web.model.Deserializer;
import works.bosk.json4web.model.Serializer;

/**
 * A factory for parsers and generators that share the same {@link Settings}.
 * Accessible via {@link CodecBuilder}.
 * <p>
 * Codecs, parsers, and generators hold no per-call state and may be shared between threads.
 */
public interface Codec {
	Settings settings();
	<T> Parser<T> parserFor(Deserializer<T> deserializer);
	<T> Generator<T> generatorFor(Serializer<? super T> serializer);
}
