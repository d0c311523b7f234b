package works.bosk.json4web.model;

/**
 * Constructs values of type {@code T} by pulling them out of a {@link Decoder}.
 * <p>
 * An implementation calls exactly one top-level {@code decode} method on the decoder
 * for each value it constructs.
 */
@FunctionalInterface
public interface Deserializer<T> {
	T deserialize(Decoder in);
}
