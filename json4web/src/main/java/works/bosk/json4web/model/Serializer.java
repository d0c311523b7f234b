package works.bosk.json4web.model;

/**
 * Describes values of type {@code T} to an {@link Encoder}.
 * <p>
 * An implementation calls exactly one top-level {@code encode} method on the encoder
 * for each value, and if that method returns a compound encoder,
 * it must call {@code end()} on it before returning.
 */
@FunctionalInterface
public interface Serializer<T> {
	void serialize(T value, Encoder out);
}
