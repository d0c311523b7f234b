package works.bosk.json4web.model;

/**
 * A cursor over the entries of a map or struct being decoded.
 * Each entry is read with {@link #nextKey} followed by {@link #nextValue}.
 */
public interface MapAccess {
	/**
	 * Idempotent until the next call to {@link #nextKey}.
	 *
	 * @return false if the map has no more entries
	 */
	boolean hasNext();

	/**
	 * Keys are always strings in the text, but the {@code deserializer}
	 * may decode them as any scalar type. For example, {@link Decoder#decodeI32()}
	 * will parse a key like {@code "123"}.
	 *
	 * @throws java.util.NoSuchElementException if {@link #hasNext} would return false
	 */
	<K> K nextKey(Deserializer<? extends K> deserializer);

	<V> V nextValue(Deserializer<? extends V> deserializer);
}
