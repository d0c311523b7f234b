package works.bosk.json4web.model;

/**
 * A cursor over the elements of a sequence being decoded.
 */
public interface SeqAccess {
	/**
	 * Idempotent until the next call to {@link #next}.
	 *
	 * @return false if the sequence has no more elements
	 */
	boolean hasNext();

	/**
	 * @throws java.util.NoSuchElementException if {@link #hasNext} would return false
	 */
	<E> E next(Deserializer<? extends E> deserializer);
}
