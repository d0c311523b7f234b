package works.bosk.json4web.codec;

/**
 * Emits text corresponding to Java objects.
 */
public interface Generator<T> {
	/**
	 * If this throws, {@code out} may have received part of a document.
	 */
	void generate(Appendable out, T value);

	default String generate(T value) {
		StringBuilder sb = new StringBuilder();
		generate(sb, value);
		return sb.toString();
	}
}
