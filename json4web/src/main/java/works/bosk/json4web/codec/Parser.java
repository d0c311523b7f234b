package works.bosk.json4web.codec;

/**
 * Creates Java objects corresponding to text.
 * Each call decodes one complete document.
 */
public interface Parser<T> {
	/**
	 * Strings decoded without escapes may be views of {@code utf16Chars},
	 * so don't modify the array while the result is in use.
	 */
	T parse(char[] utf16Chars);

	/**
	 * @throws works.bosk.json4web.exceptions.JsonContentException with kind
	 * {@link works.bosk.json4web.exceptions.ErrorKind#UTF8 UTF8} if the bytes are not valid UTF-8
	 */
	T parse(byte[] utf8Bytes);

	default T parse(String text) {
		return parse(text.toCharArray());
	}
}
