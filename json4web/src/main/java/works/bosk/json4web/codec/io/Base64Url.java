package works.bosk.json4web.codec.io;

import java.util.Base64;
import works.bosk.json4web.exceptions.JsonContentException;

/**
 * Byte strings travel as URL-safe base64 text.
 */
public final class Base64Url {
	private static final Base64.Encoder ENCODER = Base64.getUrlEncoder();
	private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

	private Base64Url() { }

	public static String encode(byte[] bytes) {
		return ENCODER.encodeToString(bytes);
	}

	/**
	 * @throws JsonContentException if {@code text} isn't valid URL-safe base64
	 */
	public static byte[] decode(CharSequence text) {
		try {
			return DECODER.decode(text.toString());
		} catch (IllegalArgumentException e) {
			throw JsonContentException.base64(e);
		}
	}
}
