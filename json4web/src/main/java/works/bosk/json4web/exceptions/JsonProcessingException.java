package works.bosk.json4web.exceptions;

import static works.bosk.json4web.exceptions.ErrorKind.CUSTOM;
import static works.bosk.json4web.exceptions.ErrorKind.DEPTH_LIMIT;
import static works.bosk.json4web.exceptions.ErrorKind.NAN;
import static works.bosk.json4web.exceptions.ErrorKind.OUT_OF_RANGE;

/**
 * A value can't be encoded.
 * <p>
 * This is thrown while text is being written, so the output
 * may already contain a partial document, which the caller must discard.
 */
public final class JsonProcessingException extends JsonException {
	public JsonProcessingException(ErrorKind kind, String message) {
		super(kind, message);
	}

	public JsonProcessingException(ErrorKind kind, String message, Throwable cause) {
		super(kind, message, cause);
	}

	public static JsonProcessingException custom(String message) {
		return new JsonProcessingException(CUSTOM, message);
	}

	public static JsonProcessingException notANumber(double value) {
		return new JsonProcessingException(NAN, "Cannot encode non-finite float " + value);
	}

	public static JsonProcessingException outOfRange(Object value, String type) {
		return new JsonProcessingException(OUT_OF_RANGE, "Value " + value + " is out of range for " + type);
	}

	public static JsonProcessingException depthLimit(int maxDepth) {
		return new JsonProcessingException(DEPTH_LIMIT, "Value nesting exceeds the limit of " + maxDepth);
	}
}
