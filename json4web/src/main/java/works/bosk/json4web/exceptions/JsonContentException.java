package works.bosk.json4web.exceptions;

import java.util.Collection;

import static works.bosk.json4web.exceptions.ErrorKind.BASE64;
import static works.bosk.json4web.exceptions.ErrorKind.CUSTOM;
import static works.bosk.json4web.exceptions.ErrorKind.PARSE_FLOAT;
import static works.bosk.json4web.exceptions.ErrorKind.PARSE_INT;
import static works.bosk.json4web.exceptions.ErrorKind.UTF8;

/**
 * The input text is well-formed, but its content doesn't fit the value being decoded.
 */
public final class JsonContentException extends JsonFormatException {
	public JsonContentException(ErrorKind kind, String message) {
		super(kind, message);
	}

	public JsonContentException(ErrorKind kind, String message, Throwable cause) {
		super(kind, message, cause);
	}

	public static JsonContentException custom(String message) {
		return new JsonContentException(CUSTOM, message);
	}

	public static JsonContentException missingField(String field) {
		return custom("missing field `" + field + "`");
	}

	public static JsonContentException duplicateField(String field) {
		return custom("duplicate field `" + field + "`");
	}

	public static JsonContentException unknownVariant(String tag, Collection<String> expected) {
		return custom("unknown variant `" + tag + "`, expected one of " + expected);
	}

	public static JsonContentException invalidType(String unexpected, String expected) {
		return custom("invalid type: " + unexpected + ", expected " + expected);
	}

	public static JsonContentException invalidLength(int length, String expected) {
		return custom("invalid length " + length + ", expected " + expected);
	}

	public static JsonContentException parseInt(CharSequence literal, NumberFormatException cause) {
		return new JsonContentException(PARSE_INT, "Invalid integer literal '" + literal + "': " + cause.getMessage(), cause);
	}

	public static JsonContentException parseFloat(CharSequence literal, NumberFormatException cause) {
		return new JsonContentException(PARSE_FLOAT, "Invalid float literal '" + literal + "': " + cause.getMessage(), cause);
	}

	public static JsonContentException base64(IllegalArgumentException cause) {
		return new JsonContentException(BASE64, "Invalid base64: " + cause.getMessage(), cause);
	}

	public static JsonContentException utf8(Exception cause) {
		return new JsonContentException(UTF8, "Invalid UTF-8: " + cause.getMessage(), cause);
	}
}
