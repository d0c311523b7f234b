package works.bosk.json4web.exceptions;

/**
 * The input text can't be decoded.
 * <p>
 * This class is concrete so that {@link JsonException#wrap} has something to fall back on,
 * but decoders should always throw one of the subclasses.
 */
public sealed class JsonFormatException extends JsonException permits
	JsonContentException,
	JsonSyntaxException
{
	public JsonFormatException(ErrorKind kind, String message) {
		super(kind, message);
	}

	public JsonFormatException(ErrorKind kind, String message, Throwable cause) {
		super(kind, message, cause);
	}
}
