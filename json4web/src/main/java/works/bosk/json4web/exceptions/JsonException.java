package works.bosk.json4web.exceptions;

import static java.util.Objects.requireNonNull;

public sealed abstract class JsonException extends RuntimeException permits JsonFormatException, JsonProcessingException {
	private final ErrorKind kind;

	protected JsonException(ErrorKind kind, String message) {
		super(message);
		this.kind = requireNonNull(kind);
	}

	protected JsonException(ErrorKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = requireNonNull(kind);
	}

	public ErrorKind kind() {
		return kind;
	}

	/**
	 * @return an exception of the same class and {@link #kind() kind} as {@code exception}
	 * whose message is prefixed with {@code context}.
	 */
	@SuppressWarnings("unchecked")
	public static <T extends JsonException> T wrap(T exception, String context) {
		String newMessage = context + ": " + exception.getMessage();
		if (exception instanceof JsonSyntaxException e) {
			return (T) new JsonSyntaxException(e.kind(), newMessage, e.offendingChar(), e);
		} else if (exception instanceof JsonContentException e) {
			return (T) new JsonContentException(e.kind(), newMessage, e);
		} else if (exception instanceof JsonProcessingException e) {
			return (T) new JsonProcessingException(e.kind(), newMessage, e);
		} else {
			return (T) new JsonFormatException(exception.kind(), newMessage, exception);
		}
	}
}
