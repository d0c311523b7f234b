package works.bosk.json4web.exceptions;

import java.util.OptionalInt;

import static works.bosk.json4web.exceptions.ErrorKind.DEPTH_LIMIT;
import static works.bosk.json4web.exceptions.ErrorKind.END_OF_INPUT;
import static works.bosk.json4web.exceptions.ErrorKind.INVALID_UNICODE_ESCAPE;
import static works.bosk.json4web.exceptions.ErrorKind.UNEXPECTED_TOKEN;
import static works.bosk.json4web.exceptions.ErrorKind.UNEXPECTED_UNICODE_ESCAPE;

/**
 * The input text doesn't follow the grammar.
 */
public final class JsonSyntaxException extends JsonFormatException {
	private static final int NO_CHAR = -1;

	/**
	 * A UTF-16 code unit, or {@link #NO_CHAR}.
	 */
	private final int offendingChar;

	public JsonSyntaxException(ErrorKind kind, String message) {
		super(kind, message);
		this.offendingChar = NO_CHAR;
	}

	JsonSyntaxException(ErrorKind kind, String message, OptionalInt offendingChar, Throwable cause) {
		super(kind, message, cause);
		this.offendingChar = offendingChar.orElse(NO_CHAR);
	}

	private JsonSyntaxException(ErrorKind kind, String message, int offendingChar) {
		super(kind, message);
		this.offendingChar = offendingChar;
	}

	public static JsonSyntaxException endOfInput() {
		return new JsonSyntaxException(END_OF_INPUT, "Unexpected end of input");
	}

	public static JsonSyntaxException endOfInput(CharSequence expecting) {
		return new JsonSyntaxException(END_OF_INPUT, "Unexpected end of input; expecting '" + expecting + "'");
	}

	public static JsonSyntaxException unexpectedToken(char c) {
		return new JsonSyntaxException(UNEXPECTED_TOKEN, "Unexpected character '" + printable(c) + "'", c);
	}

	public static JsonSyntaxException unexpectedToken(char c, String expecting) {
		return new JsonSyntaxException(UNEXPECTED_TOKEN,
			"Unexpected character '" + printable(c) + "'; expecting " + expecting, c);
	}

	public static JsonSyntaxException invalidUnicodeEscape(CharSequence digits) {
		return new JsonSyntaxException(INVALID_UNICODE_ESCAPE, "Invalid unicode escape \\u" + digits);
	}

	public static JsonSyntaxException unexpectedUnicodeEscape(int codeUnit) {
		return new JsonSyntaxException(UNEXPECTED_UNICODE_ESCAPE,
			"Unicode escape \\u" + String.format("%04x", codeUnit) + " is not a valid character");
	}

	public static JsonSyntaxException depthLimit(int maxDepth) {
		return new JsonSyntaxException(DEPTH_LIMIT, "Input nesting exceeds the limit of " + maxDepth);
	}

	/**
	 * @return the character that caused an {@link ErrorKind#UNEXPECTED_TOKEN UNEXPECTED_TOKEN} error, if any
	 */
	public OptionalInt offendingChar() {
		return (offendingChar == NO_CHAR)? OptionalInt.empty() : OptionalInt.of(offendingChar);
	}

	private static String printable(char c) {
		if (c < 0x20) {
			return String.format("\\u%04x", (int) c);
		} else {
			return String.valueOf(c);
		}
	}
}
