package works.bosk.json4web.codec;

/**
 * A syntactically significant element of the text, identified by its first character.
 */
public enum Token {
	END_TEXT,
	NULL,
	FALSE,
	TRUE,

	/**
	 * Includes the boolean forms {@code 1} and {@code 0},
	 * which can't be distinguished from numbers without knowing the expected type.
	 */
	NUMBER,

	START_OBJECT,
	END_OBJECT,
	START_ARRAY,
	END_ARRAY,

	/**
	 * Can be a member name, a string value, a quoted wide integer, base64 bytes, or a variant tag.
	 * We don't distinguish at the token level.
	 */
	STRING,

	COMMA,
	COLON,
	WHITESPACE,

	ERROR;

	public static Token startingWith(int c) {
		return switch (c) {
			case -1 -> END_TEXT;
			case 'n' -> NULL;
			case 'f' -> FALSE;
			case 't' -> TRUE;
			case '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', '-' -> NUMBER;
			case '{' -> START_OBJECT;
			case '}' -> END_OBJECT;
			case '[' -> START_ARRAY;
			case ']' -> END_ARRAY;
			case '"' -> STRING;
			case ',' -> COMMA;
			case ':' -> COLON;
			case 0x20, 0x0A, 0x0D, 0x09 -> WHITESPACE;
			default -> ERROR;
		};
	}

	public String fixedRepresentation() {
		return switch (this) {
			case END_TEXT -> "";
			case NULL -> "null";
			case FALSE -> "false";
			case TRUE -> "true";
			case START_OBJECT -> "{";
			case END_OBJECT -> "}";
			case START_ARRAY -> "[";
			case END_ARRAY -> "]";
			case COMMA -> ",";
			case COLON -> ":";
			default ->
				throw new IllegalArgumentException("Token has no fixed representation: " + this);
		};
	}

	/**
	 * @return the single character that represents this token
	 * @throws IllegalArgumentException if there is no such character
	 */
	public char fixedChar() {
		String representation = fixedRepresentation();
		if (representation.length() != 1) {
			throw new IllegalArgumentException("Token is not a single character: " + this);
		}
		return representation.charAt(0);
	}
}
