package works.bosk.json4web.exceptions;

/**
 * The closed set of reasons a decode or encode call can fail.
 * Every {@link JsonException} carries exactly one of these.
 */
public enum ErrorKind {
	/**
	 * The input ended where more text was required.
	 */
	END_OF_INPUT,

	/**
	 * A character appeared where the grammar doesn't allow it.
	 * The offending character is available from {@link JsonSyntaxException#offendingChar()}.
	 */
	UNEXPECTED_TOKEN,

	/**
	 * A {@code \}{@code u} escape was not followed by four hex digits.
	 */
	INVALID_UNICODE_ESCAPE,

	/**
	 * A {@code \}{@code u} escape named a surrogate that isn't part of a valid pair.
	 */
	UNEXPECTED_UNICODE_ESCAPE,

	BASE64,
	UTF8,
	PARSE_INT,
	PARSE_FLOAT,

	/**
	 * An integer is too wide for the model type it was declared as.
	 */
	OUT_OF_RANGE,

	/**
	 * NaN and infinite floats have no encoding.
	 */
	NAN,

	/**
	 * Nesting exceeded {@link works.bosk.json4web.codec.Settings#maxDepth()}.
	 */
	DEPTH_LIMIT,

	/**
	 * Reported by a {@link works.bosk.json4web.model.Serializer Serializer}
	 * or {@link works.bosk.json4web.model.Deserializer Deserializer}
	 * when the data doesn't match the model, such as a missing field.
	 */
	CUSTOM,
}
