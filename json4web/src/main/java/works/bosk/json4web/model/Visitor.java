package works.bosk.json4web.model;

import static works.bosk.json4web.exceptions.JsonContentException.invalidType;

/**
 * Receives whatever value {@link Decoder#decodeAny} finds in the input.
 * Each method by default rejects its kind of value,
 * so an implementation need only override the ones it accepts.
 */
public interface Visitor<T> {
	/**
	 * Describes the expected value for error messages, like "a sequence".
	 */
	String expecting();

	default T visitNull() {
		throw invalidType("null", expecting());
	}

	default T visitBool(boolean value) {
		throw invalidType("boolean `" + value + "`", expecting());
	}

	default T visitF64(double value) {
		throw invalidType("floating point `" + value + "`", expecting());
	}

	/**
	 * @param value may be a view into the input buffer; see {@link Decoder#decodeStr()}
	 */
	default T visitStr(CharSequence value) {
		throw invalidType("string \"" + value + "\"", expecting());
	}

	default T visitSeq(SeqAccess seq) {
		throw invalidType("sequence", expecting());
	}

	default T visitMap(MapAccess map) {
		throw invalidType("map", expecting());
	}
}
