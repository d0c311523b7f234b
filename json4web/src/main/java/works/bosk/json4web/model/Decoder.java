package works.bosk.json4web.model;

import java.math.BigInteger;
import java.util.Optional;

/**
 * The decoding side of the traversal contract.
 * A {@link Deserializer} constructs a value by calling one of these methods,
 * indicating which model type it expects next.
 * <p>
 * Unsigned model types are returned in the Java type of the same width;
 * for example, {@code decodeU8} returns {@code (byte)0xFF} for 255.
 */
public interface Decoder {
	/**
	 * For values whose type is decided by the input rather than by the caller.
	 */
	<T> T decodeAny(Visitor<T> visitor);

	boolean decodeBool();

	byte decodeI8();
	short decodeI16();
	int decodeI32();
	long decodeI64();
	BigInteger decodeI128();

	byte decodeU8();
	short decodeU16();
	int decodeU32();
	long decodeU64();
	BigInteger decodeU128();

	float decodeF32();
	double decodeF64();

	/**
	 * @return a Unicode code point
	 */
	int decodeChar();

	/**
	 * The result may be a view of the decoder's input buffer rather than a copy,
	 * in which case it remains valid only as long as that buffer isn't modified.
	 * Use {@link #decodeString()} if you intend to keep the value.
	 */
	CharSequence decodeStr();

	default String decodeString() {
		return decodeStr().toString();
	}

	byte[] decodeBytes();

	/**
	 * @return null
	 */
	Void decodeUnit();

	<T> Optional<T> decodeOption(Deserializer<? extends T> deserializer);

	<T> T decodeSeq(SeqVisitor<T> visitor);

	<T> T decodeMap(MapVisitor<T> visitor);

	/**
	 * Structs share the map representation, with field names as keys.
	 */
	default <T> T decodeStruct(MapVisitor<T> visitor) {
		return decodeMap(visitor);
	}

	<T> T decodeVariant(VariantVisitor<T> visitor);

	/**
	 * Consumes one complete value of any kind and discards it.
	 */
	void decodeIgnored();

	@FunctionalInterface
	interface SeqVisitor<T> {
		T visitSeq(SeqAccess seq);
	}

	@FunctionalInterface
	interface MapVisitor<T> {
		T visitMap(MapAccess map);
	}

	@FunctionalInterface
	interface VariantVisitor<T> {
		T visitVariant(VariantAccess variant);
	}
}
