package works.bosk.json4web.model;

import java.math.BigInteger;
import java.util.Optional;

/**
 * The encoding side of the traversal contract.
 * A {@link Serializer} describes a value by calling one of these methods.
 * <p>
 * Unsigned model types are passed in the Java type of the same width,
 * and their bits are interpreted as unsigned:
 * {@code encodeU8((byte)0xFF)} encodes 255.
 */
public interface Encoder {
	void encodeBool(boolean value);

	void encodeI8(byte value);
	void encodeI16(short value);
	void encodeI32(int value);
	void encodeI64(long value);

	/**
	 * @param value must be in the range of a signed 128-bit integer
	 */
	void encodeI128(BigInteger value);

	void encodeU8(byte value);
	void encodeU16(short value);
	void encodeU32(int value);
	void encodeU64(long value);

	/**
	 * @param value must be in the range of an unsigned 128-bit integer
	 */
	void encodeU128(BigInteger value);

	void encodeF32(float value);
	void encodeF64(double value);

	void encodeChar(int codePoint);
	void encodeStr(CharSequence value);
	void encodeBytes(byte[] value);

	void encodeUnit();

	/**
	 * The absent case of an optional value.
	 */
	void encodeNone();

	/**
	 * The present case of an optional value.
	 */
	<T> void encodeSome(T value, Serializer<? super T> serializer);

	default <T> void encodeOption(Optional<T> value, Serializer<? super T> serializer) {
		if (value.isPresent()) {
			encodeSome(value.get(), serializer);
		} else {
			encodeNone();
		}
	}

	void encodeUnitVariant(String tag);
	<T> void encodeNewtypeVariant(String tag, T value, Serializer<? super T> serializer);

	/**
	 * The length of the sequence need not be known in advance.
	 */
	SeqEncoder encodeSeq();

	SeqEncoder encodeTupleVariant(String tag);

	MapEncoder encodeMap();

	StructEncoder encodeStruct();

	StructEncoder encodeStructVariant(String tag);

	interface SeqEncoder {
		<T> void element(T value, Serializer<? super T> serializer);
		void end();
	}

	/**
	 * Each entry is a call to {@link #key} followed by a call to {@link #value}.
	 */
	interface MapEncoder {
		<K> void key(K key, Serializer<? super K> serializer);
		<V> void value(V value, Serializer<? super V> serializer);

		default <K, V> void entry(K key, Serializer<? super K> keySerializer, V value, Serializer<? super V> valueSerializer) {
			key(key, keySerializer);
			value(value, valueSerializer);
		}

		void end();
	}

	interface StructEncoder {
		<V> void field(String name, V value, Serializer<? super V> serializer);
		void end();
	}
}
