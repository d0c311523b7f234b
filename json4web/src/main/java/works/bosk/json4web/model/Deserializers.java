package works.bosk.json4web.model;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link Deserializer}s for JDK types.
 *
 * @see Serializers
 */
public final class Deserializers {
	private Deserializers() { }

	public static final Deserializer<Boolean> BOOL = Decoder::decodeBool;

	public static final Deserializer<Byte> I8 = Decoder::decodeI8;
	public static final Deserializer<Short> I16 = Decoder::decodeI16;
	public static final Deserializer<Integer> I32 = Decoder::decodeI32;
	public static final Deserializer<Long> I64 = Decoder::decodeI64;
	public static final Deserializer<BigInteger> I128 = Decoder::decodeI128;

	public static final Deserializer<Byte> U8 = Decoder::decodeU8;
	public static final Deserializer<Short> U16 = Decoder::decodeU16;
	public static final Deserializer<Integer> U32 = Decoder::decodeU32;
	public static final Deserializer<Long> U64 = Decoder::decodeU64;
	public static final Deserializer<BigInteger> U128 = Decoder::decodeU128;

	public static final Deserializer<Float> F32 = Decoder::decodeF32;
	public static final Deserializer<Double> F64 = Decoder::decodeF64;

	public static final Deserializer<Integer> CHAR = Decoder::decodeChar;

	/**
	 * Copies the text, so the result remains valid after the input buffer changes.
	 */
	public static final Deserializer<String> STRING = Decoder::decodeString;

	/**
	 * May return a view of the input buffer.
	 *
	 * @see Decoder#decodeStr()
	 */
	public static final Deserializer<CharSequence> STR = Decoder::decodeStr;

	public static final Deserializer<byte[]> BYTES = Decoder::decodeBytes;
	public static final Deserializer<Void> UNIT = Decoder::decodeUnit;

	/**
	 * Produces whatever the input contains:
	 * {@code null}, {@link Boolean}, {@link Double}, {@link String},
	 * {@link List}, or {@link Map} with {@link String} keys in input order.
	 */
	public static final Deserializer<Object> UNTYPED = in -> in.decodeAny(UntypedVisitor.INSTANCE);

	public static final Deserializer<Void> IGNORED = IgnoredAny.INSTANCE;

	public static <T> Deserializer<Optional<T>> option(Deserializer<? extends T> element) {
		return in -> in.decodeOption(element);
	}

	public static <E> Deserializer<List<E>> list(Deserializer<? extends E> element) {
		return in -> in.decodeSeq(seq -> {
			List<E> result = new ArrayList<>();
			while (seq.hasNext()) {
				E e = seq.next(element);
				result.add(e);
			}
			return result;
		});
	}

	/**
	 * Preserves the input order. If a key appears more than once, the last value wins.
	 */
	public static <K, V> Deserializer<Map<K, V>> map(Deserializer<? extends K> keyDeserializer, Deserializer<? extends V> valueDeserializer) {
		return in -> in.decodeMap(map -> {
			Map<K, V> result = new LinkedHashMap<>();
			while (map.hasNext()) {
				K key = map.nextKey(keyDeserializer);
				V value = map.nextValue(valueDeserializer);
				result.put(key, value);
			}
			return result;
		});
	}

	private enum UntypedVisitor implements Visitor<Object> {
		INSTANCE;

		@Override
		public String expecting() {
			return "any value";
		}

		@Override
		public Object visitNull() {
			return null;
		}

		@Override
		public Object visitBool(boolean value) {
			return value;
		}

		@Override
		public Object visitF64(double value) {
			return value;
		}

		@Override
		public Object visitStr(CharSequence value) {
			return value.toString();
		}

		@Override
		public Object visitSeq(SeqAccess seq) {
			List<Object> result = new ArrayList<>();
			while (seq.hasNext()) {
				result.add(seq.next(UNTYPED));
			}
			return result;
		}

		@Override
		public Object visitMap(MapAccess map) {
			Map<String, Object> result = new LinkedHashMap<>();
			while (map.hasNext()) {
				String key = map.nextKey(STRING);
				result.put(key, map.nextValue(UNTYPED));
			}
			return result;
		}
	}
}
