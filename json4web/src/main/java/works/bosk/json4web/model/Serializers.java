package works.bosk.json4web.model;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import works.bosk.json4web.exceptions.JsonProcessingException;
import works.bosk.json4web.model.Encoder.MapEncoder;
import works.bosk.json4web.model.Encoder.SeqEncoder;

/**
 * {@link Serializer}s for JDK types.
 * <p>
 * The unsigned serializers interpret the bits of their argument as unsigned,
 * so {@code U8} writes {@code (byte)-1} as 255.
 *
 * @see Deserializers
 */
public final class Serializers {
	private Serializers() { }

	public static final Serializer<Boolean> BOOL = (v, out) -> out.encodeBool(v);

	public static final Serializer<Byte> I8 = (v, out) -> out.encodeI8(v);
	public static final Serializer<Short> I16 = (v, out) -> out.encodeI16(v);
	public static final Serializer<Integer> I32 = (v, out) -> out.encodeI32(v);
	public static final Serializer<Long> I64 = (v, out) -> out.encodeI64(v);
	public static final Serializer<BigInteger> I128 = (v, out) -> out.encodeI128(v);

	public static final Serializer<Byte> U8 = (v, out) -> out.encodeU8(v);
	public static final Serializer<Short> U16 = (v, out) -> out.encodeU16(v);
	public static final Serializer<Integer> U32 = (v, out) -> out.encodeU32(v);
	public static final Serializer<Long> U64 = (v, out) -> out.encodeU64(v);
	public static final Serializer<BigInteger> U128 = (v, out) -> out.encodeU128(v);

	public static final Serializer<Float> F32 = (v, out) -> out.encodeF32(v);
	public static final Serializer<Double> F64 = (v, out) -> out.encodeF64(v);

	/**
	 * Code points, not UTF-16 chars.
	 */
	public static final Serializer<Integer> CHAR = (v, out) -> out.encodeChar(v);
	public static final Serializer<CharSequence> STR = (v, out) -> out.encodeStr(v);
	public static final Serializer<byte[]> BYTES = (v, out) -> out.encodeBytes(v);
	public static final Serializer<Void> UNIT = (v, out) -> out.encodeUnit();

	/**
	 * Writes whatever it's given, according to its runtime type:
	 * the inverse of {@link Deserializers#UNTYPED}, plus the other
	 * boxed numbers, {@link BigInteger}, {@code byte[]}, and {@link Optional}.
	 *
	 * @throws JsonProcessingException for any other type
	 */
	public static final Serializer<Object> UNTYPED = Serializers::serializeUntyped;

	public static <T> Serializer<Optional<T>> option(Serializer<? super T> element) {
		return (v, out) -> out.encodeOption(v, element);
	}

	public static <E> Serializer<List<E>> list(Serializer<? super E> element) {
		return (v, out) -> {
			SeqEncoder seq = out.encodeSeq();
			for (E e : v) {
				seq.element(e, element);
			}
			seq.end();
		};
	}

	/**
	 * Entries are written in the map's iteration order.
	 */
	public static <K, V> Serializer<Map<K, V>> map(Serializer<? super K> keySerializer, Serializer<? super V> valueSerializer) {
		return (v, out) -> {
			MapEncoder map = out.encodeMap();
			for (Map.Entry<K, V> entry : v.entrySet()) {
				map.entry(entry.getKey(), keySerializer, entry.getValue(), valueSerializer);
			}
			map.end();
		};
	}

	private static void serializeUntyped(Object value, Encoder out) {
		if (value == null) {
			out.encodeUnit();
		} else if (value instanceof Boolean b) {
			out.encodeBool(b);
		} else if (value instanceof Byte || value instanceof Short || value instanceof Integer) {
			out.encodeI32(((Number) value).intValue());
		} else if (value instanceof Long l) {
			out.encodeI64(l);
		} else if (value instanceof BigInteger i) {
			out.encodeI128(i);
		} else if (value instanceof Float f) {
			out.encodeF32(f);
		} else if (value instanceof Number n) {
			out.encodeF64(n.doubleValue());
		} else if (value instanceof CharSequence s) {
			out.encodeStr(s);
		} else if (value instanceof byte[] bytes) {
			out.encodeBytes(bytes);
		} else if (value instanceof Optional<?> o) {
			out.encodeOption(o, UNTYPED);
		} else if (value instanceof List<?> l) {
			SeqEncoder seq = out.encodeSeq();
			for (Object e : l) {
				seq.element(e, UNTYPED);
			}
			seq.end();
		} else if (value instanceof Map<?, ?> m) {
			MapEncoder map = out.encodeMap();
			for (Map.Entry<?, ?> entry : m.entrySet()) {
				map.entry(entry.getKey(), UNTYPED, entry.getValue(), UNTYPED);
			}
			map.end();
		} else {
			throw JsonProcessingException.custom("No untyped encoding for " + value.getClass());
		}
	}
}
