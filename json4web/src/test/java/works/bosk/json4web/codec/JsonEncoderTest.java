package works.bosk.json4web.codec;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import works.bosk.json4web.exceptions.JsonProcessingException;
import works.bosk.json4web.model.Serializer;
import works.bosk.json4web.model.Serializers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static works.bosk.json4web.exceptions.ErrorKind.CUSTOM;
import static works.bosk.json4web.exceptions.ErrorKind.DEPTH_LIMIT;
import static works.bosk.json4web.exceptions.ErrorKind.NAN;
import static works.bosk.json4web.exceptions.ErrorKind.OUT_OF_RANGE;

class JsonEncoderTest {
	static final Codec CODEC = CodecBuilder.withDefaults().build();

	static <T> String encode(T value, Serializer<? super T> serializer) {
		return CODEC.<T>generatorFor(serializer).generate(value);
	}

	@ParameterizedTest
	@MethodSource("scalarCases")
	<T> void scalars(T value, Serializer<T> serializer, String expected) {
		assertEquals(expected, encode(value, serializer));
	}

	static Stream<Arguments> scalarCases() {
		return Stream.of(
			arguments(true, Serializers.BOOL, "1"),
			arguments(false, Serializers.BOOL, "0"),
			arguments((byte) -128, Serializers.I8, "-128"),
			arguments((short) -1, Serializers.I16, "-1"),
			arguments(Integer.MIN_VALUE, Serializers.I32, "-2147483648"),
			arguments(Long.MIN_VALUE, Serializers.I64, "\"-9223372036854775808\""),
			arguments((byte) -1, Serializers.U8, "255"),
			arguments((short) -1, Serializers.U16, "65535"),
			arguments(-1, Serializers.U32, "4294967295"),
			arguments(-1L, Serializers.U64, "\"18446744073709551615\""),
			arguments(BigInteger.ONE.shiftLeft(127).negate(), Serializers.I128, "\"-170141183460469231731687303715884105728\""),
			arguments(BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE), Serializers.U128, "\"340282366920938463463374607431768211455\""),
			arguments(0.1f, Serializers.F32, "0.1"),
			arguments(0.1, Serializers.F64, "0.1"),
			arguments(-2.5, Serializers.F64, "-2.5"),
			arguments(100.0, Serializers.F64, "100.0"),
			arguments(1.0E10, Serializers.F64, "1.0E10"),
			arguments((int) 'x', Serializers.CHAR, "\"x\""),
			arguments(0x1F60E, Serializers.CHAR, "\"😎\""),
			arguments(new byte[]{(byte) 0xFB, (byte) 0xFF}, Serializers.BYTES, "\"-_8=\""),
			arguments(new byte[0], Serializers.BYTES, "\"\""),
			arguments(null, Serializers.UNIT, "null")
		);
	}

	@ParameterizedTest
	@MethodSource("stringCases")
	void strings(String value, String expected) {
		assertEquals(expected, encode(value, Serializers.STR));
	}

	static Stream<Arguments> stringCases() {
		return Stream.of(
			arguments("", "\"\""),
			arguments("hello", "\"hello\""),
			arguments("\"\\/\b\f\n\r\t", "\"\\\"\\\\\\/\\b\\f\\n\\r\\t\""),
			arguments("a\u0001b\u001f", "\"a\\u0001b\\u001f\""),
			arguments("é😎𝅘𝅥𝅯", "\"é😎𝅘𝅥𝅯\""),
			arguments("\u007f", "\"\u007f\"")
		);
	}

	/**
	 * Our strings are valid standard JSON strings.
	 */
	@ParameterizedTest
	@ValueSource(strings = {"", "plain", "\"\\/\b\f\n\r\t", "\u0000\u0001\u001f", "é😎", "</script>"})
	void strings_readableAsJson(String value) throws IOException {
		String encoded = encode(value, Serializers.STR);
		try (JsonParser parser = new JsonFactory().createParser(encoded)) {
			assertEquals(JsonToken.VALUE_STRING, parser.nextToken());
			assertEquals(value, parser.getText());
		}
	}

	@Test
	void option() {
		assertEquals("null", encode(Optional.empty(), Serializers.option(Serializers.I32)));
		assertEquals("5", encode(Optional.of(5), Serializers.option(Serializers.I32)));
	}

	@Test
	void compounds() {
		assertEquals("[]", encode(List.of(), Serializers.list(Serializers.I32)));
		assertEquals("[1,2,3]", encode(List.of(1, 2, 3), Serializers.list(Serializers.I32)));

		Map<String, List<Integer>> map = new LinkedHashMap<>();
		map.put("b", List.of());
		map.put("a", List.of(1));
		assertEquals("{\"b\":[],\"a\":[1]}", encode(map, Serializers.map(Serializers.STR, Serializers.list(Serializers.I32))));
		assertEquals("{}", encode(Map.of(), Serializers.map(Serializers.STR, Serializers.I32)));
	}

	@Test
	void untyped() {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("n", null);
		map.put("list", Arrays.asList(true, 1, 2L, 1.5, "s", Optional.empty()));
		assertEquals("{\"n\":null,\"list\":[1,1,\"2\",1.5,\"s\",null]}", encode(map, Serializers.UNTYPED));
	}

	@Test
	void untyped_unsupportedClass() {
		JsonProcessingException e = assertThrows(JsonProcessingException.class, () -> encode(new Object(), Serializers.UNTYPED));
		assertEquals(CUSTOM, e.kind());
	}

	@ParameterizedTest
	@ValueSource(floats = {Float.NaN, Float.POSITIVE_INFINITY, Float.NEGATIVE_INFINITY})
	void nonFiniteF32_rejected(float value) {
		JsonProcessingException e = assertThrows(JsonProcessingException.class, () -> encode(value, Serializers.F32));
		assertEquals(NAN, e.kind());
	}

	@ParameterizedTest
	@ValueSource(doubles = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY})
	void nonFiniteF64_rejected(double value) {
		JsonProcessingException e = assertThrows(JsonProcessingException.class, () -> encode(value, Serializers.F64));
		assertEquals(NAN, e.kind());
	}

	@Test
	void wideIntegers_outOfRange() {
		assertEquals(OUT_OF_RANGE, assertThrows(JsonProcessingException.class,
			() -> encode(BigInteger.ONE.shiftLeft(127), Serializers.I128)).kind());
		assertEquals(OUT_OF_RANGE, assertThrows(JsonProcessingException.class,
			() -> encode(BigInteger.ONE.shiftLeft(128), Serializers.U128)).kind());
		assertEquals(OUT_OF_RANGE, assertThrows(JsonProcessingException.class,
			() -> encode(BigInteger.ONE.negate(), Serializers.U128)).kind());
	}

	@Test
	void unclosedCompound_rejected() {
		Serializer<Integer> unclosed = (v, out) -> out.encodeSeq().element(v, Serializers.I32);
		JsonProcessingException e = assertThrows(JsonProcessingException.class, () -> encode(1, unclosed));
		assertEquals(CUSTOM, e.kind());
	}

	@Test
	void invalidCodePoint() {
		JsonProcessingException e = assertThrows(JsonProcessingException.class, () -> encode(0x110000, Serializers.CHAR));
		assertEquals(CUSTOM, e.kind());
	}

	@Test
	void cyclicGraph_hitsDepthLimit() {
		List<Object> cycle = new ArrayList<>();
		cycle.add(cycle);
		JsonProcessingException e = assertThrows(JsonProcessingException.class, () -> encode(cycle, Serializers.UNTYPED));
		assertEquals(DEPTH_LIMIT, e.kind());
	}

	@Test
	void depthLimit_countsVariantWrappers() {
		Codec shallow = CodecBuilder.withDefaults().withMaxDepth(1).build();
		Generator<Integer> newtype = shallow.generatorFor((v, out) -> out.encodeNewtypeVariant("N", v, Serializers.I32));
		assertEquals("{\"N\":1}", newtype.generate(1));

		Generator<Integer> tuple = shallow.generatorFor((v, out) -> {
			var seq = out.encodeTupleVariant("T");
			seq.element(v, Serializers.I32);
			seq.end();
		});
		assertEquals(DEPTH_LIMIT, assertThrows(JsonProcessingException.class, () -> tuple.generate(1)).kind());
	}

	@Test
	void sinkFailure_propagates() {
		Writer broken = new Writer() {
			@Override
			public void write(char[] cbuf, int off, int len) throws IOException {
				throw new IOException("disk full");
			}

			@Override
			public void flush() { }

			@Override
			public void close() { }
		};
		UncheckedIOException e = assertThrows(UncheckedIOException.class,
			() -> CODEC.generatorFor(Serializers.I32).generate(broken, 1));
		assertEquals("disk full", e.getCause().getMessage());
	}
}
