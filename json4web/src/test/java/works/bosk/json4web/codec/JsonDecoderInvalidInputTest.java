package works.bosk.json4web.codec;

import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import works.bosk.json4web.TestUtils.Sample;
import works.bosk.json4web.exceptions.ErrorKind;
import works.bosk.json4web.exceptions.JsonContentException;
import works.bosk.json4web.exceptions.JsonFormatException;
import works.bosk.json4web.exceptions.JsonSyntaxException;
import works.bosk.json4web.model.Deserializer;
import works.bosk.json4web.model.Deserializers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static works.bosk.json4web.exceptions.ErrorKind.BASE64;
import static works.bosk.json4web.exceptions.ErrorKind.CUSTOM;
import static works.bosk.json4web.exceptions.ErrorKind.DEPTH_LIMIT;
import static works.bosk.json4web.exceptions.ErrorKind.END_OF_INPUT;
import static works.bosk.json4web.exceptions.ErrorKind.INVALID_UNICODE_ESCAPE;
import static works.bosk.json4web.exceptions.ErrorKind.PARSE_FLOAT;
import static works.bosk.json4web.exceptions.ErrorKind.PARSE_INT;
import static works.bosk.json4web.exceptions.ErrorKind.UNEXPECTED_UNICODE_ESCAPE;
import static works.bosk.json4web.exceptions.ErrorKind.UTF8;

class JsonDecoderInvalidInputTest {
	static final Codec CODEC = CodecBuilder.withDefaults().build();

	@ParameterizedTest
	@MethodSource("unexpectedTokenCases")
	void unexpectedToken(String text, Deserializer<?> deserializer, char offendingChar) {
		JsonSyntaxException e = assertThrows(JsonSyntaxException.class, () -> CODEC.parserFor(deserializer).parse(text));
		assertEquals(ErrorKind.UNEXPECTED_TOKEN, e.kind());
		assertEquals(OptionalInt.of(offendingChar), e.offendingChar());
	}

	static Stream<Arguments> unexpectedTokenCases() {
		return Stream.of(
			arguments("2", Deserializers.BOOL, '2'),
			arguments("trux", Deserializers.BOOL, 'x'),
			arguments("10", Deserializers.BOOL, '0'),
			arguments("abc", Deserializers.I32, 'a'),
			arguments("+1", Deserializers.I32, '+'),
			arguments("-1", Deserializers.U32, '-'),
			arguments("1234512345", Deserializers.I64, '1'),
			arguments("nulx", Deserializers.F64, 'x'),
			arguments("\"1.5\"", Deserializers.F64, '"'),
			arguments("hello", Deserializers.STRING, 'h'),
			arguments("\"\\x\"", Deserializers.STRING, 'x'),
			arguments("\"\"", Deserializers.CHAR, '"'),
			arguments("nil", Deserializers.UNIT, 'i'),
			arguments("0", Deserializers.UNIT, '0'),
			arguments("{}", Deserializers.list(Deserializers.I32), '{'),
			arguments("[1 2]", Deserializers.list(Deserializers.I32), '2'),
			arguments("[1,]", Deserializers.list(Deserializers.I32), ']'),
			arguments("[,1]", Deserializers.list(Deserializers.I32), ','),
			arguments("{\"int\":1,}", Sample.DESERIALIZER, '}'),
			arguments("{\"int\" 1}", Sample.DESERIALIZER, '1'),
			arguments("{int:1}", Sample.DESERIALIZER, 'i'),
			arguments("x", Deserializers.UNTYPED, 'x'),
			arguments("]", Deserializers.IGNORED, ']'),
			arguments("1 2", Deserializers.I32, '2'),
			arguments("[]]", Deserializers.list(Deserializers.I32), ']'),
			arguments("\"a\"b", Deserializers.STRING, 'b')
		);
	}

	@ParameterizedTest
	@MethodSource("errorKindCases")
	void errorKind(String text, Deserializer<?> deserializer, ErrorKind expected) {
		JsonFormatException e = assertThrows(JsonFormatException.class, () -> CODEC.parserFor(deserializer).parse(text));
		assertEquals(expected, e.kind());
	}

	static Stream<Arguments> errorKindCases() {
		return Stream.of(
			arguments("", Deserializers.I32, END_OF_INPUT),
			arguments("   ", Deserializers.UNTYPED, END_OF_INPUT),
			arguments("tru", Deserializers.BOOL, END_OF_INPUT),
			arguments("nul", Deserializers.F32, END_OF_INPUT),
			arguments("\"abc", Deserializers.STRING, END_OF_INPUT),
			arguments("\"abc\\", Deserializers.STRING, END_OF_INPUT),
			arguments("\"\\u12\"", Deserializers.STRING, END_OF_INPUT),
			arguments("[1,2", Deserializers.list(Deserializers.I32), END_OF_INPUT),
			arguments("{\"int\":1", Sample.DESERIALIZER, END_OF_INPUT),
			arguments("{\"int\":", Sample.DESERIALIZER, END_OF_INPUT),

			arguments("\"\\u12G4\"", Deserializers.STRING, INVALID_UNICODE_ESCAPE),
			arguments("\"\\uD83D\"", Deserializers.STRING, UNEXPECTED_UNICODE_ESCAPE),
			arguments("\"\\uDE0E\"", Deserializers.STRING, UNEXPECTED_UNICODE_ESCAPE),
			arguments("\"\\uD83D\\u0041\"", Deserializers.STRING, UNEXPECTED_UNICODE_ESCAPE),
			arguments("\"\\uD83Dx\"", Deserializers.STRING, UNEXPECTED_UNICODE_ESCAPE),

			arguments("128", Deserializers.I8, PARSE_INT),
			arguments("256", Deserializers.U8, PARSE_INT),
			arguments("65536", Deserializers.U16, PARSE_INT),
			arguments("2147483648", Deserializers.I32, PARSE_INT),
			arguments("4294967296", Deserializers.U32, PARSE_INT),
			arguments("1-2", Deserializers.I32, PARSE_INT),
			arguments("\"9223372036854775808\"", Deserializers.I64, PARSE_INT),
			arguments("\"-1\"", Deserializers.U64, PARSE_INT),
			arguments("\"-0\"", Deserializers.U128, PARSE_INT),
			arguments("\"\u0661\u0662\u0663\"", Deserializers.I64, PARSE_INT),
			arguments("\"\u0967\u0968\"", Deserializers.U128, PARSE_INT),
			arguments("\"170141183460469231731687303715884105728\"", Deserializers.I128, PARSE_INT),
			arguments("\"340282366920938463463374607431768211456\"", Deserializers.U128, PARSE_INT),
			arguments("\"12a\"", Deserializers.I64, PARSE_INT),
			arguments("\"\"", Deserializers.I64, PARSE_INT),

			arguments("1.2.3", Deserializers.F64, PARSE_FLOAT),
			arguments("-", Deserializers.F64, PARSE_FLOAT),
			arguments("1e", Deserializers.F32, PARSE_FLOAT),

			arguments("\"!!!!\"", Deserializers.BYTES, BASE64),
			arguments("\"+/8=\"", Deserializers.BYTES, BASE64),

			arguments("{\"seq\":[]}", Sample.DESERIALIZER, CUSTOM),
			arguments("{\"int\":1,\"int\":2,\"seq\":[]}", Sample.DESERIALIZER, CUSTOM)
		);
	}

	@Test
	void errorClasses() {
		assertInstanceOf(JsonSyntaxException.class, assertThrows(JsonFormatException.class, () -> CODEC.parserFor(Deserializers.I32).parse("x")));
		assertInstanceOf(JsonContentException.class, assertThrows(JsonFormatException.class, () -> CODEC.parserFor(Deserializers.I32).parse("99999999999")));
	}

	@Test
	void invalidUtf8() {
		byte[] bytes = {'"', (byte) 0xC3, '(', '"'};
		JsonContentException e = assertThrows(JsonContentException.class, () -> CODEC.parserFor(Deserializers.STRING).parse(bytes));
		assertEquals(UTF8, e.kind());
	}

	@Test
	void depthLimit_default() {
		int tooDeep = Settings.DEFAULT.maxDepth() + 1;
		String text = "[".repeat(tooDeep) + "]".repeat(tooDeep);
		JsonSyntaxException e = assertThrows(JsonSyntaxException.class, () -> CODEC.parserFor(Deserializers.UNTYPED).parse(text));
		assertEquals(DEPTH_LIMIT, e.kind());
	}

	@Test
	void depthLimit_doesNotOverflowStack() {
		String text = "[".repeat(100_000);
		JsonSyntaxException e = assertThrows(JsonSyntaxException.class, () -> CODEC.parserFor(Deserializers.IGNORED).parse(text));
		assertEquals(DEPTH_LIMIT, e.kind());
	}

	@Test
	void depthLimit_configured() {
		Codec shallow = CodecBuilder.withDefaults().withMaxDepth(2).build();
		Deserializer<Object> untyped = Deserializers.UNTYPED;
		assertEquals(List.of(List.of(1.0)), shallow.parserFor(untyped).parse("[[1]]"));
		JsonSyntaxException e = assertThrows(JsonSyntaxException.class, () -> shallow.parserFor(untyped).parse("[[[1]]]"));
		assertEquals(DEPTH_LIMIT, e.kind());
		e = assertThrows(JsonSyntaxException.class, () -> shallow.parserFor(untyped).parse("{\"a\":{\"b\":{}}}"));
		assertEquals(DEPTH_LIMIT, e.kind());
	}
}
