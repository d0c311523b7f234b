package works.bosk.json4web.codec;

import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import works.bosk.json4web.TestUtils.E;
import works.bosk.json4web.exceptions.ErrorKind;
import works.bosk.json4web.exceptions.JsonContentException;
import works.bosk.json4web.exceptions.JsonFormatException;
import works.bosk.json4web.exceptions.JsonSyntaxException;
import works.bosk.json4web.model.Deserializers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static works.bosk.json4web.exceptions.ErrorKind.CUSTOM;
import static works.bosk.json4web.exceptions.ErrorKind.END_OF_INPUT;
import static works.bosk.json4web.exceptions.ErrorKind.UNEXPECTED_TOKEN;

class VariantTest {
	static final Codec CODEC = CodecBuilder.withDefaults().build();
	static final Parser<E> PARSER = CODEC.parserFor(E.DESERIALIZER);
	static final Generator<E> GENERATOR = CODEC.generatorFor(E.SERIALIZER);

	@ParameterizedTest
	@MethodSource("shapes")
	void decode(E expected, String text) {
		assertEquals(expected, PARSER.parse(text));
	}

	@ParameterizedTest
	@MethodSource("shapes")
	void encode(E value, String expected) {
		assertEquals(expected, GENERATOR.generate(value));
	}

	static Stream<Arguments> shapes() {
		return Stream.of(
			arguments(new E.Unit(), "\"Unit\""),
			arguments(new E.Newtype(1), "{\"Newtype\":1}"),
			arguments(new E.Tuple(1, 2), "{\"Tuple\":[1,2]}"),
			arguments(new E.Struct(1), "{\"Struct\":{\"a\":1}}")
		);
	}

	@ParameterizedTest
	@ValueSource(strings = {
		" \"Unit\" ",
		"{ \"Newtype\" : 1 }",
		"{\n\t\"Tuple\": [ 1 , 2 ]\n}",
		"{\"Struct\":{ \"a\" : 1 }}",
	})
	void whitespace(String text) {
		E decoded = PARSER.parse(text);
		assertEquals(text.replaceAll("\\s", ""), GENERATOR.generate(decoded));
	}

	@Test
	void unitWithPayload_rejected() {
		JsonSyntaxException e = assertThrows(JsonSyntaxException.class, () -> PARSER.parse("{\"Unit\":null}"));
		assertEquals(UNEXPECTED_TOKEN, e.kind());
		assertEquals(OptionalInt.of('n'), e.offendingChar());
	}

	@Test
	void unitWithMissingPayload_rejected() {
		JsonSyntaxException e = assertThrows(JsonSyntaxException.class, () -> PARSER.parse("{\"Unit\":}"));
		assertEquals(UNEXPECTED_TOKEN, e.kind());
		assertEquals(OptionalInt.of('}'), e.offendingChar());
	}

	@ParameterizedTest
	@ValueSource(strings = {"\"Newtype\"", "\"Tuple\"", "\"Struct\""})
	void bareTagForPayloadVariant_rejected(String text) {
		JsonContentException e = assertThrows(JsonContentException.class, () -> PARSER.parse(text));
		assertEquals(CUSTOM, e.kind());
	}

	@Test
	void unknownTag_rejected() {
		JsonContentException e = assertThrows(JsonContentException.class, () -> PARSER.parse("{\"Bogus\":1}"));
		assertEquals(CUSTOM, e.kind());
	}

	@Test
	void wrongTupleLength_rejected() {
		JsonContentException e = assertThrows(JsonContentException.class, () -> PARSER.parse("{\"Tuple\":[1,2,3]}"));
		assertEquals(CUSTOM, e.kind());
	}

	@ParameterizedTest
	@MethodSource("malformed")
	void malformed(String text, ErrorKind expectedKind) {
		JsonFormatException e = assertThrows(JsonFormatException.class, () -> PARSER.parse(text));
		assertEquals(expectedKind, e.kind());
	}

	static Stream<Arguments> malformed() {
		return Stream.of(
			arguments("{\"Newtype\":1,\"Tuple\":[1,2]}", UNEXPECTED_TOKEN),
			arguments("{\"Newtype\" 1}", UNEXPECTED_TOKEN),
			arguments("{Newtype:1}", UNEXPECTED_TOKEN),
			arguments("[\"Unit\"]", UNEXPECTED_TOKEN),
			arguments("Unit", UNEXPECTED_TOKEN),
			arguments("{\"Newtype\":1", END_OF_INPUT),
			arguments("{\"Tuple\":[1,2]", END_OF_INPUT),
			arguments("{", END_OF_INPUT),
			arguments("", END_OF_INPUT)
		);
	}

	@Test
	void nestedInCompound() {
		assertEquals(
			List.of(new E.Unit(), new E.Struct(3)),
			CODEC.parserFor(Deserializers.list(E.DESERIALIZER)).parse("[\"Unit\",{\"Struct\":{\"a\":3}}]"));
	}
}
