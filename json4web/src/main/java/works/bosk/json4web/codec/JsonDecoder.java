package works.bosk.json4web.codec;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.util.Optional;
import java.util.function.IntPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.json4web.codec.io.Base64Url;
import works.bosk.json4web.codec.io.NumberLiterals;
import works.bosk.json4web.codec.io.TextSlice;
import works.bosk.json4web.codec.io.Util;
import works.bosk.json4web.exceptions.JsonContentException;
import works.bosk.json4web.exceptions.JsonSyntaxException;
import works.bosk.json4web.model.Decoder;
import works.bosk.json4web.model.Deserializer;
import works.bosk.json4web.model.IgnoredAny;
import works.bosk.json4web.model.Visitor;

import static java.lang.Math.min;
import static java.nio.charset.CodingErrorAction.REPORT;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static works.bosk.json4web.codec.Token.END_ARRAY;
import static works.bosk.json4web.codec.Token.END_OBJECT;
import static works.bosk.json4web.codec.Token.NULL;
import static works.bosk.json4web.codec.Token.START_ARRAY;
import static works.bosk.json4web.codec.Token.START_OBJECT;
import static works.bosk.json4web.exceptions.JsonSyntaxException.endOfInput;
import static works.bosk.json4web.exceptions.JsonSyntaxException.invalidUnicodeEscape;
import static works.bosk.json4web.exceptions.JsonSyntaxException.unexpectedToken;
import static works.bosk.json4web.exceptions.JsonSyntaxException.unexpectedUnicodeEscape;

/**
 * Decodes a complete in-memory text, left to right, on behalf of a {@link Deserializer}.
 * <p>
 * The only mutable state is the cursor {@link #pos} into {@link #chars},
 * plus the current nesting depth.
 * Each method skips leading whitespace, consumes exactly the characters of the value it decodes,
 * and leaves any following separator for the enclosing compound to deal with.
 * <p>
 * Strings containing no escapes are returned as {@link TextSlice views} of the input
 * rather than copies.
 * <p>
 * Not thread-safe. Create one per top-level decode.
 */
public final class JsonDecoder implements Decoder {
	private final char[] chars;
	private int pos = 0;
	private int depth = 0;
	private final Settings settings;
	private final MapKeyDecoder keyDecoder;

	public JsonDecoder(char[] chars, Settings settings) {
		this.chars = requireNonNull(chars);
		this.settings = requireNonNull(settings);
		this.keyDecoder = new MapKeyDecoder(this);
	}

	public static JsonDecoder forString(String text, Settings settings) {
		return new JsonDecoder(text.toCharArray(), settings);
	}

	/**
	 * @throws JsonContentException if {@code utf8Bytes} is not valid UTF-8
	 */
	public static JsonDecoder forUtf8(byte[] utf8Bytes, Settings settings) {
		CharsetDecoder utf8 = UTF_8.newDecoder()
			.onMalformedInput(REPORT)
			.onUnmappableCharacter(REPORT);
		CharBuffer decoded;
		try {
			decoded = utf8.decode(ByteBuffer.wrap(utf8Bytes));
		} catch (CharacterCodingException e) {
			throw JsonContentException.utf8(e);
		}
		char[] chars = new char[decoded.remaining()];
		decoded.get(chars);
		return new JsonDecoder(chars, settings);
	}

	/**
	 * Decodes the whole input as a single value.
	 */
	public <T> T decodeDocument(Deserializer<T> deserializer) {
		LOGGER.debug("Decoding {} chars", chars.length);
		T result = deserializer.deserialize(this);
		if (!settings.allowTrailingCharacters()) {
			skipWhitespace();
			if (pos < chars.length) {
				throw unexpectedToken(chars[pos], "end of input");
			}
		}
		return result;
	}

	@Override
	public <T> T decodeAny(Visitor<T> visitor) {
		skipWhitespace();
		logEntry("decodeAny");
		int c = peekRawChar();
		return switch (Token.startingWith(c)) {
			case END_TEXT -> throw endOfInput();
			case NULL -> {
				decodeUnit();
				yield visitor.visitNull();
			}
			case TRUE, FALSE -> visitor.visitBool(decodeBool());
			case STRING -> visitor.visitStr(parseString());
			case NUMBER -> visitor.visitF64(decodeF64());
			case START_ARRAY -> decodeSeq(visitor::visitSeq);
			case START_OBJECT -> decodeMap(visitor::visitMap);
			default -> throw unexpectedToken((char) c, "a value");
		};
	}

	@Override
	public boolean decodeBool() {
		skipWhitespace();
		char c = peekChar();
		return switch (c) {
			case '1' -> {
				pos++;
				yield true;
			}
			case '0' -> {
				pos++;
				yield false;
			}
			case 't' -> {
				expectLiteral(Token.TRUE.fixedRepresentation());
				yield true;
			}
			case 'f' -> {
				expectLiteral(Token.FALSE.fixedRepresentation());
				yield false;
			}
			default -> throw unexpectedToken(c, "a boolean");
		};
	}

	@Override
	public byte decodeI8() {
		return NumberLiterals.parseI8(scanNumber(Util::isSignedIntegerChar));
	}

	@Override
	public short decodeI16() {
		return NumberLiterals.parseI16(scanNumber(Util::isSignedIntegerChar));
	}

	@Override
	public int decodeI32() {
		return NumberLiterals.parseI32(scanNumber(Util::isSignedIntegerChar));
	}

	@Override
	public long decodeI64() {
		return NumberLiterals.parseI64(decodeStr());
	}

	@Override
	public BigInteger decodeI128() {
		return NumberLiterals.parseI128(decodeStr());
	}

	@Override
	public byte decodeU8() {
		return NumberLiterals.parseU8(scanNumber(Util::isDigit));
	}

	@Override
	public short decodeU16() {
		return NumberLiterals.parseU16(scanNumber(Util::isDigit));
	}

	@Override
	public int decodeU32() {
		return NumberLiterals.parseU32(scanNumber(Util::isDigit));
	}

	@Override
	public long decodeU64() {
		return NumberLiterals.parseU64(decodeStr());
	}

	@Override
	public BigInteger decodeU128() {
		return NumberLiterals.parseU128(decodeStr());
	}

	@Override
	public float decodeF32() {
		CharSequence literal = scanFloat();
		return (literal == null)? Float.NaN : NumberLiterals.parseF32(literal);
	}

	@Override
	public double decodeF64() {
		CharSequence literal = scanFloat();
		return (literal == null)? Double.NaN : NumberLiterals.parseF64(literal);
	}

	@Override
	public int decodeChar() {
		CharSequence s = decodeStr();
		if (s.length() == 0) {
			throw unexpectedToken('"', "a character");
		}
		return Character.codePointAt(s, 0);
	}

	@Override
	public CharSequence decodeStr() {
		skipWhitespace();
		return parseString();
	}

	@Override
	public byte[] decodeBytes() {
		return Base64Url.decode(decodeStr());
	}

	@Override
	public Void decodeUnit() {
		skipWhitespace();
		char c = peekChar();
		if (c != 'n') {
			throw unexpectedToken(c, "null");
		}
		expectLiteral(NULL.fixedRepresentation());
		return null;
	}

	@Override
	public <T> Optional<T> decodeOption(Deserializer<? extends T> deserializer) {
		skipWhitespace();
		if (peekChar() == 'n') {
			expectLiteral(NULL.fixedRepresentation());
			return Optional.empty();
		} else {
			return Optional.ofNullable(deserializer.deserialize(this));
		}
	}

	@Override
	public <T> T decodeSeq(SeqVisitor<T> visitor) {
		skipWhitespace();
		logEntry("decodeSeq");
		expect(START_ARRAY.fixedChar());
		enter();
		T result = visitor.visitSeq(new ElementCursor(this, END_ARRAY.fixedChar()));
		skipWhitespace();
		expect(END_ARRAY.fixedChar());
		exit();
		return result;
	}

	@Override
	public <T> T decodeMap(MapVisitor<T> visitor) {
		skipWhitespace();
		logEntry("decodeMap");
		expect(START_OBJECT.fixedChar());
		enter();
		T result = visitor.visitMap(new ElementCursor(this, END_OBJECT.fixedChar()));
		skipWhitespace();
		expect(END_OBJECT.fixedChar());
		exit();
		return result;
	}

	@Override
	public <T> T decodeVariant(VariantVisitor<T> visitor) {
		skipWhitespace();
		logEntry("decodeVariant");
		char c = peekChar();
		if (c == '"') {
			return visitor.visitVariant(new VariantCursor.BareTag(parseString().toString()));
		} else if (c == START_OBJECT.fixedChar()) {
			pos++;
			enter();
			String tag = decodeString();
			skipWhitespace();
			expect(':');
			T result = visitor.visitVariant(new VariantCursor.Tagged(this, tag));
			skipWhitespace();
			expect(END_OBJECT.fixedChar());
			exit();
			return result;
		} else {
			throw unexpectedToken(c, "a variant");
		}
	}

	@Override
	public void decodeIgnored() {
		decodeAny(IgnoredAny.INSTANCE);
	}

	/**
	 * Decodes map keys, which are always strings in the text.
	 */
	Decoder keyDecoder() {
		return keyDecoder;
	}

	// Cursor primitives for the compound helpers

	void skipWhitespace() {
		while (Util.fast_isWhitespace(peekRawChar())) {
			pos++;
		}
	}

	/**
	 * @return NOT a code point! Either a UTF-16 code unit or -1 at end of input.
	 */
	private int peekRawChar() {
		if (pos >= chars.length) {
			return -1;
		} else {
			return chars[pos];
		}
	}

	/**
	 * @throws JsonSyntaxException at end of input
	 */
	char peekChar() {
		if (pos >= chars.length) {
			throw endOfInput();
		}
		return chars[pos];
	}

	/**
	 * Consumes the given character, which must be next in the input.
	 */
	void expect(char expected) {
		if (pos >= chars.length) {
			throw endOfInput(String.valueOf(expected));
		}
		char actual = chars[pos];
		if (actual != expected) {
			throw unexpectedToken(actual, "'" + expected + "'");
		}
		pos++;
	}

	private void expectLiteral(CharSequence expectedCharacters) {
		for (int i = 0; i < expectedCharacters.length(); i++) {
			if (pos + i >= chars.length) {
				throw endOfInput(expectedCharacters);
			}
			char actual = chars[pos + i];
			if (actual != expectedCharacters.charAt(i)) {
				throw unexpectedToken(actual, "'" + expectedCharacters + "'");
			}
		}
		pos += expectedCharacters.length();
	}

	private void enter() {
		if (++depth > settings.maxDepth()) {
			throw JsonSyntaxException.depthLimit(settings.maxDepth());
		}
	}

	private void exit() {
		assert depth > 0;
		--depth;
	}

	// Lexical classes

	/**
	 * Consumes the maximal run of characters matching {@code numberChar}.
	 */
	private CharSequence scanNumber(IntPredicate numberChar) {
		skipWhitespace();
		char first = peekChar();
		int start = pos;
		while (pos < chars.length && numberChar.test(chars[pos])) {
			pos++;
		}
		if (pos == start) {
			throw unexpectedToken(first, "a number");
		}
		return new TextSlice(chars, start, pos);
	}

	/**
	 * @return null if the input contains {@code null}, which stands for NaN.
	 */
	private CharSequence scanFloat() {
		skipWhitespace();
		if (peekChar() == 'n') {
			expectLiteral(NULL.fixedRepresentation());
			return null;
		} else {
			return scanNumber(Util::isFloatChar);
		}
	}

	/**
	 * Parses a quoted string starting at the current position.
	 *
	 * @return a {@link TextSlice} of the input if the string has no escapes;
	 * otherwise a newly allocated {@link String}.
	 */
	private CharSequence parseString() {
		expect('"');
		int start = pos;
		while (pos < chars.length) {
			char c = chars[pos];
			if (c == '"') {
				TextSlice result = new TextSlice(chars, start, pos);
				pos++; // Skip closing quote
				return result;
			} else if (c == '\\') {
				// Found an escape. The borrowed fast path doesn't work.
				return parseEscapedString(start);
			}
			pos++;
		}
		throw endOfInput("\"");
	}

	/**
	 * Continues parsing a string after the first escape has been found at {@link #pos}.
	 *
	 * @param start the position of the first character of the string's contents
	 */
	private String parseEscapedString(int start) {
		StringBuilder sb = new StringBuilder(pos - start + 16);
		sb.append(chars, start, pos - start);
		while (pos < chars.length) {
			char c = chars[pos++];
			if (c == '"') {
				return sb.toString();
			} else if (c == '\\') {
				parseEscape(sb);
			} else {
				sb.append(c);
			}
		}
		throw endOfInput("\"");
	}

	private void parseEscape(StringBuilder sb) {
		if (pos >= chars.length) {
			throw endOfInput();
		}
		char esc = chars[pos++];
		switch (esc) {
			case '"', '\\', '/' -> sb.append(esc);
			case 'b' -> sb.append('\b');
			case 'f' -> sb.append('\f');
			case 'n' -> sb.append('\n');
			case 'r' -> sb.append('\r');
			case 't' -> sb.append('\t');
			case 'u' -> sb.appendCodePoint(parseUnicodeEscape());
			default -> throw unexpectedToken(esc, "an escape character");
		}
	}

	/**
	 * Called after {@code \}{@code u} has been consumed.
	 * A high surrogate must be immediately followed by an escaped low surrogate,
	 * and the two are combined into one code point.
	 */
	private int parseUnicodeEscape() {
		char first = parseHex4();
		if (!Character.isSurrogate(first)) {
			return first;
		}
		if (Character.isHighSurrogate(first)
			&& pos + 1 < chars.length
			&& chars[pos] == '\\'
			&& chars[pos + 1] == 'u'
		) {
			pos += 2;
			char second = parseHex4();
			if (Character.isLowSurrogate(second)) {
				return Character.toCodePoint(first, second);
			}
		}
		throw unexpectedUnicodeEscape(first);
	}

	private char parseHex4() {
		if (pos + 4 > chars.length) {
			throw endOfInput();
		}
		int value = 0;
		for (int i = 0; i < 4; i++) {
			int digit = Util.hexValue(chars[pos + i]);
			if (digit < 0) {
				throw invalidUnicodeEscape(new String(chars, pos, 4));
			}
			value = (value << 4) | digit;
		}
		pos += 4;
		return (char) value;
	}

	/**
	 * On a best-effort basis, return the upcoming characters in the input.
	 */
	private String previewString(int requestedLength) {
		int actualLength = min(requestedLength, chars.length - pos);
		return new String(chars, pos, actualLength);
	}

	private void logEntry(String methodName) {
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("{} @ {} depth {}: |{}|", methodName, pos, depth, previewString(20));
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonDecoder.class);
}
