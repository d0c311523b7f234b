package works.bosk.json4web.codec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.json4web.codec.io.Base64Url;
import works.bosk.json4web.codec.io.FloatFormatting;
import works.bosk.json4web.codec.io.NumberLiterals;
import works.bosk.json4web.exceptions.JsonProcessingException;
import works.bosk.json4web.model.Encoder;
import works.bosk.json4web.model.Serializer;

import static java.util.Objects.requireNonNull;
import static works.bosk.json4web.codec.Token.END_ARRAY;
import static works.bosk.json4web.codec.Token.END_OBJECT;
import static works.bosk.json4web.codec.Token.NULL;
import static works.bosk.json4web.codec.Token.START_ARRAY;
import static works.bosk.json4web.codec.Token.START_OBJECT;

/**
 * Appends the text for each value described to it by a {@link Serializer}.
 * <p>
 * Output is written as soon as it's known, and never revisited.
 * If an exception is thrown partway through a value,
 * the output will contain an incomplete document, which the caller should discard.
 * <p>
 * Not thread-safe. Create one per top-level encode.
 */
public final class JsonEncoder implements Encoder {
	private final Appendable out;
	private final Settings settings;
	private final MapKeyEncoder keyEncoder;
	private int depth = 0;

	public JsonEncoder(Appendable out, Settings settings) {
		this.out = requireNonNull(out);
		this.settings = requireNonNull(settings);
		this.keyEncoder = new MapKeyEncoder(this);
	}

	public <T> void encodeDocument(T value, Serializer<? super T> serializer) {
		LOGGER.debug("Encoding value of {}", (value == null)? "null" : value.getClass());
		serializer.serialize(value, this);
		if (depth != 0) {
			throw JsonProcessingException.custom("Serializer left " + depth + " compound(s) open");
		}
	}

	@Override
	public void encodeBool(boolean value) {
		append(value? '1' : '0');
	}

	@Override
	public void encodeI8(byte value) {
		append(Byte.toString(value));
	}

	@Override
	public void encodeI16(short value) {
		append(Short.toString(value));
	}

	@Override
	public void encodeI32(int value) {
		append(Integer.toString(value));
	}

	/**
	 * Wide integers are quoted, because many consumers can't represent
	 * integers beyond 2^53 as numbers.
	 */
	@Override
	public void encodeI64(long value) {
		appendQuoted(Long.toString(value));
	}

	@Override
	public void encodeI128(BigInteger value) {
		if (!NumberLiterals.isI128(value)) {
			throw JsonProcessingException.outOfRange(value, "i128");
		}
		appendQuoted(value.toString());
	}

	@Override
	public void encodeU8(byte value) {
		append(Integer.toString(Byte.toUnsignedInt(value)));
	}

	@Override
	public void encodeU16(short value) {
		append(Integer.toString(Short.toUnsignedInt(value)));
	}

	@Override
	public void encodeU32(int value) {
		append(Integer.toUnsignedString(value));
	}

	@Override
	public void encodeU64(long value) {
		appendQuoted(Long.toUnsignedString(value));
	}

	@Override
	public void encodeU128(BigInteger value) {
		if (!NumberLiterals.isU128(value)) {
			throw JsonProcessingException.outOfRange(value, "u128");
		}
		appendQuoted(value.toString());
	}

	@Override
	public void encodeF32(float value) {
		if (!Float.isFinite(value)) {
			throw JsonProcessingException.notANumber(value);
		}
		append(FloatFormatting.format(value));
	}

	@Override
	public void encodeF64(double value) {
		if (!Double.isFinite(value)) {
			throw JsonProcessingException.notANumber(value);
		}
		append(FloatFormatting.format(value));
	}

	@Override
	public void encodeChar(int codePoint) {
		if (!Character.isValidCodePoint(codePoint)) {
			throw JsonProcessingException.custom("Invalid code point " + codePoint);
		}
		encodeStr(new String(Character.toChars(codePoint)));
	}

	@Override
	public void encodeStr(CharSequence value) {
		append(stringLiteral(value));
	}

	@Override
	public void encodeBytes(byte[] value) {
		appendQuoted(Base64Url.encode(value));
	}

	@Override
	public void encodeUnit() {
		append(NULL.fixedRepresentation());
	}

	@Override
	public void encodeNone() {
		encodeUnit();
	}

	@Override
	public <T> void encodeSome(T value, Serializer<? super T> serializer) {
		serializer.serialize(value, this);
	}

	@Override
	public void encodeUnitVariant(String tag) {
		encodeStr(tag);
	}

	@Override
	public <T> void encodeNewtypeVariant(String tag, T value, Serializer<? super T> serializer) {
		enter();
		append(START_OBJECT.fixedChar());
		encodeStr(tag);
		append(':');
		serializer.serialize(value, this);
		append(END_OBJECT.fixedChar());
		exit();
	}

	@Override
	public SeqEncoder encodeSeq() {
		enter();
		append(START_ARRAY.fixedChar());
		return new CompoundWriter(this, END_ARRAY.fixedRepresentation(), 1);
	}

	@Override
	public SeqEncoder encodeTupleVariant(String tag) {
		enter();
		append(START_OBJECT.fixedChar());
		encodeStr(tag);
		append(':');
		enter();
		append(START_ARRAY.fixedChar());
		return new CompoundWriter(this, END_ARRAY.fixedRepresentation() + END_OBJECT.fixedRepresentation(), 2);
	}

	@Override
	public MapEncoder encodeMap() {
		enter();
		append(START_OBJECT.fixedChar());
		return new CompoundWriter(this, END_OBJECT.fixedRepresentation(), 1);
	}

	@Override
	public StructEncoder encodeStruct() {
		enter();
		append(START_OBJECT.fixedChar());
		return new CompoundWriter(this, END_OBJECT.fixedRepresentation(), 1);
	}

	@Override
	public StructEncoder encodeStructVariant(String tag) {
		enter();
		append(START_OBJECT.fixedChar());
		encodeStr(tag);
		append(':');
		enter();
		append(START_OBJECT.fixedChar());
		return new CompoundWriter(this, END_OBJECT.fixedRepresentation() + END_OBJECT.fixedRepresentation(), 2);
	}

	Encoder keyEncoder() {
		return keyEncoder;
	}

	void append(char c) {
		try {
			out.append(c);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	void append(CharSequence s) {
		try {
			out.append(s);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	void appendQuoted(String s) {
		append('"');
		append(s);
		append('"');
	}

	private void enter() {
		if (++depth > settings.maxDepth()) {
			throw JsonProcessingException.depthLimit(settings.maxDepth());
		}
	}

	void exit() {
		assert depth > 0;
		--depth;
	}

	/**
	 * Non-ASCII characters are written as-is;
	 * only the quote, backslash, slash, and control characters are escaped.
	 */
	static String stringLiteral(CharSequence s) {
		StringBuilder sb = new StringBuilder(s.length() + 2);
		sb.append('"');
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '"': sb.append("\\\""); break;
				case '\\': sb.append("\\\\"); break;
				case '/': sb.append("\\/"); break;
				case '\b': sb.append("\\b"); break;
				case '\f': sb.append("\\f"); break;
				case '\n': sb.append("\\n"); break;
				case '\r': sb.append("\\r"); break;
				case '\t': sb.append("\\t"); break;
				default:
					if (c < 0x20) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
			}
		}
		sb.append('"');
		return sb.toString();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonEncoder.class);
}
