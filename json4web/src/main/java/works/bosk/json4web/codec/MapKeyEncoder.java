package works.bosk.json4web.codec;

import java.math.BigInteger;
import works.bosk.json4web.exceptions.JsonProcessingException;
import works.bosk.json4web.model.Encoder;
import works.bosk.json4web.model.Serializer;

/**
 * Encodes map keys, which must be strings in the text.
 * String-like keys are written as usual;
 * booleans and numbers are written as quoted strings, to be parsed by {@link MapKeyDecoder};
 * anything else is rejected.
 */
final class MapKeyEncoder implements Encoder {
	private final JsonEncoder encoder;

	MapKeyEncoder(JsonEncoder encoder) {
		this.encoder = encoder;
	}

	@Override
	public void encodeBool(boolean value) {
		encoder.appendQuoted(value? "1" : "0");
	}

	@Override
	public void encodeI8(byte value) {
		encoder.appendQuoted(Byte.toString(value));
	}

	@Override
	public void encodeI16(short value) {
		encoder.appendQuoted(Short.toString(value));
	}

	@Override
	public void encodeI32(int value) {
		encoder.appendQuoted(Integer.toString(value));
	}

	@Override
	public void encodeI64(long value) {
		encoder.encodeI64(value);
	}

	@Override
	public void encodeI128(BigInteger value) {
		encoder.encodeI128(value);
	}

	@Override
	public void encodeU8(byte value) {
		encoder.appendQuoted(Integer.toString(Byte.toUnsignedInt(value)));
	}

	@Override
	public void encodeU16(short value) {
		encoder.appendQuoted(Integer.toString(Short.toUnsignedInt(value)));
	}

	@Override
	public void encodeU32(int value) {
		encoder.appendQuoted(Integer.toUnsignedString(value));
	}

	@Override
	public void encodeU64(long value) {
		encoder.encodeU64(value);
	}

	@Override
	public void encodeU128(BigInteger value) {
		encoder.encodeU128(value);
	}

	@Override
	public void encodeF32(float value) {
		encoder.append('"');
		encoder.encodeF32(value);
		encoder.append('"');
	}

	@Override
	public void encodeF64(double value) {
		encoder.append('"');
		encoder.encodeF64(value);
		encoder.append('"');
	}

	@Override
	public void encodeChar(int codePoint) {
		encoder.encodeChar(codePoint);
	}

	@Override
	public void encodeStr(CharSequence value) {
		encoder.encodeStr(value);
	}

	@Override
	public void encodeBytes(byte[] value) {
		throw keyMustBeAString("bytes");
	}

	@Override
	public void encodeUnit() {
		throw keyMustBeAString("unit");
	}

	@Override
	public void encodeNone() {
		throw keyMustBeAString("none");
	}

	@Override
	public <T> void encodeSome(T value, Serializer<? super T> serializer) {
		throw keyMustBeAString("optional value");
	}

	@Override
	public void encodeUnitVariant(String tag) {
		encoder.encodeUnitVariant(tag);
	}

	@Override
	public <T> void encodeNewtypeVariant(String tag, T value, Serializer<? super T> serializer) {
		throw keyMustBeAString("newtype variant");
	}

	@Override
	public SeqEncoder encodeSeq() {
		throw keyMustBeAString("sequence");
	}

	@Override
	public SeqEncoder encodeTupleVariant(String tag) {
		throw keyMustBeAString("tuple variant");
	}

	@Override
	public MapEncoder encodeMap() {
		throw keyMustBeAString("map");
	}

	@Override
	public StructEncoder encodeStruct() {
		throw keyMustBeAString("struct");
	}

	@Override
	public StructEncoder encodeStructVariant(String tag) {
		throw keyMustBeAString("struct variant");
	}

	private static JsonProcessingException keyMustBeAString(String kind) {
		return JsonProcessingException.custom("Map key must be a string, not " + kind);
	}
}
