package works.bosk.json4web.codec;

import java.math.BigInteger;
import java.util.Optional;
import works.bosk.json4web.codec.io.NumberLiterals;
import works.bosk.json4web.model.Decoder;
import works.bosk.json4web.model.Deserializer;
import works.bosk.json4web.model.Visitor;

import static works.bosk.json4web.exceptions.JsonContentException.invalidType;

/**
 * Decodes map keys.
 * Keys are always strings in the text, so scalar keys
 * (written by {@link MapKeyEncoder} as quoted strings)
 * are parsed from the string's contents.
 * Everything else is delegated to the underlying {@link JsonDecoder}.
 */
final class MapKeyDecoder implements Decoder {
	private final JsonDecoder decoder;

	MapKeyDecoder(JsonDecoder decoder) {
		this.decoder = decoder;
	}

	@Override
	public <T> T decodeAny(Visitor<T> visitor) {
		return visitor.visitStr(decoder.decodeStr());
	}

	@Override
	public boolean decodeBool() {
		CharSequence key = decoder.decodeStr();
		switch (key.toString()) {
			case "1":
			case "true":
				return true;
			case "0":
			case "false":
				return false;
			default:
				throw invalidType("string \"" + key + "\"", "a boolean map key");
		}
	}

	@Override
	public byte decodeI8() {
		return NumberLiterals.parseI8(decoder.decodeStr());
	}

	@Override
	public short decodeI16() {
		return NumberLiterals.parseI16(decoder.decodeStr());
	}

	@Override
	public int decodeI32() {
		return NumberLiterals.parseI32(decoder.decodeStr());
	}

	@Override
	public long decodeI64() {
		return decoder.decodeI64();
	}

	@Override
	public BigInteger decodeI128() {
		return decoder.decodeI128();
	}

	@Override
	public byte decodeU8() {
		return NumberLiterals.parseU8(decoder.decodeStr());
	}

	@Override
	public short decodeU16() {
		return NumberLiterals.parseU16(decoder.decodeStr());
	}

	@Override
	public int decodeU32() {
		return NumberLiterals.parseU32(decoder.decodeStr());
	}

	@Override
	public long decodeU64() {
		return decoder.decodeU64();
	}

	@Override
	public BigInteger decodeU128() {
		return decoder.decodeU128();
	}

	@Override
	public float decodeF32() {
		return NumberLiterals.parseF32(decoder.decodeStr());
	}

	@Override
	public double decodeF64() {
		return NumberLiterals.parseF64(decoder.decodeStr());
	}

	@Override
	public int decodeChar() {
		return decoder.decodeChar();
	}

	@Override
	public CharSequence decodeStr() {
		return decoder.decodeStr();
	}

	@Override
	public byte[] decodeBytes() {
		return decoder.decodeBytes();
	}

	@Override
	public Void decodeUnit() {
		return decoder.decodeUnit();
	}

	@Override
	public <T> Optional<T> decodeOption(Deserializer<? extends T> deserializer) {
		return decoder.decodeOption(deserializer);
	}

	@Override
	public <T> T decodeSeq(SeqVisitor<T> visitor) {
		return decoder.decodeSeq(visitor);
	}

	@Override
	public <T> T decodeMap(MapVisitor<T> visitor) {
		return decoder.decodeMap(visitor);
	}

	@Override
	public <T> T decodeVariant(VariantVisitor<T> visitor) {
		return decoder.decodeVariant(visitor);
	}

	@Override
	public void decodeIgnored() {
		decoder.decodeIgnored();
	}
}
