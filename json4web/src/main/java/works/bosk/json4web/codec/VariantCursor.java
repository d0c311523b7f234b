package works.bosk.json4web.codec;

import works.bosk.json4web.model.Decoder.MapVisitor;
import works.bosk.json4web.model.Decoder.SeqVisitor;
import works.bosk.json4web.model.Deserializer;
import works.bosk.json4web.model.VariantAccess;

import static works.bosk.json4web.exceptions.JsonContentException.invalidType;
import static works.bosk.json4web.exceptions.JsonSyntaxException.unexpectedToken;

/**
 * The compound cursor for a tagged variant being decoded.
 * The tag has already been consumed; the payload, if any, has not.
 */
sealed abstract class VariantCursor implements VariantAccess {
	private final String tag;

	VariantCursor(String tag) {
		this.tag = tag;
	}

	@Override
	public String tag() {
		return tag;
	}

	/**
	 * A variant written as just its quoted tag, which can only be a unit variant.
	 */
	static final class BareTag extends VariantCursor {
		BareTag(String tag) {
			super(tag);
		}

		@Override
		public void unit() {
		}

		@Override
		public <T> T newtype(Deserializer<? extends T> deserializer) {
			throw invalidType("unit variant", "newtype variant");
		}

		@Override
		public <T> T tuple(SeqVisitor<T> visitor) {
			throw invalidType("unit variant", "tuple variant");
		}

		@Override
		public <T> T struct(MapVisitor<T> visitor) {
			throw invalidType("unit variant", "struct variant");
		}
	}

	/**
	 * A variant written as a single-member object whose value is the payload.
	 * {@link JsonDecoder} has consumed the opening brace, the tag, and the colon,
	 * and will consume the closing brace after the payload.
	 */
	static final class Tagged extends VariantCursor {
		private final JsonDecoder decoder;

		Tagged(JsonDecoder decoder, String tag) {
			super(tag);
			this.decoder = decoder;
		}

		/**
		 * A unit variant has no payload, so there's nothing valid that could follow the colon.
		 */
		@Override
		public void unit() {
			decoder.skipWhitespace();
			throw unexpectedToken(decoder.peekChar(), "no payload for unit variant " + tag());
		}

		@Override
		public <T> T newtype(Deserializer<? extends T> deserializer) {
			return deserializer.deserialize(decoder);
		}

		@Override
		public <T> T tuple(SeqVisitor<T> visitor) {
			return decoder.decodeSeq(visitor);
		}

		@Override
		public <T> T struct(MapVisitor<T> visitor) {
			return decoder.decodeMap(visitor);
		}
	}
}
