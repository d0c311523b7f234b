package works.bosk.json4web.codec;

import java.util.NoSuchElementException;
import works.bosk.json4web.model.Deserializer;
import works.bosk.json4web.model.MapAccess;
import works.bosk.json4web.model.SeqAccess;

/**
 * The compound cursor for sequences and maps being decoded.
 * Expects a comma before every element except the first,
 * and reports exhaustion when the closing bracket is next.
 * <p>
 * The opening and closing brackets themselves are consumed by {@link JsonDecoder}.
 */
final class ElementCursor implements SeqAccess, MapAccess {
	private final JsonDecoder decoder;
	private final char closingBracket;
	private boolean first = true;

	/**
	 * True if {@link #hasNext} has consumed the separator for an element
	 * that hasn't been read yet.
	 */
	private boolean elementPending = false;

	ElementCursor(JsonDecoder decoder, char closingBracket) {
		this.decoder = decoder;
		this.closingBracket = closingBracket;
	}

	@Override
	public boolean hasNext() {
		if (elementPending) {
			return true;
		}
		decoder.skipWhitespace();
		if (decoder.peekChar() == closingBracket) {
			return false;
		}
		if (!first) {
			decoder.expect(',');
		}
		first = false;
		elementPending = true;
		return true;
	}

	@Override
	public <E> E next(Deserializer<? extends E> deserializer) {
		startElement();
		return deserializer.deserialize(decoder);
	}

	@Override
	public <K> K nextKey(Deserializer<? extends K> deserializer) {
		startElement();
		return deserializer.deserialize(decoder.keyDecoder());
	}

	@Override
	public <V> V nextValue(Deserializer<? extends V> deserializer) {
		decoder.skipWhitespace();
		decoder.expect(':');
		return deserializer.deserialize(decoder);
	}

	private void startElement() {
		if (!hasNext()) {
			throw new NoSuchElementException("No more elements before '" + closingBracket + "'");
		}
		elementPending = false;
	}
}
