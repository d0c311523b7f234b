package works.bosk.json4web.codec;

import works.bosk.json4web.model.Encoder.MapEncoder;
import works.bosk.json4web.model.Encoder.SeqEncoder;
import works.bosk.json4web.model.Encoder.StructEncoder;
import works.bosk.json4web.model.Serializer;

/**
 * The compound cursor for sequences, maps, and structs being encoded.
 * {@link JsonEncoder} has already written the opening bracket;
 * this writes a comma before every element but the first,
 * and the closing text on {@link #end}.
 */
final class CompoundWriter implements SeqEncoder, MapEncoder, StructEncoder {
	private final JsonEncoder encoder;
	private final String closing;
	private final int levels;
	private boolean first = true;

	/**
	 * @param closing written by {@link #end}. Tuple and struct variants close two brackets.
	 * @param levels the nesting depth opened for this compound
	 */
	CompoundWriter(JsonEncoder encoder, String closing, int levels) {
		this.encoder = encoder;
		this.closing = closing;
		this.levels = levels;
	}

	@Override
	public <T> void element(T value, Serializer<? super T> serializer) {
		separator();
		serializer.serialize(value, encoder);
	}

	@Override
	public <K> void key(K key, Serializer<? super K> serializer) {
		separator();
		serializer.serialize(key, encoder.keyEncoder());
	}

	@Override
	public <V> void value(V value, Serializer<? super V> serializer) {
		encoder.append(':');
		serializer.serialize(value, encoder);
	}

	@Override
	public <V> void field(String name, V value, Serializer<? super V> serializer) {
		separator();
		encoder.encodeStr(name);
		encoder.append(':');
		serializer.serialize(value, encoder);
	}

	@Override
	public void end() {
		encoder.append(closing);
		for (int i = 0; i < levels; i++) {
			encoder.exit();
		}
	}

	private void separator() {
		if (first) {
			first = false;
		} else {
			encoder.append(',');
		}
	}
}
