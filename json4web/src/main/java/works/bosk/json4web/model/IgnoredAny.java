package works.bosk.json4web.model;

/**
 * Consumes and discards one complete value of any kind,
 * including every element of nested sequences and maps.
 * Useful for skipping unrecognized struct fields.
 */
public enum IgnoredAny implements Visitor<Void>, Deserializer<Void> {
	INSTANCE;

	@Override
	public Void deserialize(Decoder in) {
		in.decodeIgnored();
		return null;
	}

	@Override
	public String expecting() {
		return "anything at all";
	}

	@Override
	public Void visitNull() {
		return null;
	}

	@Override
	public Void visitBool(boolean value) {
		return null;
	}

	@Override
	public Void visitF64(double value) {
		return null;
	}

	@Override
	public Void visitStr(CharSequence value) {
		return null;
	}

	@Override
	public Void visitSeq(SeqAccess seq) {
		while (seq.hasNext()) {
			seq.next(this);
		}
		return null;
	}

	@Override
	public Void visitMap(MapAccess map) {
		while (map.hasNext()) {
			map.nextKey(this);
			map.nextValue(this);
		}
		return null;
	}
}
