package works.bosk.json4web.model;

import works.bosk.json4web.model.Decoder.MapVisitor;
import works.bosk.json4web.model.Decoder.SeqVisitor;

/**
 * Gives access to a tagged variant being decoded.
 * After inspecting the {@link #tag}, the caller must call exactly one of
 * {@link #unit}, {@link #newtype}, {@link #tuple}, or {@link #struct}
 * according to the shape the tag denotes.
 */
public interface VariantAccess {
	String tag();

	void unit();

	<T> T newtype(Deserializer<? extends T> deserializer);

	<T> T tuple(SeqVisitor<T> visitor);

	<T> T struct(MapVisitor<T> visitor);
}
