/**
 * The traversal contract between the codec and the types it handles.
 * <p>
 * A {@link works.bosk.json4web.model.Serializer} describes a value by calling
 * an {@link works.bosk.json4web.model.Encoder} once per value (and once per element of compound values).
 * A {@link works.bosk.json4web.model.Deserializer} does the reverse,
 * telling a {@link works.bosk.json4web.model.Decoder} what it expects next
 * and building its value from what comes back.
 * Neither side knows anything about the text format.
 * <p>
 * {@link works.bosk.json4web.model.Serializers} and {@link works.bosk.json4web.model.Deserializers}
 * cover the JDK types; records, sealed hierarchies and the like are written by hand.
 */
package works.bosk.json4web.model;
