/**
 * The two traversal engines:
 * {@link works.bosk.json4web.codec.JsonDecoder}, which turns text into values
 * on behalf of a {@link works.bosk.json4web.model.Deserializer Deserializer}, and
 * {@link works.bosk.json4web.codec.JsonEncoder}, which turns values into text
 * on behalf of a {@link works.bosk.json4web.model.Serializer Serializer}.
 * <p>
 * Most callers should use {@link works.bosk.json4web.codec.CodecBuilder}
 * to obtain {@link works.bosk.json4web.codec.Parser Parsers}
 * and {@link works.bosk.json4web.codec.Generator Generators}
 * rather than creating the engines directly.
 */
package works.bosk.json4web.codec;
