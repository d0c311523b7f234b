/**
 * json4web: a compact, JSON-derived text format for typed data.
 * <p>
 * Types take part by supplying a {@link works.bosk.json4web.model.Serializer Serializer}
 * and {@link works.bosk.json4web.model.Deserializer Deserializer},
 * which describe values in terms of the {@link works.bosk.json4web.model data model}.
 * The codec turns those descriptions into text and back.
 * <p>
 * The major packages are:
 *
 * <ul>
 *     <li>
 *         {@link works.bosk.json4web.model}, the traversal contract and stock implementations for JDK types;
 *     </li>
 *     <li>
 *         {@link works.bosk.json4web.codec}, the decoder and encoder; and
 *     </li>
 *     <li>
 *         {@link works.bosk.json4web.exceptions}, describing everything that can go wrong.
 *     </li>
 * </ul>
 *
 * {@link works.bosk.json4web.Json4Web} offers one-line shortcuts.
 */
module works.bosk.json4web {
	requires com.fasterxml.jackson.core;
	requires org.slf4j;

	exports works.bosk.json4web;
	exports works.bosk.json4web.codec;
	exports works.bosk.json4web.codec.io;
	exports works.bosk.json4web.exceptions;
	exports works.bosk.json4web.model;
}
