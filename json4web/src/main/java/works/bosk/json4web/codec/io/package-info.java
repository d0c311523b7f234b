/**
 * Lexical building blocks shared by {@link works.bosk.json4web.codec.JsonDecoder}
 * and {@link works.bosk.json4web.codec.JsonEncoder}:
 * character classes, zero-copy {@link works.bosk.json4web.codec.io.TextSlice text slices},
 * numeric literals, and the base64 and float formatting collaborators.
 */
package works.bosk.json4web.codec.io;
