/**
 * Every failure is a {@link works.bosk.json4web.exceptions.JsonException}
 * carrying one {@link works.bosk.json4web.exceptions.ErrorKind}.
 * These are unchecked, and none of them are recoverable:
 * once thrown, the decode or encode call is over.
 */
package works.bosk.json4web.exceptions;
