package works.bosk.json4web.codec.io;

import java.util.stream.LongStream;
import works.bosk.json4web.codec.Token;

public class Util {
	private static final long WHITESPACE_CHARS = LongStream
		.of(0x20, 0x0A, 0x0D, 0x09)
		.map(n -> 1L << n)
		.sum();

	/**
	 * The parameter need not be an actual code point: it can also be a surrogate character,
	 * or -1 to indicate the end of input. This correctly returns false in those cases.
	 */
	public static boolean fast_isWhitespace(int c) {
		// The position to check in WHITESPACE_CHARS
		long bit = 1L << c;

		// Zero if definitely not whitespace
		// Can have false positives
		long bitIsSet = WHITESPACE_CHARS & bit;

		// All ones if c is outside 0..63
		long isNegative = (long)c >> 63;
		long isTooBig = (63L - c) >> 63;

		long answer = bitIsSet & ~(isNegative | isTooBig);

		boolean result = (answer != 0);
		assert result == (Token.startingWith(c) == Token.WHITESPACE);
		return result;
	}

	public static boolean isDigit(int c) {
		return c >= '0' && c <= '9';
	}

	public static boolean isSignedIntegerChar(int c) {
		return isDigit(c) || c == '-';
	}

	/**
	 * Float literals also admit exponents, because that's what
	 * {@link FloatFormatting} produces for very large and very small magnitudes.
	 */
	public static boolean isFloatChar(int c) {
		return isDigit(c) || c == '-' || c == '.' || c == '+' || c == 'e' || c == 'E';
	}

	/**
	 * @return the value of the given hex digit, or -1 if it isn't one
	 */
	public static int hexValue(int c) {
		if (c >= '0' && c <= '9') {
			return c - '0';
		} else if (c >= 'a' && c <= 'f') {
			return c - 'a' + 10;
		} else if (c >= 'A' && c <= 'F') {
			return c - 'A' + 10;
		} else {
			return -1;
		}
	}
}
