package works.bosk.json4web.codec.io;

import java.math.BigInteger;
import works.bosk.json4web.exceptions.JsonContentException;

import static works.bosk.json4web.exceptions.JsonContentException.parseFloat;
import static works.bosk.json4web.exceptions.JsonContentException.parseInt;

/**
 * Converts numeric literal text into the model's numeric types.
 * Each method throws {@link JsonContentException} if the text doesn't represent
 * a value of the requested type.
 */
public final class NumberLiterals {
	public static final BigInteger I128_MIN = BigInteger.ONE.shiftLeft(127).negate();
	public static final BigInteger I128_MAX = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
	public static final BigInteger U128_MAX = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

	private NumberLiterals() { }

	public static byte parseI8(CharSequence literal) {
		try {
			return Byte.parseByte(checkSignedDigits(literal));
		} catch (NumberFormatException e) {
			throw parseInt(literal, e);
		}
	}

	public static short parseI16(CharSequence literal) {
		try {
			return Short.parseShort(checkSignedDigits(literal));
		} catch (NumberFormatException e) {
			throw parseInt(literal, e);
		}
	}

	public static int parseI32(CharSequence literal) {
		try {
			return Integer.parseInt(checkSignedDigits(literal));
		} catch (NumberFormatException e) {
			throw parseInt(literal, e);
		}
	}

	public static long parseI64(CharSequence literal) {
		try {
			return Long.parseLong(checkSignedDigits(literal));
		} catch (NumberFormatException e) {
			throw parseInt(literal, e);
		}
	}

	public static BigInteger parseI128(CharSequence literal) {
		try {
			return checkRange(new BigInteger(checkSignedDigits(literal)), I128_MIN, I128_MAX);
		} catch (NumberFormatException e) {
			throw parseInt(literal, e);
		}
	}

	public static byte parseU8(CharSequence literal) {
		try {
			return (byte) checkUnsigned(Integer.parseInt(checkUnsignedDigits(literal)), 0xFF);
		} catch (NumberFormatException e) {
			throw parseInt(literal, e);
		}
	}

	public static short parseU16(CharSequence literal) {
		try {
			return (short) checkUnsigned(Integer.parseInt(checkUnsignedDigits(literal)), 0xFFFF);
		} catch (NumberFormatException e) {
			throw parseInt(literal, e);
		}
	}

	public static int parseU32(CharSequence literal) {
		try {
			return Integer.parseUnsignedInt(checkUnsignedDigits(literal));
		} catch (NumberFormatException e) {
			throw parseInt(literal, e);
		}
	}

	public static long parseU64(CharSequence literal) {
		try {
			return Long.parseUnsignedLong(checkUnsignedDigits(literal));
		} catch (NumberFormatException e) {
			throw parseInt(literal, e);
		}
	}

	public static BigInteger parseU128(CharSequence literal) {
		try {
			return checkRange(new BigInteger(checkUnsignedDigits(literal)), BigInteger.ZERO, U128_MAX);
		} catch (NumberFormatException e) {
			throw parseInt(literal, e);
		}
	}

	public static float parseF32(CharSequence literal) {
		try {
			return Float.parseFloat(checkFloatChars(literal));
		} catch (NumberFormatException e) {
			throw parseFloat(literal, e);
		}
	}

	public static double parseF64(CharSequence literal) {
		try {
			return Double.parseDouble(checkFloatChars(literal));
		} catch (NumberFormatException e) {
			throw parseFloat(literal, e);
		}
	}

	public static boolean isI128(BigInteger value) {
		return value.compareTo(I128_MIN) >= 0 && value.compareTo(I128_MAX) <= 0;
	}

	public static boolean isU128(BigInteger value) {
		return value.signum() >= 0 && value.compareTo(U128_MAX) <= 0;
	}

	private static int checkUnsigned(int value, int max) {
		if (value < 0 || value > max) {
			throw new NumberFormatException("Value out of range. Value:\"" + value + "\" Max:" + max);
		}
		return value;
	}

	private static BigInteger checkRange(BigInteger value, BigInteger min, BigInteger max) {
		if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
			throw new NumberFormatException("Value out of range. Value:\"" + value + "\"");
		}
		return value;
	}

	/**
	 * The JDK integer parsers accept {@code +} and any Unicode decimal digit.
	 * Integer literals here are an optional {@code -} and ASCII digits only.
	 */
	private static String checkSignedDigits(CharSequence literal) {
		int start = (literal.length() > 0 && literal.charAt(0) == '-')? 1 : 0;
		return checkDigits(literal, start);
	}

	private static String checkUnsignedDigits(CharSequence literal) {
		return checkDigits(literal, 0);
	}

	private static String checkDigits(CharSequence literal, int start) {
		if (literal.length() == start) {
			throw new NumberFormatException("no digits");
		}
		for (int i = start; i < literal.length(); i++) {
			if (!Util.isDigit(literal.charAt(i))) {
				throw new NumberFormatException("Unexpected character '" + literal.charAt(i) + "'");
			}
		}
		return literal.toString();
	}

	/**
	 * The JDK parsers also accept things like {@code NaN}, {@code 0x1p3}, and {@code 1.0f},
	 * none of which are float literals here.
	 */
	private static String checkFloatChars(CharSequence literal) {
		if (literal.length() == 0) {
			throw new NumberFormatException("empty literal");
		}
		for (int i = 0; i < literal.length(); i++) {
			if (!Util.isFloatChar(literal.charAt(i))) {
				throw new NumberFormatException("Unexpected character '" + literal.charAt(i) + "'");
			}
		}
		return literal.toString();
	}
}
