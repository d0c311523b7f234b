package works.bosk.json4web.codec.io;

import com.fasterxml.jackson.core.io.NumberOutput;

/**
 * Shortest round-trip decimal text for finite floats.
 * <p>
 * Delegates to the Schubfach implementation in jackson-core,
 * which produces the fewest digits that parse back to the same bits.
 * Magnitudes outside {@code [1e-3, 1e7)} come out in exponent form, like {@code 1.0E10}.
 */
public final class FloatFormatting {
	private FloatFormatting() { }

	public static String format(float value) {
		assert Float.isFinite(value);
		return NumberOutput.toString(value, true);
	}

	public static String format(double value) {
		assert Double.isFinite(value);
		return NumberOutput.toString(value, true);
	}
}
