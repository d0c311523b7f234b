package works.bosk.json4web.codec.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FloatFormattingTest {
	@Test
	void shortest() {
		assertEquals("1.3", FloatFormatting.format(1.3f));
		assertEquals("1.3", FloatFormatting.format(1.3));
		assertEquals("0.30000000000000004", FloatFormatting.format(0.1 + 0.2));
		assertEquals("2.0E-7", FloatFormatting.format(2e-7));
	}

	@ParameterizedTest
	@ValueSource(doubles = {0.0, -0.0, 1.0, 0.001, 1234567.0, 1e7, 1e22, 5e-324, Double.MAX_VALUE, Math.PI})
	void reparses(double value) {
		String text = FloatFormatting.format(value);
		assertEquals(value, NumberLiterals.parseF64(text), text);
	}

	@ParameterizedTest
	@ValueSource(floats = {0.0f, 1.0f, 0.1f, 3.4e38f, 1.4e-45f, 16777216.0f})
	void reparses_f32(float value) {
		String text = FloatFormatting.format(value);
		assertEquals(value, NumberLiterals.parseF32(text), text);
	}
}
