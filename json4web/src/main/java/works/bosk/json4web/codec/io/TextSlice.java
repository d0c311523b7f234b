package works.bosk.json4web.codec.io;

import java.util.Objects;

/**
 * A {@link CharSequence} that is a view of part of a char array, without copying.
 * Changes to the array show through.
 */
public final class TextSlice implements CharSequence {
	private final char[] chars;
	private final int start;
	private final int stop;

	public TextSlice(char[] chars, int start, int stop) {
		Objects.checkFromToIndex(start, stop, chars.length);
		this.chars = chars;
		this.start = start;
		this.stop = stop;
	}

	@Override
	public int length() {
		return stop - start;
	}

	@Override
	public char charAt(int index) {
		Objects.checkIndex(index, length());
		return chars[start + index];
	}

	@Override
	public TextSlice subSequence(int start, int end) {
		Objects.checkFromToIndex(start, end, length());
		return new TextSlice(chars, this.start + start, this.start + end);
	}

	/**
	 * @return true if this is a view of the given array
	 */
	public boolean isViewOf(char[] array) {
		return chars == array;
	}

	@Override
	public String toString() {
		return new String(chars, start, length());
	}
}
