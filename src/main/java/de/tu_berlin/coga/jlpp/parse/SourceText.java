package de.tu_berlin.coga.jlpp.parse;

import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * The complete text of a linear problem together with the offsets at which
 * its lines start. Translates character offsets into 1-based line and column
 * numbers for error messages.
 */
public final class SourceText {
	private final String text;
	private final int[] lineStarts;

	public SourceText(String text) {
		this.text = Preconditions.checkNotNull(text);

		int count = 1;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				count++;
			}
		}
		lineStarts = new int[count];
		int line = 1;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				lineStarts[line++] = i + 1;
			}
		}
	}

	public String text() {
		return text;
	}

	public int length() {
		return text.length();
	}

	/**
	 * @return the 1-based line containing <code>offset</code>
	 */
	public int lineOf(int offset) {
		Preconditions.checkPositionIndex(offset, text.length());
		int index = Arrays.binarySearch(lineStarts, offset);
		if (index < 0) {
			// insertion point is the line after the one we are in
			index = -index - 2;
		}
		return index + 1;
	}

	/**
	 * @return the 1-based column of <code>offset</code> within its line
	 */
	public int columnOf(int offset) {
		return offset - lineStarts[lineOf(offset) - 1] + 1;
	}
}
