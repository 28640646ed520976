package de.tu_berlin.coga.jlpp.parse;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * A contiguous range <code>[start, end)</code> of a {@link SourceText}. All
 * offsets handed in and out are absolute offsets into the source, so tokens
 * and errors found in a segment can always be traced back to a line and
 * column of the input.
 */
public final class Segment {
	private final SourceText source;
	private final int start;
	private final int end;

	public Segment(SourceText source, int start, int end) {
		Preconditions.checkPositionIndexes(start, end, source.length());
		this.source = source;
		this.start = start;
		this.end = end;
	}

	/**
	 * Wraps a standalone piece of text, for callers that have no surrounding
	 * problem text.
	 */
	public static Segment of(String text) {
		SourceText source = new SourceText(text);
		return new Segment(source, 0, source.length());
	}

	public SourceText source() {
		return source;
	}

	public int start() {
		return start;
	}

	public int end() {
		return end;
	}

	public String text() {
		return source.text().substring(start, end);
	}

	public char charAt(int offset) {
		Preconditions.checkElementIndex(offset - start, end - start);
		return source.text().charAt(offset);
	}

	public boolean isBlank() {
		return text().trim().isEmpty();
	}

	/**
	 * @return the part of this segment between the absolute offsets
	 *         <code>from</code> and <code>to</code>
	 */
	public Segment slice(int from, int to) {
		Preconditions.checkArgument(start <= from && from <= to && to <= end, "[%s, %s) is not inside [%s, %s)", from,
				to, start, end);
		return new Segment(source, from, to);
	}

	/**
	 * Splits the segment at newlines. Runs of newlines and lines holding only
	 * whitespace are dropped, so the result holds one entry per non-blank
	 * line, in source order.
	 */
	public List<Segment> lines() {
		List<Segment> lines = new ArrayList<Segment>();
		String text = source.text();
		int lineStart = start;
		for (int i = start; i <= end; i++) {
			if (i == end || text.charAt(i) == '\n') {
				Segment line = new Segment(source, lineStart, i);
				if (!line.isBlank()) {
					lines.add(line);
				}
				lineStart = i + 1;
			}
		}
		return lines;
	}

	public int lineOf(int offset) {
		return source.lineOf(offset);
	}

	public int columnOf(int offset) {
		return source.columnOf(offset);
	}

	/**
	 * @return the absolute offset of the first non-whitespace character, or
	 *         <code>start()</code> for a blank segment
	 */
	public int firstNonBlank() {
		String text = source.text();
		for (int i = start; i < end; i++) {
			if (!Character.isWhitespace(text.charAt(i))) {
				return i;
			}
		}
		return start;
	}

	@Override
	public String toString() {
		return text();
	}
}
