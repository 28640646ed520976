package de.tu_berlin.coga.jlpp.parse;

/**
 * A token of a linear expression. Offsets point into the {@link SourceText}
 * the token was read from; since whitespace is dropped while tokenising, a
 * token like <code>&lt; =</code> may span more source characters than its
 * text has.
 */
public final class Token {

	public static enum Type {
		/** <code>+</code> or <code>-</code> */
		SIGN,
		/** one or more digits */
		NUMBER,
		/** <code>x</code> or <code>X</code> followed by one or more digits */
		VARIABLE,
		/** <code>&lt;=</code>, <code>=</code> or <code>&gt;=</code> */
		RELATION,
		/** any other single character */
		OTHER
	}

	private final Type type;
	private final String text;
	private final int offset;
	private final int end;

	public Token(Type type, String text, int offset, int end) {
		this.type = type;
		this.text = text;
		this.offset = offset;
		this.end = end;
	}

	public Type type() {
		return type;
	}

	public String text() {
		return text;
	}

	public int offset() {
		return offset;
	}

	/**
	 * @return the source offset after the last character of the token
	 */
	public int end() {
		return end;
	}

	public boolean is(Type type) {
		return this.type == type;
	}

	@Override
	public String toString() {
		return type + "(" + text + ")";
	}
}
