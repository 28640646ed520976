package de.tu_berlin.coga.jlpp.parse;

/**
 * A problem in the input that does not stop parsing.
 */
public final class Diagnostic {

	public static enum Kind {
		/** a natural constraint names a variable the problem does not use */
		UNKNOWN_VARIABLE_REFERENCE_IGNORED
	}

	private final Kind kind;
	private final int line;
	private final int sourceLine;
	private final String name;
	private final String text;

	Diagnostic(Kind kind, int line, int sourceLine, String name, String text) {
		this.kind = kind;
		this.line = line;
		this.sourceLine = sourceLine;
		this.name = name;
		this.text = text;
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * @return the 1-based number of the declaration within its section
	 */
	public int line() {
		return line;
	}

	public int sourceLine() {
		return sourceLine;
	}

	/**
	 * @return the variable name as given, lower case; empty if the
	 *         declaration has none
	 */
	public String name() {
		return name;
	}

	public String text() {
		return text;
	}

	public String message() {
		return "line " + sourceLine + ": natural constraint no " + line + " refers to unknown variable '" + name
				+ "', ignored";
	}

	@Override
	public String toString() {
		return kind + ": " + message();
	}
}
