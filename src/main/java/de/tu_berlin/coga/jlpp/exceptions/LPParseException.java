package de.tu_berlin.coga.jlpp.exceptions;

import java.text.ParseException;

/**
 * Signals that the text of a linear problem could not be turned into a model.
 * <p>
 * Every instance carries a {@link Kind} and, where it applies, the number of
 * the offending constraint or natural constraint within its section
 * ({@link #getLine()}), the offending text and the term, token or keyword the
 * error is about. {@link #getErrorOffset()} is the 1-based line of the whole
 * input, {@link #getColumn()} the 1-based column within it; both are 0 when
 * the error has no position.
 */
public class LPParseException extends ParseException {
	private static final long serialVersionUID = 1L;

	public static enum Kind {
		MISSING_DIRECTION_KEYWORD,
		MISSING_SECTION_KEYWORD,
		MALFORMED_CONSTRAINT,
		EMPTY_LEFT_SIDE,
		EMPTY_RIGHT_SIDE,
		NON_LINEAR_TERM,
		MALFORMED_NATURAL_CONSTRAINT,
		UNEXPECTED_TOKEN,
		INVALID_NUMBER,
		NO_VARIABLES
	}

	private final Kind kind;
	private final int line;
	private final int column;
	private final String text;
	private final String detail;

	private LPParseException(Kind kind, String message, int sourceLine, int column, int line, String text,
			String detail) {
		super(position(sourceLine, column) + message, sourceLine);
		this.kind = kind;
		this.line = line;
		this.column = column;
		this.text = text;
		this.detail = detail;
	}

	private static String position(int sourceLine, int column) {
		if (sourceLine <= 0) {
			return "";
		}
		if (column <= 0) {
			return "line " + sourceLine + ": ";
		}
		return "line " + sourceLine + ", column " + column + ": ";
	}

	public static LPParseException missingDirectionKeyword(int sourceLine, int column) {
		return new LPParseException(Kind.MISSING_DIRECTION_KEYWORD,
				"expression \"min\" or \"max\" not found, include it at the beginning of the problem's description",
				sourceLine, column, 0, null, null);
	}

	/**
	 * @param section
	 *          the keyword that was expected, e.g. <code>s.t.</code> or
	 *          <code>end</code>
	 */
	public static LPParseException missingSectionKeyword(String section, int sourceLine, int column) {
		return new LPParseException(Kind.MISSING_SECTION_KEYWORD, "expression \"" + section + "\" not found", sourceLine,
				column, 0, null, section);
	}

	public static LPParseException malformedConstraint(int line, String text, int sourceLine, int column) {
		return new LPParseException(Kind.MALFORMED_CONSTRAINT, "there was a problem parsing constraint no " + line
				+ ", make sure you have one constraint per line. Is \"" + text + "\" a constraint?", sourceLine, column, line,
				text, null);
	}

	public static LPParseException emptyLeftSide(int line, String text, int sourceLine, int column) {
		return new LPParseException(Kind.EMPTY_LEFT_SIDE, "constraint no " + line + " has no left part", sourceLine,
				column, line, text, null);
	}

	public static LPParseException emptyRightSide(int line, String text, int sourceLine, int column) {
		return new LPParseException(Kind.EMPTY_RIGHT_SIDE, "constraint no " + line + " has no right part", sourceLine,
				column, line, text, null);
	}

	public static LPParseException invalidNumber(int line, String number, int sourceLine, int column) {
		return new LPParseException(Kind.INVALID_NUMBER, "'" + number + "' in constraint no " + line
				+ " is not a valid number", sourceLine, column, line, number, number);
	}

	/**
	 * For a number outside of any numbered constraint, such as a coefficient
	 * too large for a <code>double</code>.
	 */
	public static LPParseException invalidNumber(String number, int sourceLine, int column) {
		return new LPParseException(Kind.INVALID_NUMBER, "'" + number + "' is not a valid number", sourceLine, column, 0,
				number, number);
	}

	/**
	 * @param expression
	 *          the expression with all whitespace removed
	 * @param term
	 *          the term that follows another one without an operator
	 */
	public static LPParseException nonLinearTerm(String expression, String term, int sourceLine, int column) {
		return new LPParseException(Kind.NON_LINEAR_TERM, "expression " + expression + " is non-linear, fix term " + term,
				sourceLine, column, 0, expression, term);
	}

	public static LPParseException unexpectedToken(String expression, String token, int sourceLine, int column) {
		String found = token == null ? "end of expression" : "'" + token + "'";
		return new LPParseException(Kind.UNEXPECTED_TOKEN, "unexpected " + found + " in expression " + expression
				+ ", expected a term of the form [+|-][coefficient]x<index>", sourceLine, column, 0, expression, token);
	}

	public static LPParseException malformedNaturalConstraint(int line, String text, int sourceLine, int column) {
		return new LPParseException(Kind.MALFORMED_NATURAL_CONSTRAINT, "there was a problem parsing natural constraint no "
				+ line + ", make sure you have one natural constraint per line. Is \"" + text
				+ "\" a natural constraint?", sourceLine, column, line, text, null);
	}

	public static LPParseException noVariables() {
		return new LPParseException(Kind.NO_VARIABLES, "the problem does not use any variable", 0, 0, 0, null, null);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the 1-based number of the constraint or natural constraint within
	 *         its section, 0 if the error is not about one
	 */
	public int getLine() {
		return line;
	}

	public int getSourceLine() {
		return getErrorOffset();
	}

	public int getColumn() {
		return column;
	}

	/**
	 * @return the offending line or expression, may be <code>null</code>
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return the offending term, token or missing keyword, may be
	 *         <code>null</code>
	 */
	public String getDetail() {
		return detail;
	}
}
