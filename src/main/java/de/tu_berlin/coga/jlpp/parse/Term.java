package de.tu_berlin.coga.jlpp.parse;

/**
 * One summand <code>sign coefficient variable</code> of a linear expression.
 */
public final class Term {
	private final int sign;
	private final double magnitude;
	private final String variable;
	private final String text;
	private final int offset;
	private final boolean signed;

	Term(int sign, boolean signed, double magnitude, String variable, String text, int offset) {
		this.sign = sign;
		this.signed = signed;
		this.magnitude = magnitude;
		this.variable = variable;
		this.text = text;
		this.offset = offset;
	}

	/**
	 * @return +1 or -1
	 */
	public int sign() {
		return sign;
	}

	/**
	 * @return whether the sign was written out rather than implied
	 */
	public boolean hasExplicitSign() {
		return signed;
	}

	public double magnitude() {
		return magnitude;
	}

	public double value() {
		return sign * magnitude;
	}

	/**
	 * @return the lower case variable name
	 */
	public String variable() {
		return variable;
	}

	/**
	 * @return the term as written, without whitespace
	 */
	public String text() {
		return text;
	}

	public int offset() {
		return offset;
	}

	@Override
	public String toString() {
		return text;
	}
}
