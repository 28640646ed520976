package de.tu_berlin.coga.jlpp.parse;

/**
 * Direction and coefficients of an objective function.
 */
public final class Objective {
	private final int direction;
	private final double[] coefficients;

	Objective(int direction, double[] coefficients) {
		this.direction = direction;
		this.coefficients = coefficients.clone();
	}

	/**
	 * @return 1 to maximise, -1 to minimise
	 */
	public int direction() {
		return direction;
	}

	public double[] coefficients() {
		return coefficients.clone();
	}
}
