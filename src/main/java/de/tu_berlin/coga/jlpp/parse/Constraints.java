package de.tu_berlin.coga.jlpp.parse;

/**
 * The constraint part of a problem: coefficient matrix <code>A</code>,
 * relation codes <code>Eqin</code> and right hand side <code>b</code>, one
 * row per constraint line in source order.
 */
public final class Constraints {
	private final double[][] a;
	private final int[] eqin;
	private final double[] b;

	Constraints(double[][] a, int[] eqin, double[] b) {
		this.a = a;
		this.eqin = eqin;
		this.b = b;
	}

	public int size() {
		return eqin.length;
	}

	public double[][] a() {
		double[][] copy = new double[a.length][];
		for (int i = 0; i < a.length; i++) {
			copy[i] = a[i].clone();
		}
		return copy;
	}

	/**
	 * @return -1 for <code>&lt;=</code>, 0 for <code>=</code>, 1 for
	 *         <code>&gt;=</code>, per constraint
	 */
	public int[] eqin() {
		return eqin.clone();
	}

	public double[] b() {
		return b.clone();
	}
}
