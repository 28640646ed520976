package de.tu_berlin.coga.jlpp;

import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a linear problem into its dual.
 * <p>
 * With primal <code>(MinMax, c, A, Eqin, b, naturalConstraints)</code> the
 * dual is
 * <ul>
 * <li><code>MinMax' = -MinMax</code></li>
 * <li><code>c' = b</code>, <code>b' = c</code></li>
 * <li><code>A' = A<sup>T</sup></code></li>
 * <li>dual maximises: <code>Eqin' = -naturalConstraints</code>,
 * <code>naturalConstraints' = Eqin</code></li>
 * <li>dual minimises: <code>Eqin' = naturalConstraints</code>,
 * <code>naturalConstraints' = -Eqin</code></li>
 * </ul>
 * Only transposition and sign changes are involved, so converting twice
 * gives back the primal exactly. The dual variables, one per primal
 * constraint, are called <code>w1 ... wm</code>.
 */
public final class DualConverter {
	private static final Logger LOGGER = LoggerFactory.getLogger(DualConverter.class);

	private DualConverter() {
	}

	public static LinearProblem toDual(LinearProblem primal) {
		int n = primal.getNumVariables();
		int m = primal.getNumConstraints();

		int dualType = -1 * primal.getMinMax();
		double[] dualC = primal.getB();
		double[] dualB = primal.getC();
		double[][] w = transpose(primal.getA(), m, n);

		int[] dualEqin;
		int[] dualNaturalConstraints;
		if (dualType == 1) {
			// min -> max
			dualEqin = negate(primal.getNaturalConstraints());
			dualNaturalConstraints = primal.getEqin();
		} else {
			// max -> min
			dualEqin = primal.getNaturalConstraints();
			dualNaturalConstraints = negate(primal.getEqin());
		}

		LOGGER.debug("converted {}x{} primal to {}x{} dual", m, n, n, m);
		return new LinearProblem(dualType, dualC, w, dualEqin, dualB, dualNaturalConstraints,
				LinearProblem.defaultNames("w", m));
	}

	private static double[][] transpose(double[][] a, int rows, int cols) {
		DenseMatrix64F matrix = new DenseMatrix64F(rows, cols);
		for (int i = 0; i < rows; i++) {
			for (int j = 0; j < cols; j++) {
				matrix.set(i, j, a[i][j]);
			}
		}
		DenseMatrix64F transposed = CommonOps.transpose(matrix, null);

		double[][] result = new double[cols][rows];
		for (int i = 0; i < cols; i++) {
			for (int j = 0; j < rows; j++) {
				result[i][j] = transposed.get(i, j);
			}
		}
		return result;
	}

	private static int[] negate(int[] codes) {
		int[] negated = new int[codes.length];
		for (int i = 0; i < codes.length; i++) {
			negated[i] = -1 * codes[i];
		}
		return negated;
	}
}
