package de.tu_berlin.coga.jlpp;

import java.util.Arrays;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;

/**
 * A linear problem in matrix form
 *
 * <pre>
 * max|min  c x
 * s.t.     A x (Eqin) b
 *          x (naturalConstraints) 0
 * </pre>
 *
 * with <code>n</code> variables and <code>m</code> constraints. Directions,
 * relations and sign restrictions are stored as integer codes so that they
 * can be negated directly when converting to the dual:
 * <ul>
 * <li><code>MinMax</code>: 1 maximise, -1 minimise</li>
 * <li><code>Eqin</code>: -1 <code>&lt;=</code>, 0 <code>=</code>, 1
 * <code>&gt;=</code></li>
 * <li><code>naturalConstraints</code>: -1 <code>x &lt;= 0</code>, 0 free, 1
 * <code>x &gt;= 0</code></li>
 * </ul>
 * All numbers are finite. Instances are immutable; all accessors return copies. Column
 * <code>j</code> of <code>c</code>, <code>A</code> and
 * <code>naturalConstraints</code> belongs to variable
 * {@link #getVariableName(int)}. The names are informational and take no
 * part in {@link #equals(Object)}.
 */
public final class LinearProblem {
	private final int minMax;
	private final double[] obj;
	private final double[][] constraints;
	private final int[] eqin;
	private final double[] rightHandSide;
	private final int[] naturalConstraints;
	private final ImmutableList<String> varName;

	/**
	 * Creates a problem whose variables are called <code>x1 ... xn</code>.
	 *
	 * @param naturalConstraints
	 *          may be <code>null</code>, all variables are then non-negative
	 */
	public LinearProblem(int minMax, double[] c, double[][] a, int[] eqin, double[] b, int[] naturalConstraints) {
		this(minMax, c, a, eqin, b, naturalConstraints, null);
	}

	/**
	 * @param naturalConstraints
	 *          may be <code>null</code>, all variables are then non-negative
	 * @param variableNames
	 *          one name per column, <code>null</code> for
	 *          <code>x1 ... xn</code>
	 * @throws IllegalArgumentException
	 *           if the dimensions do not agree, a code is out of range or a
	 *           number is not finite
	 */
	public LinearProblem(int minMax, double[] c, double[][] a, int[] eqin, double[] b, int[] naturalConstraints,
			String[] variableNames) {
		Preconditions.checkNotNull(c, "c");
		Preconditions.checkNotNull(a, "A");
		Preconditions.checkNotNull(eqin, "Eqin");
		Preconditions.checkNotNull(b, "b");
		ObjectiveGoal.fromCode(minMax);

		int n = c.length;
		int m = b.length;
		Preconditions.checkArgument(a.length == m, "A has %s rows but b has %s entries", a.length, m);
		Preconditions.checkArgument(eqin.length == m, "Eqin has %s entries but b has %s", eqin.length, m);

		checkFinite(c, "c");
		checkFinite(b, "b");

		this.minMax = minMax;
		this.obj = c.clone();
		this.constraints = new double[m][];
		for (int i = 0; i < m; i++) {
			Preconditions.checkNotNull(a[i], "row %s of A", i);
			Preconditions.checkArgument(a[i].length == n, "row %s of A has %s columns, expected %s", i, a[i].length, n);
			checkFinite(a[i], "A");
			this.constraints[i] = a[i].clone();
			Sense.fromCode(eqin[i]);
		}
		this.eqin = eqin.clone();
		this.rightHandSide = b.clone();

		if (naturalConstraints == null) {
			this.naturalConstraints = new int[n];
			Arrays.fill(this.naturalConstraints, Nature.NON_NEGATIVE.code());
		} else {
			Preconditions.checkArgument(naturalConstraints.length == n,
					"naturalConstraints has %s entries, expected %s", naturalConstraints.length, n);
			for (int code : naturalConstraints) {
				Nature.fromCode(code);
			}
			this.naturalConstraints = naturalConstraints.clone();
		}

		if (variableNames == null) {
			variableNames = defaultNames("x", n);
		}
		Preconditions.checkArgument(variableNames.length == n, "%s variable names for %s variables",
				variableNames.length, n);
		this.varName = ImmutableList.copyOf(variableNames);
	}

	private static void checkFinite(double[] values, String name) {
		for (int i = 0; i < values.length; i++) {
			Preconditions.checkArgument(Doubles.isFinite(values[i]), "%s holds %s", name, values[i]);
		}
	}

	static String[] defaultNames(String prefix, int count) {
		String[] names = new String[count];
		for (int i = 0; i < count; i++) {
			names[i] = prefix + (i + 1);
		}
		return names;
	}

	public int getNumVariables() {
		return obj.length;
	}

	public int getNumConstraints() {
		return rightHandSide.length;
	}

	/**
	 * @return 1 to maximise, -1 to minimise
	 */
	public int getMinMax() {
		return minMax;
	}

	public ObjectiveGoal getObjectiveGoal() {
		return ObjectiveGoal.fromCode(minMax);
	}

	public double[] getC() {
		return obj.clone();
	}

	public double[][] getA() {
		double[][] copy = new double[constraints.length][];
		for (int i = 0; i < constraints.length; i++) {
			copy[i] = constraints[i].clone();
		}
		return copy;
	}

	public int[] getEqin() {
		return eqin.clone();
	}

	public Sense getSense(int constraint) {
		return Sense.fromCode(eqin[constraint]);
	}

	public double[] getB() {
		return rightHandSide.clone();
	}

	public int[] getNaturalConstraints() {
		return naturalConstraints.clone();
	}

	public Nature getNature(int variable) {
		return Nature.fromCode(naturalConstraints[variable]);
	}

	public String getVariableName(int variable) {
		return varName.get(variable);
	}

	public ImmutableList<String> getVariableNames() {
		return varName;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof LinearProblem)) {
			return false;
		}
		LinearProblem other = (LinearProblem) obj;
		return minMax == other.minMax && Arrays.equals(this.obj, other.obj)
				&& Arrays.deepEquals(constraints, other.constraints) && Arrays.equals(eqin, other.eqin)
				&& Arrays.equals(rightHandSide, other.rightHandSide)
				&& Arrays.equals(naturalConstraints, other.naturalConstraints);
	}

	@Override
	public int hashCode() {
		int result = minMax;
		result = 31 * result + Arrays.hashCode(obj);
		result = 31 * result + Arrays.deepHashCode(constraints);
		result = 31 * result + Arrays.hashCode(eqin);
		result = 31 * result + Arrays.hashCode(rightHandSide);
		result = 31 * result + Arrays.hashCode(naturalConstraints);
		return result;
	}

	@Override
	public String toString() {
		StringBuilder strBuilder = new StringBuilder();
		String goal = (getObjectiveGoal() == ObjectiveGoal.MAX) ? "max" : "min";
		strBuilder.append(goal);
		strBuilder.append('\t');
		for (int i = 0; i < obj.length; i++) {
			if (obj[i] != 0) {
				strBuilder.append(obj[i]);
				strBuilder.append("*");
				strBuilder.append(varName.get(i));
			}
			strBuilder.append('\t');
		}
		strBuilder.append("\n\n");
		strBuilder.append("subject to:\n");

		for (int c = 0; c < constraints.length; c++) {
			strBuilder.append("c");
			strBuilder.append(c + 1);
			strBuilder.append(":\t");
			for (int i = 0; i < obj.length; i++) {
				if (constraints[c][i] != 0) {
					strBuilder.append(constraints[c][i]);
					strBuilder.append('*');
					strBuilder.append(varName.get(i));
				}
				strBuilder.append('\t');
			}
			strBuilder.append(" ");
			strBuilder.append(getSense(c).symbol());
			strBuilder.append(" ");
			strBuilder.append(rightHandSide[c]);
			strBuilder.append('\n');
		}

		strBuilder.append("\nwith:\n");
		for (int i = 0; i < obj.length; i++) {
			strBuilder.append(varName.get(i));
			strBuilder.append(' ');
			Nature nature = getNature(i);
			strBuilder.append(nature == Nature.FREE ? nature.symbol() : nature.symbol() + " 0");
			strBuilder.append('\n');
		}

		return strBuilder.toString();
	}

	public static enum ObjectiveGoal {
		MIN(-1), MAX(1);

		private final int code;

		private ObjectiveGoal(int code) {
			this.code = code;
		}

		public int code() {
			return code;
		}

		public static ObjectiveGoal fromCode(int code) {
			for (ObjectiveGoal goal : values()) {
				if (goal.code == code) {
					return goal;
				}
			}
			throw new IllegalArgumentException("invalid MinMax code " + code);
		}
	}

	/**
	 * Relation of a constraint's left hand side to its right hand side.
	 */
	public static enum Sense {
		LEQ(-1, "<="), EQ(0, "="), GEQ(1, ">=");

		private final int code;
		private final String symbol;

		private Sense(int code, String symbol) {
			this.code = code;
			this.symbol = symbol;
		}

		public int code() {
			return code;
		}

		public String symbol() {
			return symbol;
		}

		public static Sense fromCode(int code) {
			for (Sense sense : values()) {
				if (sense.code == code) {
					return sense;
				}
			}
			throw new IllegalArgumentException("invalid Eqin code " + code);
		}

		public static Sense fromSymbol(String symbol) {
			for (Sense sense : values()) {
				if (sense.symbol.equals(symbol)) {
					return sense;
				}
			}
			throw new IllegalArgumentException("invalid relation " + symbol);
		}
	}

	/**
	 * Sign restriction of a variable.
	 */
	public static enum Nature {
		NON_POSITIVE(-1, "<="), FREE(0, "free"), NON_NEGATIVE(1, ">=");

		private final int code;
		private final String symbol;

		private Nature(int code, String symbol) {
			this.code = code;
			this.symbol = symbol;
		}

		public int code() {
			return code;
		}

		public String symbol() {
			return symbol;
		}

		public static Nature fromCode(int code) {
			for (Nature nature : values()) {
				if (nature.code == code) {
					return nature;
				}
			}
			throw new IllegalArgumentException("invalid natural constraint code " + code);
		}

		/**
		 * @param symbol
		 *          <code>&lt;=</code>, <code>&gt;=</code> or <code>free</code>
		 *          in any case
		 */
		public static Nature fromSymbol(String symbol) {
			for (Nature nature : values()) {
				if (nature.symbol.equalsIgnoreCase(symbol)) {
					return nature;
				}
			}
			throw new IllegalArgumentException("invalid natural constraint " + symbol);
		}
	}
}
