package de.tu_berlin.coga.jlpp;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

import de.tu_berlin.coga.jlpp.LinearProblem.Nature;
import de.tu_berlin.coga.jlpp.LinearProblem.ObjectiveGoal;
import de.tu_berlin.coga.jlpp.LinearProblem.Sense;

public class LinearProblemTest {

	private static LinearProblem example() {
		return new LinearProblem(1, new double[] { 2, 3 }, new double[][] { { 1, 1 }, { 1, -1 } }, new int[] { -1, 1 },
				new double[] { 4, 1 }, new int[] { 1, 0 });
	}

	@Test
	public void dimensionsAndCodes() {
		LinearProblem lp = example();

		assertEquals(2, lp.getNumVariables());
		assertEquals(2, lp.getNumConstraints());
		assertEquals(ObjectiveGoal.MAX, lp.getObjectiveGoal());
		assertEquals(Sense.LEQ, lp.getSense(0));
		assertEquals(Sense.GEQ, lp.getSense(1));
		assertEquals(Nature.NON_NEGATIVE, lp.getNature(0));
		assertEquals(Nature.FREE, lp.getNature(1));
		assertEquals(ImmutableList.of("x1", "x2"), lp.getVariableNames());
	}

	@Test
	public void missingNaturalConstraintsAreNonNegative() {
		LinearProblem lp = new LinearProblem(-1, new double[] { 1, 2, 3 }, new double[0][], new int[0], new double[0],
				null);

		assertArrayEquals(new int[] { 1, 1, 1 }, lp.getNaturalConstraints());
		assertEquals(0, lp.getNumConstraints());
	}

	@Test
	public void arraysAreCopied() {
		double[] c = { 2, 3 };
		double[][] a = { { 1, 1 } };
		LinearProblem lp = new LinearProblem(1, c, a, new int[] { 0 }, new double[] { 1 }, null);

		c[0] = 99;
		a[0][1] = 99;
		lp.getA()[0][0] = 99;
		lp.getB()[0] = 99;

		assertArrayEquals(new double[] { 2, 3 }, lp.getC(), 0.0);
		assertArrayEquals(new double[] { 1, 1 }, lp.getA()[0], 0.0);
		assertArrayEquals(new double[] { 1 }, lp.getB(), 0.0);
	}

	@Test
	public void namesDoNotTakePartInEquality() {
		LinearProblem named = new LinearProblem(1, new double[] { 2, 3 }, new double[][] { { 1, 1 }, { 1, -1 } },
				new int[] { -1, 1 }, new double[] { 4, 1 }, new int[] { 1, 0 }, new String[] { "x3", "x7" });

		assertEquals(example(), named);
		assertEquals(example().hashCode(), named.hashCode());
		assertEquals("x7", named.getVariableName(1));
	}

	@Test
	public void differentCodesAreNotEqual() {
		LinearProblem other = new LinearProblem(1, new double[] { 2, 3 }, new double[][] { { 1, 1 }, { 1, -1 } },
				new int[] { -1, 1 }, new double[] { 4, 1 }, new int[] { 1, 1 });

		assertNotEquals(example(), other);
	}

	@Test
	public void rejectsInconsistentDimensions() {
		assertThrows(IllegalArgumentException.class, () -> new LinearProblem(1, new double[] { 1, 2 },
				new double[][] { { 1 } }, new int[] { 0 }, new double[] { 1 }, null));
		assertThrows(IllegalArgumentException.class, () -> new LinearProblem(1, new double[] { 1 },
				new double[][] { { 1 } }, new int[] { 0, 1 }, new double[] { 1 }, null));
		assertThrows(IllegalArgumentException.class, () -> new LinearProblem(1, new double[] { 1 },
				new double[][] { { 1 } }, new int[] { 0 }, new double[] { 1 }, new int[] { 1, 1 }));
		assertThrows(IllegalArgumentException.class, () -> new LinearProblem(1, new double[] { 1 },
				new double[][] { { 1 } }, new int[] { 0 }, new double[] { 1 }, null, new String[] { "x1", "x2" }));
	}

	@Test
	public void rejectsInvalidCodes() {
		assertThrows(IllegalArgumentException.class, () -> new LinearProblem(0, new double[] { 1 },
				new double[][] { { 1 } }, new int[] { 0 }, new double[] { 1 }, null));
		assertThrows(IllegalArgumentException.class, () -> new LinearProblem(1, new double[] { 1 },
				new double[][] { { 1 } }, new int[] { 2 }, new double[] { 1 }, null));
		assertThrows(IllegalArgumentException.class, () -> new LinearProblem(1, new double[] { 1 },
				new double[][] { { 1 } }, new int[] { 0 }, new double[] { 1 }, new int[] { -2 }));
	}

	@Test
	public void rejectsNumbersThatAreNotFinite() {
		assertThrows(IllegalArgumentException.class, () -> new LinearProblem(1, new double[] { 1 },
				new double[][] { { 1 } }, new int[] { 0 }, new double[] { Double.POSITIVE_INFINITY }, null));
		assertThrows(IllegalArgumentException.class, () -> new LinearProblem(1, new double[] { Double.NaN },
				new double[][] { { 1 } }, new int[] { 0 }, new double[] { 1 }, null));
		assertThrows(IllegalArgumentException.class, () -> new LinearProblem(1, new double[] { 1 },
				new double[][] { { Double.NEGATIVE_INFINITY } }, new int[] { 0 }, new double[] { 1 }, null));
	}

	@Test
	public void symbols() {
		assertEquals(Sense.EQ, Sense.fromSymbol("="));
		assertEquals(Nature.FREE, Nature.fromSymbol("FREE"));
		assertEquals(Nature.NON_POSITIVE, Nature.fromSymbol("<="));
		assertThrows(IllegalArgumentException.class, () -> Sense.fromSymbol("=<"));
	}

	@Test
	public void algebraicForm() {
		String text = example().toString();

		assertTrue(text.startsWith("max\t2.0*x1\t3.0*x2\t"), text);
		assertTrue(text.contains("c1:\t1.0*x1\t1.0*x2\t <= 4.0\n"), text);
		assertTrue(text.contains("c2:\t1.0*x1\t-1.0*x2\t >= 1.0\n"), text);
		assertTrue(text.endsWith("with:\nx1 >= 0\nx2 free\n"), text);
	}
}
