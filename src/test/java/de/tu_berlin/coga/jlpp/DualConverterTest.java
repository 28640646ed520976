package de.tu_berlin.coga.jlpp;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class DualConverterTest {

	private static LinearProblem example() {
		return new LinearProblem(1, new double[] { 2, 3 }, new double[][] { { 1, 1 }, { 1, -1 } }, new int[] { -1, 1 },
				new double[] { 4, 1 }, new int[] { 1, 1 });
	}

	@Test
	public void dualOfMaximisation() {
		LinearProblem dual = DualConverter.toDual(example());

		assertEquals(-1, dual.getMinMax());
		assertArrayEquals(new double[] { 4, 1 }, dual.getC(), 0.0);
		assertArrayEquals(new double[] { 1, 1 }, dual.getA()[0], 0.0);
		assertArrayEquals(new double[] { 1, -1 }, dual.getA()[1], 0.0);
		assertArrayEquals(new int[] { 1, 1 }, dual.getEqin());
		assertArrayEquals(new double[] { 2, 3 }, dual.getB(), 0.0);
		assertArrayEquals(new int[] { 1, -1 }, dual.getNaturalConstraints());
		assertEquals(ImmutableList.of("w1", "w2"), dual.getVariableNames());
	}

	@Test
	public void dualOfMinimisation() {
		LinearProblem primal = new LinearProblem(-1, new double[] { 1, 0, -2 },
				new double[][] { { 1, 2, 3 }, { 0, -1, 4 } }, new int[] { 0, -1 }, new double[] { 5, 6 },
				new int[] { 1, 0, -1 });

		LinearProblem dual = DualConverter.toDual(primal);

		assertEquals(1, dual.getMinMax());
		assertEquals(3, dual.getNumConstraints());
		assertEquals(2, dual.getNumVariables());
		assertArrayEquals(new double[] { 5, 6 }, dual.getC(), 0.0);
		assertArrayEquals(new double[] { 1, 0 }, dual.getA()[0], 0.0);
		assertArrayEquals(new double[] { 2, -1 }, dual.getA()[1], 0.0);
		assertArrayEquals(new double[] { 3, 4 }, dual.getA()[2], 0.0);
		assertArrayEquals(new int[] { -1, 0, 1 }, dual.getEqin());
		assertArrayEquals(new double[] { 1, 0, -2 }, dual.getB(), 0.0);
		assertArrayEquals(new int[] { 0, -1 }, dual.getNaturalConstraints());
	}

	@Test
	public void dualOfDualIsPrimal() {
		LinearProblem primal = example();
		assertEquals(primal, DualConverter.toDual(DualConverter.toDual(primal)));

		LinearProblem min = new LinearProblem(-1, new double[] { 1, 0, -2 },
				new double[][] { { 1, 2, 3 }, { 0, -1, 4 } }, new int[] { 0, -1 }, new double[] { 5, 6 },
				new int[] { 1, 0, -1 });
		assertEquals(min, DualConverter.toDual(DualConverter.toDual(min)));
	}

	@Test
	public void primalIsNotChanged() {
		LinearProblem primal = example();
		LinearProblem copy = example();

		DualConverter.toDual(primal);

		assertEquals(copy, primal);
		assertEquals(ImmutableList.of("x1", "x2"), primal.getVariableNames());
	}

	@Test
	public void defaultNaturalConstraints() {
		LinearProblem primal = new LinearProblem(1, new double[] { 1, 1, 1 }, new double[][] { { 1, 2, 3 } },
				new int[] { -1 }, new double[] { 7 }, null);

		LinearProblem dual = DualConverter.toDual(primal);

		assertArrayEquals(new int[] { 1, 1, 1 }, dual.getEqin());
		assertArrayEquals(new int[] { 1 }, dual.getNaturalConstraints());
	}
}
