package de.tu_berlin.coga.jlpp;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class LPWriterTest {

	private static final String EXAMPLE_1 = "MinMax = 1\n\n"
			+ "c =\n[2.0, 3.0]\n\n"
			+ "A =\n[[1.0, 1.0],\n [1.0, -1.0]]\n\n"
			+ "Eqin =\n[[-1],\n [1]]\n\n"
			+ "b =\n[[4.0],\n [1.0]]\n\n"
			+ "naturalConstraints =\n[1, 1]\n\n";

	private static LinearProblem example() {
		return new LinearProblem(1, new double[] { 2, 3 }, new double[][] { { 1, 1 }, { 1, -1 } }, new int[] { -1, 1 },
				new double[] { 4, 1 }, null);
	}

	@Test
	public void format() {
		assertEquals(EXAMPLE_1, LPWriter.format(example()));
	}

	@Test
	public void writer() throws IOException {
		StringWriter out = new StringWriter();
		LPWriter.write(example(), out);

		assertEquals(EXAMPLE_1, out.toString());
	}

	@Test
	public void file(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("example1.txt");
		LPWriter.write(example(), file);

		assertEquals(EXAMPLE_1, new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
	}

	@Test
	public void noConstraints() {
		LinearProblem lp = new LinearProblem(-1, new double[] { 1 }, new double[0][], new int[0], new double[0], null);

		assertEquals("MinMax = -1\n\nc =\n[1.0]\n\nA =\n[]\n\nEqin =\n[]\n\nb =\n[]\n\nnaturalConstraints =\n[1]\n\n",
				LPWriter.format(lp));
	}
}
