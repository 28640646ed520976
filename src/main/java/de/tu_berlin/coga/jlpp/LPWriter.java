package de.tu_berlin.coga.jlpp;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Writes a problem as a readable block of its vectors and matrices. The
 * output is meant for people; use {@link LPJsonCodec} to exchange problems
 * between programs.
 */
public final class LPWriter {

	private LPWriter() {
	}

	public static String format(LinearProblem problem) {
		StringBuilder out = new StringBuilder();
		out.append("MinMax = ").append(problem.getMinMax()).append("\n\n");

		// 1 x n
		out.append("c =\n").append(Arrays.toString(problem.getC())).append("\n\n");

		// m x n
		out.append("A =\n");
		double[][] a = problem.getA();
		out.append('[');
		for (int i = 0; i < a.length; i++) {
			if (i > 0) {
				out.append(",\n ");
			}
			out.append(Arrays.toString(a[i]));
		}
		out.append("]\n\n");

		// m x 1
		int[] eqin = problem.getEqin();
		out.append("Eqin =\n");
		out.append('[');
		for (int i = 0; i < eqin.length; i++) {
			if (i > 0) {
				out.append(",\n ");
			}
			out.append('[').append(eqin[i]).append(']');
		}
		out.append("]\n\n");

		// m x 1
		double[] b = problem.getB();
		out.append("b =\n");
		out.append('[');
		for (int i = 0; i < b.length; i++) {
			if (i > 0) {
				out.append(",\n ");
			}
			out.append('[').append(b[i]).append(']');
		}
		out.append("]\n\n");

		// 1 x n
		out.append("naturalConstraints =\n").append(Arrays.toString(problem.getNaturalConstraints())).append("\n\n");
		return out.toString();
	}

	public static void write(LinearProblem problem, Writer out) throws IOException {
		out.write(format(problem));
		out.flush();
	}

	public static void write(LinearProblem problem, Path file) throws IOException {
		Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
		try {
			write(problem, out);
		} finally {
			out.close();
		}
	}
}
