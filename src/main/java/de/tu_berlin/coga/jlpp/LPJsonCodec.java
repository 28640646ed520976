package de.tu_berlin.coga.jlpp;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Reads and writes problems in JSON:
 *
 * <pre>
 * {
 *   "MinMax" : 1,
 *   "c" : [ 2.0, 3.0 ],
 *   "A" : [ [ 1.0, 1.0 ], [ 1.0, -1.0 ] ],
 *   "Eqin" : [ -1, 1 ],
 *   "b" : [ 4.0, 1.0 ],
 *   "naturalConstraints" : [ 1, 1 ]
 * }
 * </pre>
 *
 * Reading a written problem gives an equal one. Variable names are not
 * stored; a problem read back has variables <code>x1 ... xn</code>. When
 * reading, vectors may also be given as columns (<code>[[4.0], [1.0]]</code>)
 * and a missing <code>naturalConstraints</code> makes all variables
 * non-negative.
 */
public final class LPJsonCodec {
	static final String MIN_MAX = "MinMax";
	static final String C = "c";
	static final String A = "A";
	static final String EQIN = "Eqin";
	static final String B = "b";
	static final String NATURAL_CONSTRAINTS = "naturalConstraints";

	private final ObjectMapper mapper;

	public LPJsonCodec() {
		this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
	}

	public LPJsonCodec(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public String toJson(LinearProblem problem) throws IOException {
		return mapper.writeValueAsString(toTree(problem));
	}

	public void write(LinearProblem problem, Writer out) throws IOException {
		mapper.writeValue(out, toTree(problem));
	}

	public void write(LinearProblem problem, Path file) throws IOException {
		Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
		try {
			write(problem, out);
		} finally {
			out.close();
		}
	}

	public LinearProblem fromJson(String json) throws IOException {
		return fromTree(mapper.readTree(json));
	}

	public LinearProblem read(Reader in) throws IOException {
		return fromTree(mapper.readTree(in));
	}

	public LinearProblem read(Path file) throws IOException {
		Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
		try {
			return read(in);
		} finally {
			in.close();
		}
	}

	ObjectNode toTree(LinearProblem problem) {
		ObjectNode root = mapper.createObjectNode();
		root.put(MIN_MAX, problem.getMinMax());

		ArrayNode c = root.putArray(C);
		for (double value : problem.getC()) {
			c.add(value);
		}

		ArrayNode a = root.putArray(A);
		for (double[] row : problem.getA()) {
			ArrayNode rowNode = a.addArray();
			for (double value : row) {
				rowNode.add(value);
			}
		}

		ArrayNode eqin = root.putArray(EQIN);
		for (int code : problem.getEqin()) {
			eqin.add(code);
		}

		ArrayNode b = root.putArray(B);
		for (double value : problem.getB()) {
			b.add(value);
		}

		ArrayNode naturalConstraints = root.putArray(NATURAL_CONSTRAINTS);
		for (int code : problem.getNaturalConstraints()) {
			naturalConstraints.add(code);
		}
		return root;
	}

	LinearProblem fromTree(JsonNode root) throws IOException {
		if (root == null || !root.isObject()) {
			throw new IOException("expected a JSON object");
		}
		int minMax = toInt(required(root, MIN_MAX), MIN_MAX);
		double[] c = toDoubles(required(root, C), C);
		JsonNode aNode = required(root, A);
		if (!aNode.isArray()) {
			throw new IOException("'" + A + "' must be an array of arrays");
		}
		double[][] a = new double[aNode.size()][];
		for (int i = 0; i < a.length; i++) {
			a[i] = toDoubles(aNode.get(i), A + "[" + i + "]");
		}
		int[] eqin = toInts(required(root, EQIN), EQIN);
		double[] b = toDoubles(required(root, B), B);
		JsonNode naturalNode = root.get(NATURAL_CONSTRAINTS);
		int[] naturalConstraints = naturalNode == null || naturalNode.isNull() ? null
				: toInts(naturalNode, NATURAL_CONSTRAINTS);

		try {
			return new LinearProblem(minMax, c, a, eqin, b, naturalConstraints);
		} catch (IllegalArgumentException e) {
			throw new IOException("invalid problem: " + e.getMessage(), e);
		}
	}

	private static JsonNode required(JsonNode root, String field) throws IOException {
		JsonNode node = root.get(field);
		if (node == null || node.isNull()) {
			throw new IOException("missing field '" + field + "'");
		}
		return node;
	}

	private static double[] toDoubles(JsonNode node, String field) throws IOException {
		if (!node.isArray()) {
			throw new IOException("'" + field + "' must be an array of numbers");
		}
		double[] values = new double[node.size()];
		for (int i = 0; i < values.length; i++) {
			JsonNode element = unwrap(node.get(i));
			if (!element.isNumber()) {
				throw new IOException("'" + field + "' must be an array of numbers, found " + element);
			}
			values[i] = element.doubleValue();
			if (Double.isInfinite(values[i])) {
				throw new IOException("'" + field + "' holds " + element + ", which is out of range");
			}
		}
		return values;
	}

	private static int[] toInts(JsonNode node, String field) throws IOException {
		if (!node.isArray()) {
			throw new IOException("'" + field + "' must be an array of integers");
		}
		int[] values = new int[node.size()];
		for (int i = 0; i < values.length; i++) {
			values[i] = toInt(unwrap(node.get(i)), field);
		}
		return values;
	}

	/**
	 * Column vectors written as <code>[[-1], [1]]</code> hold their values in
	 * one-element arrays.
	 */
	private static JsonNode unwrap(JsonNode element) {
		if (element.isArray() && element.size() == 1) {
			return element.get(0);
		}
		return element;
	}

	private static int toInt(JsonNode node, String field) throws IOException {
		if (!node.isNumber() || node.doubleValue() != Math.rint(node.doubleValue())) {
			throw new IOException("'" + field + "' must hold integers, found " + node);
		}
		if (!node.canConvertToInt()) {
			throw new IOException("'" + field + "' holds " + node + ", which is out of range");
		}
		return node.intValue();
	}
}
