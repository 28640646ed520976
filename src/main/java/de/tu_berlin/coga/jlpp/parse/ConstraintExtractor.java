package de.tu_berlin.coga.jlpp.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.tu_berlin.coga.jlpp.LinearProblem.Sense;
import de.tu_berlin.coga.jlpp.exceptions.LPParseException;
import de.tu_berlin.coga.jlpp.parse.Token.Type;

/**
 * Reads the constraint section, one constraint per line:
 * <code>expression (&lt;=|=|&gt;=) number</code>.
 */
public final class ConstraintExtractor {
	private static final Logger LOGGER = LoggerFactory.getLogger(ConstraintExtractor.class);

	static final Pattern NUMBER = Pattern.compile("[+-]?(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");

	private ConstraintExtractor() {
	}

	public static Constraints extract(Segment section, List<Variable> variables) throws LPParseException {
		return extract(section.lines(), variables);
	}

	/**
	 * @param lines
	 *          the non-blank lines of the constraint section
	 * @param variables
	 *          the canonical variable list
	 * @throws LPParseException
	 *           <code>MALFORMED_CONSTRAINT</code> unless a line has exactly one
	 *           relation, <code>EMPTY_LEFT_SIDE</code> if all coefficients of a
	 *           line are zero, <code>EMPTY_RIGHT_SIDE</code> or
	 *           <code>INVALID_NUMBER</code> for a missing, broken or
	 *           overflowing right hand side, or any error of
	 *           {@link TermParser#parse(Segment)}
	 */
	public static Constraints extract(List<Segment> lines, List<Variable> variables) throws LPParseException {
		double[][] a = new double[lines.size()][];
		int[] eqin = new int[lines.size()];
		double[] b = new double[lines.size()];

		for (int i = 0; i < lines.size(); i++) {
			Segment line = lines.get(i);
			int constrNo = i + 1;
			int lineStart = line.firstNonBlank();
			String text = line.text().trim();
			LOGGER.trace("parsing constraint {}: '{}'", constrNo, text);

			List<Token> relations = new ArrayList<Token>();
			for (Token token : Lexer.tokenize(line)) {
				if (token.is(Type.RELATION)) {
					relations.add(token);
				}
			}
			if (relations.size() != 1) {
				throw LPParseException.malformedConstraint(constrNo, text, line.lineOf(lineStart),
						line.columnOf(lineStart));
			}
			Token relation = relations.get(0);

			double[] row = TermParser.coefficients(line.slice(line.start(), relation.offset()), variables);
			if (isZero(row)) {
				throw LPParseException.emptyLeftSide(constrNo, text, line.lineOf(lineStart), line.columnOf(lineStart));
			}
			a[i] = row;

			Segment right = line.slice(relation.end(), line.end());
			String rhs = Lexer.compact(right);
			if (rhs.isEmpty()) {
				throw LPParseException.emptyRightSide(constrNo, text, line.lineOf(relation.offset()),
						line.columnOf(relation.offset()));
			}
			int offset = right.firstNonBlank();
			if (!NUMBER.matcher(rhs).matches()) {
				throw LPParseException.invalidNumber(constrNo, rhs, line.lineOf(offset), line.columnOf(offset));
			}
			b[i] = Double.parseDouble(rhs);
			if (Double.isInfinite(b[i])) {
				throw LPParseException.invalidNumber(constrNo, rhs, line.lineOf(offset), line.columnOf(offset));
			}

			eqin[i] = Sense.fromSymbol(relation.text()).code();
			LOGGER.trace("..sense is {}, rhs is {}", relation.text(), b[i]);
		}
		LOGGER.debug("{} constraints", lines.size());
		return new Constraints(a, eqin, b);
	}

	private static boolean isZero(double[] row) {
		for (double coefficient : row) {
			if (coefficient != 0) {
				return false;
			}
		}
		return true;
	}
}
