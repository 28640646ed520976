package de.tu_berlin.coga.jlpp.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import de.tu_berlin.coga.jlpp.exceptions.LPParseException;
import de.tu_berlin.coga.jlpp.parse.Token.Type;

/**
 * Parses linear expressions of the form <code>[+|-][coefficient]x&lt;index&gt;</code>
 * repeated, e.g. <code>2x1 - x3 + 10x4</code>.
 * <p>
 * The sign of the first term may be left out, it is then taken as
 * <code>+</code>. A later term without a sign means two variables were
 * written next to each other (<code>x1x2</code>), which is a product and
 * thus rejected as non-linear. A missing coefficient is read as 1.
 */
public final class TermParser {
	private static final Logger LOGGER = LoggerFactory.getLogger(TermParser.class);

	private TermParser() {
	}

	/**
	 * Parses an expression into a dense coefficient vector.
	 * <p>
	 * If a variable occurs in several terms, the last one wins.
	 *
	 * @param expression
	 *          the expression, nothing but terms
	 * @param variables
	 *          the canonical variable list; every variable of the expression
	 *          must be part of it
	 * @return the coefficients, indexed like <code>variables</code>, with 0 for
	 *         variables the expression does not mention
	 */
	public static double[] coefficients(Segment expression, List<Variable> variables) throws LPParseException {
		double[] coefficients = new double[variables.size()];
		for (Term term : parse(expression)) {
			int index = Variable.indexOf(variables, term.variable());
			Preconditions.checkArgument(index >= 0, "variable %s is not in the variable list %s", term.variable(),
					variables);
			coefficients[index] = term.value();
		}
		return coefficients;
	}

	/**
	 * Parses an expression that has to consist of terms only.
	 *
	 * @throws LPParseException
	 *           <code>UNEXPECTED_TOKEN</code> if anything but a term is found,
	 *           <code>NON_LINEAR_TERM</code> if a term after the first has no
	 *           sign, <code>INVALID_NUMBER</code> if a coefficient overflows
	 */
	public static List<Term> parse(Segment expression) throws LPParseException {
		List<Token> tokens = Lexer.tokenize(expression);
		List<Term> terms = new ArrayList<Term>();
		int pos = 0;
		while (pos < tokens.size()) {
			int end = matchTerm(tokens, pos);
			if (end < 0) {
				throw unexpected(expression, tokens, pos);
			}
			addTerm(expression, terms, tokens, pos, end);
			pos = end;
		}
		return terms;
	}

	/**
	 * Collects the terms of a text that may contain other things as well, such
	 * as a whole constraint line with relation and right hand side. Tokens that
	 * do not form a term are skipped; the sign rule still holds.
	 *
	 * @throws LPParseException
	 *           <code>NON_LINEAR_TERM</code> if a term after the first has no
	 *           sign
	 */
	public static List<Term> findTerms(Segment text) throws LPParseException {
		List<Token> tokens = Lexer.tokenize(text);
		List<Term> terms = new ArrayList<Term>();
		int pos = 0;
		while (pos < tokens.size()) {
			int end = matchTerm(tokens, pos);
			if (end < 0) {
				pos++;
			} else {
				addTerm(text, terms, tokens, pos, end);
				pos = end;
			}
		}
		return terms;
	}

	/**
	 * @return the index after the term starting at <code>pos</code>, or -1 if
	 *         no term starts there
	 */
	private static int matchTerm(List<Token> tokens, int pos) {
		int i = skip(tokens, skip(tokens, pos, Type.SIGN), Type.NUMBER);
		if (i < tokens.size() && tokens.get(i).is(Type.VARIABLE)) {
			return i + 1;
		}
		return -1;
	}

	private static int skip(List<Token> tokens, int pos, Type type) {
		if (pos < tokens.size() && tokens.get(pos).is(type)) {
			return pos + 1;
		}
		return pos;
	}

	private static void addTerm(Segment expression, List<Term> terms, List<Token> tokens, int from, int to)
			throws LPParseException {
		int sign = 1;
		boolean signed = false;
		double magnitude = 1;
		StringBuilder text = new StringBuilder();
		String variable = null;
		for (int i = from; i < to; i++) {
			Token token = tokens.get(i);
			text.append(token.text());
			switch (token.type()) {
			case SIGN:
				signed = true;
				sign = token.text().equals("-") ? -1 : 1;
				break;
			case NUMBER:
				magnitude = Double.parseDouble(token.text());
				if (Double.isInfinite(magnitude)) {
					throw LPParseException.invalidNumber(token.text(), expression.lineOf(token.offset()),
							expression.columnOf(token.offset()));
				}
				break;
			case VARIABLE:
				variable = token.text().toLowerCase(Locale.ROOT);
				break;
			default:
				throw new IllegalStateException("unexpected " + token + " in a term");
			}
		}

		int offset = tokens.get(from).offset();
		if (!terms.isEmpty() && !signed) {
			throw LPParseException.nonLinearTerm(Lexer.compact(expression), text.toString(), expression.lineOf(offset),
					expression.columnOf(offset));
		}
		LOGGER.trace("..term {}: {} * {}", text, sign * magnitude, variable);
		terms.add(new Term(sign, signed, magnitude, variable, text.toString(), offset));
	}

	private static LPParseException unexpected(Segment expression, List<Token> tokens, int pos) {
		int i = skip(tokens, skip(tokens, pos, Type.SIGN), Type.NUMBER);
		if (i < tokens.size()) {
			Token token = tokens.get(i);
			return LPParseException.unexpectedToken(Lexer.compact(expression), token.text(),
					expression.lineOf(token.offset()), expression.columnOf(token.offset()));
		}
		return LPParseException.unexpectedToken(Lexer.compact(expression), null, expression.lineOf(expression.end()),
				expression.columnOf(expression.end()));
	}
}
