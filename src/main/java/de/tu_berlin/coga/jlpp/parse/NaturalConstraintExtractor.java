package de.tu_berlin.coga.jlpp.parse;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.tu_berlin.coga.jlpp.LinearProblem.Nature;
import de.tu_berlin.coga.jlpp.exceptions.LPParseException;

/**
 * Reads the optional natural constraint section, one declaration per line:
 * <code>[variable] (&lt;=|&gt;=|free) [anything]</code>, e.g.
 * <code>x1 &lt;= 0</code> or <code>x2 free</code>. The variable is the word
 * right in front of the relation; words before it are ignored.
 * <p>
 * Variables without a declaration are non-negative. A declaration for a
 * variable the problem does not use is accepted and has no effect; it is
 * reported as a {@link Diagnostic}.
 */
public final class NaturalConstraintExtractor {
	private static final Logger LOGGER = LoggerFactory.getLogger(NaturalConstraintExtractor.class);

	private static final Pattern RELATION = Pattern.compile("<=|>=|free(?![a-z0-9_])", Pattern.CASE_INSENSITIVE);
	/** the word right in front of the relation */
	private static final Pattern NAME = Pattern.compile("\\w*$");

	private NaturalConstraintExtractor() {
	}

	/**
	 * @param section
	 *          the natural constraint section, <code>null</code> if the
	 *          problem has none
	 * @param variables
	 *          the canonical variable list
	 */
	public static NaturalConstraints extract(Segment section, List<Variable> variables) throws LPParseException {
		int[] natures = new int[variables.size()];
		Arrays.fill(natures, Nature.NON_NEGATIVE.code());
		if (section == null) {
			return new NaturalConstraints(natures, new ArrayList<Diagnostic>());
		}
		return extract(section.lines(), variables);
	}

	/**
	 * @param lines
	 *          the non-blank lines of the natural constraint section
	 * @throws LPParseException
	 *           <code>MALFORMED_NATURAL_CONSTRAINT</code> unless a line has
	 *           exactly one relation
	 */
	public static NaturalConstraints extract(List<Segment> lines, List<Variable> variables) throws LPParseException {
		int[] natures = new int[variables.size()];
		Arrays.fill(natures, Nature.NON_NEGATIVE.code());
		List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

		for (int i = 0; i < lines.size(); i++) {
			Segment line = lines.get(i);
			int constrNo = i + 1;
			String text = line.text();
			int lineStart = line.firstNonBlank();
			LOGGER.trace("parsing natural constraint {}: '{}'", constrNo, text.trim());

			Matcher matcher = RELATION.matcher(text);
			int count = 0;
			String relation = null;
			int relationStart = -1;
			while (matcher.find()) {
				if (count++ == 0) {
					relation = matcher.group();
					relationStart = matcher.start();
				}
			}
			if (count != 1) {
				throw LPParseException.malformedNaturalConstraint(constrNo, text.trim(), line.lineOf(lineStart),
						line.columnOf(lineStart));
			}
			Matcher nameMatcher = NAME.matcher(text.substring(0, relationStart).trim());
			nameMatcher.find();
			String name = nameMatcher.group().toLowerCase(Locale.ROOT);

			int index = Variable.indexOf(variables, name);
			if (index < 0) {
				Diagnostic ignored = new Diagnostic(Diagnostic.Kind.UNKNOWN_VARIABLE_REFERENCE_IGNORED, constrNo,
						line.lineOf(lineStart), name, text.trim());
				LOGGER.warn(ignored.message());
				diagnostics.add(ignored);
				continue;
			}
			Nature nature = Nature.fromSymbol(relation);
			LOGGER.trace("..{} is {}", name, nature);
			natures[index] = nature.code();
		}
		return new NaturalConstraints(natures, diagnostics);
	}
}
