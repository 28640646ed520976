package de.tu_berlin.coga.jlpp.parse;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import de.tu_berlin.coga.jlpp.exceptions.LPParseException;

/**
 * Finds the variables of a problem and fixes their order.
 * <p>
 * The canonical order is the lexicographic order of the names, so
 * <code>x10</code> comes before <code>x2</code>. It only depends on the set
 * of names in the text, never on where they occur first.
 */
public final class VariableDiscovery {
	private static final Logger LOGGER = LoggerFactory.getLogger(VariableDiscovery.class);

	private VariableDiscovery() {
	}

	/**
	 * @param objectiveExpression
	 *          the objective without its direction keyword
	 * @param constraintLines
	 *          the raw constraint lines, relation and right hand side included
	 * @throws LPParseException
	 *           <code>NON_LINEAR_TERM</code> if any of the texts multiplies two
	 *           variables
	 */
	public static ImmutableList<Variable> discover(Segment objectiveExpression, List<Segment> constraintLines)
			throws LPParseException {
		SortedSet<String> names = new TreeSet<String>();
		collect(objectiveExpression, names);
		for (Segment line : constraintLines) {
			collect(line, names);
		}

		ImmutableList.Builder<Variable> variables = ImmutableList.builder();
		int index = 0;
		for (String name : names) {
			variables.add(new Variable(name, index++));
		}
		ImmutableList<Variable> result = variables.build();
		LOGGER.debug("{} variables: {}", result.size(), result);
		return result;
	}

	private static void collect(Segment text, SortedSet<String> names) throws LPParseException {
		for (Term term : TermParser.findTerms(text)) {
			if (names.add(term.variable())) {
				LOGGER.trace("new variable '{}'", term.variable());
			}
		}
	}
}
