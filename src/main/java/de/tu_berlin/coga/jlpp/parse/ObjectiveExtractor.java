package de.tu_berlin.coga.jlpp.parse;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.tu_berlin.coga.jlpp.exceptions.LPParseException;

/**
 * Reads the objective section: a direction keyword (<code>max</code>,
 * <code>min</code> and their long forms) followed by the objective
 * expression. Anything in front of the keyword is ignored, and so is a label
 * right after it: <code>max: 2x1</code>, <code>max z = 2x1</code>.
 */
public final class ObjectiveExtractor {
	private static final Logger LOGGER = LoggerFactory.getLogger(ObjectiveExtractor.class);

	/** a colon and/or a name followed by <code>=</code> or <code>:</code>; never a variable */
	private static final Pattern LABEL = Pattern.compile("\\s*:?\\s*(?:(?!x[0-9])[a-z_]\\w*\\s*[:=])?",
			Pattern.CASE_INSENSITIVE);

	private ObjectiveExtractor() {
	}

	public static Objective extract(Segment section, List<Variable> variables) throws LPParseException {
		int direction = direction(section);
		double[] c = TermParser.coefficients(expression(section), variables);
		return new Objective(direction, c);
	}

	/**
	 * @return 1 if the first direction keyword maximises, -1 if it minimises
	 */
	public static int direction(Segment section) throws LPParseException {
		Matcher matcher = find(section);
		int direction = Keywords.directionCode(matcher.group(1));
		LOGGER.debug("recognised a {} problem", direction == 1 ? "maximising" : "minimising");
		return direction;
	}

	/**
	 * @return the part of the section after the first direction keyword and
	 *         its label, if any
	 */
	public static Segment expression(Segment section) throws LPParseException {
		Matcher label = LABEL.matcher(section.source().text());
		label.region(find(section).end(), section.end());
		label.lookingAt();
		return section.slice(label.end(), section.end());
	}

	private static Matcher find(Segment section) throws LPParseException {
		Matcher matcher = Keywords.DIRECTION_PATTERN.matcher(section.source().text());
		matcher.region(section.start(), section.end());
		if (!matcher.find()) {
			int offset = section.firstNonBlank();
			throw LPParseException.missingDirectionKeyword(section.lineOf(offset), section.columnOf(offset));
		}
		return matcher;
	}
}
