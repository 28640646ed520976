package de.tu_berlin.coga.jlpp.parse;

import java.util.regex.Pattern;

/**
 * Keywords of the problem text. Keywords are case-insensitive and must not
 * be glued to the letters of a neighbouring word; a directly following digit
 * is fine (<code>max2x1</code>).
 */
final class Keywords {

	static final String DIRECTION = "max(?:imi[sz]e)?|min(?:imi[sz]e)?";

	private static final String BEFORE = "(?<![a-z0-9_])";
	private static final String AFTER = "(?![a-z_])";

	/** group 1: the direction keyword */
	static final Pattern DIRECTION_PATTERN = Pattern.compile(BEFORE + "(" + DIRECTION + ")" + AFTER,
			Pattern.CASE_INSENSITIVE);

	/**
	 * group 1: direction, group 2: start of the constraints, group 3: start of
	 * the natural constraints, group 4: end of the problem
	 */
	static final Pattern SECTION_PATTERN = Pattern.compile(BEFORE + "(?:(" + DIRECTION + ")"
			+ "|(s\\.?[ \\t]*t\\.?|subject[ \\t]*to|such[ \\t]+that)" + "|(with)" + "|(end))" + AFTER,
			Pattern.CASE_INSENSITIVE);

	private Keywords() {
	}

	/**
	 * @return 1 for a maximising keyword, -1 for a minimising one
	 */
	static int directionCode(String keyword) {
		return keyword.regionMatches(true, 0, "max", 0, 3) ? 1 : -1;
	}
}
