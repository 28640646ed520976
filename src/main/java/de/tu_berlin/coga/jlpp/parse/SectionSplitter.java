package de.tu_berlin.coga.jlpp.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.tu_berlin.coga.jlpp.exceptions.LPParseException;

/**
 * Cuts a problem text into its sections. The keywords have to appear in the
 * order
 *
 * <pre>
 * max|min   objective
 * s.t.      constraints
 * [with     natural constraints]
 * end
 * </pre>
 *
 * Text after <code>end</code> is ignored.
 */
public final class SectionSplitter {
	private static final Logger LOGGER = LoggerFactory.getLogger(SectionSplitter.class);

	private static final int DIRECTION = 1;
	private static final int SUBJECT_TO = 2;
	private static final int WITH = 3;
	private static final int END = 4;

	private SectionSplitter() {
	}

	private static final class Keyword {
		final int kind;
		final int start;
		final int end;

		Keyword(int kind, int start, int end) {
			this.kind = kind;
			this.start = start;
			this.end = end;
		}
	}

	/**
	 * @throws LPParseException
	 *           <code>MISSING_DIRECTION_KEYWORD</code> if the text does not
	 *           start with a direction, <code>MISSING_SECTION_KEYWORD</code> if
	 *           <code>s.t.</code> or <code>end</code> is not where it belongs
	 */
	public static Sections split(SourceText source) throws LPParseException {
		List<Keyword> keywords = findKeywords(source);

		if (keywords.isEmpty() || keywords.get(0).kind != DIRECTION) {
			int offset = keywords.isEmpty() ? 0 : keywords.get(0).start;
			throw LPParseException.missingDirectionKeyword(source.lineOf(offset), source.columnOf(offset));
		}
		LOGGER.debug("switching to section OBJECTIVE");

		Keyword subjectTo = expect(source, keywords, 1, SUBJECT_TO, "s.t.");
		LOGGER.debug("switching to section CONSTRAINTS");
		Segment objective = new Segment(source, 0, subjectTo.start);

		Keyword next = keywords.size() > 2 ? keywords.get(2) : null;
		if (next != null && next.kind == WITH) {
			Keyword end = expect(source, keywords, 3, END, "end");
			LOGGER.debug("switching to section NATURAL_CONSTRAINTS");
			return new Sections(objective, new Segment(source, subjectTo.end, next.start),
					new Segment(source, next.end, end.start));
		}

		Keyword end = expect(source, keywords, 2, END, "end");
		LOGGER.warn("expression \"with\" not found, assuming all variables are non-negative");
		return new Sections(objective, new Segment(source, subjectTo.end, end.start), null);
	}

	private static Keyword expect(SourceText source, List<Keyword> keywords, int index, int kind, String name)
			throws LPParseException {
		if (index < keywords.size() && keywords.get(index).kind == kind) {
			return keywords.get(index);
		}
		int offset = index < keywords.size() ? keywords.get(index).start : source.length();
		throw LPParseException.missingSectionKeyword(name, source.lineOf(offset), source.columnOf(offset));
	}

	/**
	 * @return all keywords up to and including the first <code>end</code>
	 */
	private static List<Keyword> findKeywords(SourceText source) {
		List<Keyword> keywords = new ArrayList<Keyword>();
		Matcher matcher = Keywords.SECTION_PATTERN.matcher(source.text());
		while (matcher.find()) {
			int kind = DIRECTION;
			while (matcher.group(kind) == null) {
				kind++;
			}
			LOGGER.trace("keyword '{}' at line {}", matcher.group(), source.lineOf(matcher.start()));
			keywords.add(new Keyword(kind, matcher.start(), matcher.end()));
			if (kind == END) {
				break;
			}
		}
		return keywords;
	}
}
