package de.tu_berlin.coga.jlpp.parse;

import java.util.ArrayList;
import java.util.List;

import de.tu_berlin.coga.jlpp.parse.Token.Type;

/**
 * Splits a segment into {@link Token}s.
 * <p>
 * Whitespace carries no meaning in a linear expression, so it is removed
 * before tokenising: <code>1 2x 3</code> reads as <code>12x3</code>. Each
 * token still records the offset of its first character in the source
 * text.
 */
public final class Lexer {

	private Lexer() {
	}

	public static List<Token> tokenize(Segment segment) {
		String text = segment.source().text();

		// compact the segment, remembering where each character came from
		StringBuilder compact = new StringBuilder(segment.end() - segment.start());
		int[] offsets = new int[segment.end() - segment.start()];
		for (int i = segment.start(); i < segment.end(); i++) {
			char c = text.charAt(i);
			if (!Character.isWhitespace(c)) {
				offsets[compact.length()] = i;
				compact.append(c);
			}
		}

		List<Token> tokens = new ArrayList<Token>();
		int pos = 0;
		while (pos < compact.length()) {
			char c = compact.charAt(pos);
			int tokenStart = pos;
			Type type;
			if (c == '+' || c == '-') {
				type = Type.SIGN;
				pos++;
			} else if (isDigit(c)) {
				type = Type.NUMBER;
				pos = skipDigits(compact, pos);
			} else if ((c == 'x' || c == 'X') && pos + 1 < compact.length() && isDigit(compact.charAt(pos + 1))) {
				type = Type.VARIABLE;
				pos = skipDigits(compact, pos + 1);
			} else if ((c == '<' || c == '>') && pos + 1 < compact.length() && compact.charAt(pos + 1) == '=') {
				type = Type.RELATION;
				pos += 2;
			} else if (c == '=') {
				type = Type.RELATION;
				pos++;
			} else {
				type = Type.OTHER;
				pos++;
			}
			tokens.add(new Token(type, compact.substring(tokenStart, pos), offsets[tokenStart],
					offsets[pos - 1] + 1));
		}
		return tokens;
	}

	/**
	 * @return the segment's text with all whitespace removed
	 */
	public static String compact(Segment segment) {
		String text = segment.text();
		StringBuilder compact = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (!Character.isWhitespace(c)) {
				compact.append(c);
			}
		}
		return compact.toString();
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static int skipDigits(CharSequence chars, int pos) {
		while (pos < chars.length() && isDigit(chars.charAt(pos))) {
			pos++;
		}
		return pos;
	}
}
