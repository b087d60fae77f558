package org.entitybrowser.search.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for the browse query language.
 *
 * <pre>
 * query := term (whitespace term)*
 * term  := [classifier ':'] (quoted | bare)
 * quoted := "'" text "'"
 * </pre>
 *
 * <p>Parsing never fails: every string yields a (possibly empty) list of terms.</p>
 */
public final class QueryParser {
	private QueryParser() {}

	public static List<SearchTerm> parse(String query) {
		List<SearchTerm> terms = new ArrayList<>();
		for (String token : splitTerms(query)) {
			terms.add(parseTerm(token));
		}
		return terms;
	}

	/**
	 * Splits a query on whitespace, keeping single-quoted values together.
	 *
	 * <p>A quote opens a value only at the start of a token or right after the classifier colon, and closes only when
	 * followed by whitespace or the end of the query, so apostrophes inside words never split or join terms. A quote
	 * preceded by an odd number of backslashes is literal. An unclosed quote extends to the end of the query.</p>
	 */
	public static List<String> splitTerms(String query) {
		List<String> terms = new ArrayList<>();
		if (query == null) {
			return terms;
		}

		int length = query.length();
		int start = -1;
		boolean inQuotes = false;

		for (int i = 0; i < length; i++) {
			char ch = query.charAt(i);

			if (isSeparator(ch) && !inQuotes) {
				if (start >= 0) {
					terms.add(query.substring(start, i));
					start = -1;
				}
				continue;
			}

			if (start < 0) {
				start = i;
			}

			if (ch == '\'' && !isEscaped(query, i)) {
				if (!inQuotes) {
					if (i == start || query.charAt(i - 1) == ':') {
						inQuotes = true;
					}
				} else if (i + 1 == length || isSeparator(query.charAt(i + 1))) {
					inQuotes = false;
				}
			}
		}

		if (start >= 0) {
			terms.add(query.substring(start));
		}
		return terms;
	}

	/**
	 * Unicode White_Space: space separators (including no-break spaces), line and paragraph separators, the ASCII
	 * controls TAB through CR, and NEL
	 */
	static boolean isSeparator(char ch) {
		return Character.isSpaceChar(ch) || (ch >= '\t' && ch <= '\r') || ch == '\u0085';
	}

	/**
	 * Parses a single whitespace-free token (or a token produced by {@link #splitTerms(String)}).
	 */
	public static SearchTerm parseTerm(String token) {
		int colon = token.indexOf(':');
		if (colon < 0) {
			return parseValue(null, token);
		}
		return parseValue(token.substring(0, colon), token.substring(colon + 1));
	}

	private static SearchTerm parseValue(String classifier, String valuePart) {
		if (isQuoted(valuePart)) {
			String inner = valuePart.substring(1, valuePart.length() - 1);
			return new SearchTerm(classifier, unescape(inner), true);
		}
		return new SearchTerm(classifier, valuePart, false);
	}

	private static boolean isQuoted(String value) {
		return value.length() >= 2 && value.startsWith("'") && value.endsWith("'");
	}

	/**
	 * Resolves {@code \'} and {@code \\} inside a quoted value; any other backslash is kept as written.
	 */
	static String unescape(String raw) {
		StringBuilder out = new StringBuilder(raw.length());
		int length = raw.length();

		for (int i = 0; i < length; i++) {
			char ch = raw.charAt(i);
			if (ch != '\\') {
				out.append(ch);
				continue;
			}
			if (i + 1 == length) {
				out.append('\\');
				continue;
			}
			char next = raw.charAt(++i);
			if (next != '\'' && next != '\\') {
				out.append('\\');
			}
			out.append(next);
		}
		return out.toString();
	}

	private static boolean isEscaped(String input, int index) {
		int backslashes = 0;
		for (int i = index - 1; i >= 0 && input.charAt(i) == '\\'; i--) {
			backslashes++;
		}
		return backslashes % 2 == 1;
	}
}
