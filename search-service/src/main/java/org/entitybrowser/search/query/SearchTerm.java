package org.entitybrowser.search.query;

import org.jetbrains.annotations.Nullable;

/**
 * One parsed query term: an optional field classifier, the text to match and whether the text was single-quoted.
 *
 * @param classifier text before the first {@code :}, or {@code null} when the term has none
 * @param pattern    the match text with surrounding quotes and escapes removed
 * @param exact      {@code true} when the value was written as {@code 'text'}
 */
public record SearchTerm(@Nullable String classifier, String pattern, boolean exact) {

	public static SearchTerm exact(String pattern) {
		return new SearchTerm(null, pattern, true);
	}

	public boolean hasClassifier() {
		return classifier != null;
	}
}
