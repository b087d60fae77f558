package org.entitybrowser.indexing.service;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Splits text into lower-cased index words. Alphabetic and numeric characters, {@code _} and {@code -} form words; every other
 * character separates them. Words shorter than {@link #MIN_WORD_LENGTH} are dropped.
 */
public final class WordTokenizer {
	public static final int MIN_WORD_LENGTH = 2;

	private WordTokenizer() {}

	public static Set<String> tokenize(String text) {
		Set<String> words = new LinkedHashSet<>();
		tokenize(text, words);
		return words;
	}

	/**
	 * Adds the words of {@code text} to {@code sink}
	 */
	public static void tokenize(String text, Set<String> sink) {
		int length = text.length();
		int start = -1;

		for (int i = 0; i < length; ) {
			int codePoint = text.codePointAt(i);
			if (isWordChar(codePoint)) {
				if (start < 0) {
					start = i;
				}
			} else if (start >= 0) {
				addWord(text.substring(start, i), sink);
				start = -1;
			}
			i += Character.charCount(codePoint);
		}

		if (start >= 0) {
			addWord(text.substring(start), sink);
		}
	}

	private static void addWord(String word, Set<String> sink) {
		String lower = word.toLowerCase(Locale.ROOT);
		if (lower.codePointCount(0, lower.length()) >= MIN_WORD_LENGTH) {
			sink.add(lower);
		}
	}

	static boolean isWordChar(int codePoint) {
		return isAlphanumeric(codePoint) || codePoint == '_' || codePoint == '-';
	}

	/**
	 * Unicode Alphabetic or Numeric, so superscripts, roman numerals and combining vowel signs stay inside words
	 */
	static boolean isAlphanumeric(int codePoint) {
		if (Character.isAlphabetic(codePoint)) {
			return true;
		}
		switch (Character.getType(codePoint)) {
			case Character.DECIMAL_DIGIT_NUMBER:
			case Character.LETTER_NUMBER:
			case Character.OTHER_NUMBER:
				return true;
			default:
				return false;
		}
	}
}
