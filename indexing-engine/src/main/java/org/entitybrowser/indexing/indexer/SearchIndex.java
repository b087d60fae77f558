package org.entitybrowser.indexing.indexer;

import java.util.Objects;
import java.util.Set;

/**
 * Inverted index over a record collection: identifier, type, category and word mappings. Values are record
 * positions, so an instance is only meaningful together with the exact collection it was built from.
 */
public final class SearchIndex {
	private final FieldIndex byId;
	private final FieldIndex byType;
	private final FieldIndex byCategory;
	private final FieldIndex words;

	SearchIndex(FieldIndex byId, FieldIndex byType, FieldIndex byCategory, FieldIndex words) {
		this.byId = byId;
		this.byType = byType;
		this.byCategory = byCategory;
		this.words = words;
	}

	public static SearchIndex empty() {
		return new SearchIndex(new FieldIndex(), new FieldIndex(), new FieldIndex(), new FieldIndex());
	}

	public FieldIndex byId() {
		return byId;
	}

	public FieldIndex byType() {
		return byType;
	}

	public FieldIndex byCategory() {
		return byCategory;
	}

	public FieldIndex words() {
		return words;
	}

	public FieldIndex field(IndexedField field) {
		return switch (field) {
			case ID -> byId;
			case TYPE -> byType;
			case CATEGORY -> byCategory;
		};
	}

	public Set<Integer> lookupField(IndexedField field, String pattern, boolean exact) {
		return field(field).lookup(pattern, exact);
	}

	/**
	 * Records owning at least one word that contains {@code pattern}, case-insensitively
	 */
	public Set<Integer> searchWords(String pattern) {
		return words.lookup(pattern, false);
	}

	public IndexStats getStats() {
		return new IndexStats(byId.size(), byType.size(), byCategory.size(), words.size(), words.totalMappings());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof SearchIndex other)) return false;
		return byId.equals(other.byId)
				&& byType.equals(other.byType)
				&& byCategory.equals(other.byCategory)
				&& words.equals(other.words);
	}

	@Override
	public int hashCode() {
		return Objects.hash(byId, byType, byCategory, words);
	}

	public record IndexStats(int idKeys, int typeKeys, int categoryKeys, int uniqueWords, int totalWordMappings) {}
}
