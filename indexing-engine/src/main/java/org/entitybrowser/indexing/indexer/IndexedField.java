package org.entitybrowser.indexing.indexer;

import java.util.Optional;
import java.util.Set;

/**
 * Record fields served by a dedicated inverted mapping, with the query classifiers that address them.
 */
public enum IndexedField {
	ID(Set.of("id", "abstract", "i")),
	TYPE(Set.of("type", "t")),
	CATEGORY(Set.of("category", "c"));

	private final Set<String> classifiers;

	IndexedField(Set<String> classifiers) {
		this.classifiers = classifiers;
	}

	/**
	 * The field a classifier refers to, or empty when the classifier needs a tree walk.
	 */
	public static Optional<IndexedField> forClassifier(String classifier) {
		for (IndexedField field : values()) {
			if (field.classifiers.contains(classifier)) {
				return Optional.of(field);
			}
		}
		return Optional.empty();
	}
}
