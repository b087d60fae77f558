package org.entitybrowser.search.model;

import org.entitybrowser.core.model.GameRecord;

public record SearchResult(
		int index,
		String id,
		String type,
		String category
) {
	public static SearchResult fromRecord(int index, GameRecord record) {
		return new SearchResult(
				index,
				record.id(),
				record.itemType(),
				record.category()
		);
	}
}
