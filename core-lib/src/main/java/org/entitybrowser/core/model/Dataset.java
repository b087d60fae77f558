package org.entitybrowser.core.model;

import java.util.List;

/**
 * A loaded dataset: build metadata plus the ordered record collection. Record positions in {@code records} are the
 * indices an index built from this dataset refers to.
 */
public record Dataset(BuildInfo build, List<GameRecord> records) {
	public Dataset {
		records = List.copyOf(records);
	}

	public static Dataset of(List<GameRecord> records) {
		return new Dataset(BuildInfo.unknown(), records);
	}

	public int size() {
		return records.size();
	}
}
