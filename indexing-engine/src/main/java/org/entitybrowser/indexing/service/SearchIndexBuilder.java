package org.entitybrowser.indexing.service;

import org.entitybrowser.core.model.GameRecord;
import org.entitybrowser.core.progress.ProgressListener;
import org.entitybrowser.indexing.config.IndexingConfig;
import org.entitybrowser.indexing.indexer.SearchIndex;
import org.entitybrowser.indexing.indexer.SearchIndexWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds a {@link SearchIndex} over a record collection in a single synchronous pass.
 */
public class SearchIndexBuilder {
	private static final Logger logger = LoggerFactory.getLogger(SearchIndexBuilder.class);

	private final int progressInterval;

	public SearchIndexBuilder() {
		this(IndexingConfig.defaults());
	}

	public SearchIndexBuilder(IndexingConfig config) {
		this.progressInterval = config.progressInterval();
	}

	public SearchIndex build(List<GameRecord> records) {
		return build(records, ProgressListener.NONE);
	}

	/**
	 * Build the index, reporting every {@code progressInterval} records and on the final record
	 */
	public SearchIndex build(List<GameRecord> records, ProgressListener listener) {
		long start = System.currentTimeMillis();
		int total = records.size();
		SearchIndexWriter writer = new SearchIndexWriter();

		for (int i = 0; i < total; i++) {
			writer.addRecord(i, records.get(i));

			if (isProgressPoint(i, total, progressInterval)) {
				listener.onProgress(i + 1, total);
			}
		}

		SearchIndex index = writer.toIndex();
		logBuilt(index, total, System.currentTimeMillis() - start);
		return index;
	}

	static boolean isProgressPoint(int recordIndex, int total, int interval) {
		return recordIndex % interval == 0 || recordIndex + 1 == total;
	}

	static void logBuilt(SearchIndex index, int records, long elapsedMillis) {
		SearchIndex.IndexStats stats = index.getStats();
		logger.info("Indexed {} records in {} ms ({} ids, {} types, {} categories, {} unique words)",
				records, elapsedMillis, stats.idKeys(), stats.typeKeys(), stats.categoryKeys(), stats.uniqueWords());
	}
}
