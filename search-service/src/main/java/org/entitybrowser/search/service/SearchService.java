package org.entitybrowser.search.service;

import org.entitybrowser.core.model.GameRecord;
import org.entitybrowser.indexing.indexer.SearchIndex;
import org.entitybrowser.search.model.SearchResponse;
import org.entitybrowser.search.model.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

public class SearchService {
	private static final Logger logger = LoggerFactory.getLogger(SearchService.class);

	private final AtomicReference<RecordCatalog> catalog;
	private final int maxResults;

	public SearchService(int maxResults) {
		this(RecordCatalog.empty(), maxResults);
	}

	public SearchService(RecordCatalog initial, int maxResults) {
		this.catalog = new AtomicReference<>(initial);
		this.maxResults = maxResults;
	}

	/**
	 * Install a freshly built catalog; queries already running finish against the previous one
	 */
	public void replaceCatalog(RecordCatalog next) {
		RecordCatalog previous = catalog.getAndSet(next);
		logger.info("Catalog replaced: {} records (build {}) -> {} records (build {})",
				previous.size(), previous.build().tagName(), next.size(), next.build().tagName());
	}

	public RecordCatalog currentCatalog() {
		return catalog.get();
	}

	public SearchResponse search(String query, Integer limit) {
		String effectiveQuery = query == null ? "" : query;
		RecordCatalog current = catalog.get();

		long start = System.nanoTime();
		List<Integer> matches = current.search(effectiveQuery);
		long elapsedMicros = (System.nanoTime() - start) / 1000;

		int resultLimit = (limit != null && limit > 0) ? Math.min(limit, maxResults) : maxResults;
		List<SearchResult> results = matches.stream()
				.limit(resultLimit)
				.map(index -> SearchResult.fromRecord(index, current.record(index)))
				.collect(Collectors.toList());

		logger.info("Query '{}' matched {} of {} records in {} us", effectiveQuery, matches.size(), current.size(), elapsedMicros);
		return new SearchResponse(effectiveQuery, matches.size(), results.size(), results);
	}

	public Optional<GameRecord> getRecord(int index) {
		return catalog.get().findRecord(index);
	}

	/**
	 * Get catalog statistics
	 */
	public SearchStats getStats() {
		RecordCatalog current = catalog.get();
		return new SearchStats(current.size(), current.build().tagName(), current.index().getStats());
	}

	public record SearchStats(int totalRecords, String buildTag, SearchIndex.IndexStats index) {}
}
