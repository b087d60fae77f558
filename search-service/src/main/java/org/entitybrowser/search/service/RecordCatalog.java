package org.entitybrowser.search.service;

import org.entitybrowser.core.model.BuildInfo;
import org.entitybrowser.core.model.Dataset;
import org.entitybrowser.core.model.GameRecord;
import org.entitybrowser.core.progress.ProgressListener;
import org.entitybrowser.indexing.indexer.SearchIndex;
import org.entitybrowser.indexing.service.IncrementalIndexBuilder;
import org.entitybrowser.indexing.service.SearchIndexBuilder;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A record collection together with the index built from it.
 *
 * <p>The two halves can only be created together, through {@code build}/{@code buildAsync}, and are never replaced
 * independently: a reload produces a new catalog.</p>
 */
public final class RecordCatalog {
	private final Dataset dataset;
	private final SearchIndex index;

	private RecordCatalog(Dataset dataset, SearchIndex index) {
		this.dataset = dataset;
		this.index = index;
	}

	public static RecordCatalog empty() {
		return new RecordCatalog(Dataset.of(List.of()), SearchIndex.empty());
	}

	public static RecordCatalog build(Dataset dataset) {
		return build(dataset, new SearchIndexBuilder(), ProgressListener.NONE);
	}

	public static RecordCatalog build(Dataset dataset, SearchIndexBuilder builder, ProgressListener listener) {
		return new RecordCatalog(dataset, builder.build(dataset.records(), listener));
	}

	public static CompletableFuture<RecordCatalog> buildAsync(Dataset dataset, IncrementalIndexBuilder builder,
			Executor executor, ProgressListener listener) {
		return builder.buildAsync(dataset.records(), executor, listener)
				.thenApply(index -> new RecordCatalog(dataset, index));
	}

	public List<Integer> search(String query) {
		return QueryEvaluator.evaluate(index, dataset.records(), query);
	}

	public GameRecord record(int position) {
		return dataset.records().get(position);
	}

	public Optional<GameRecord> findRecord(int position) {
		if (position < 0 || position >= size()) {
			return Optional.empty();
		}
		return Optional.of(record(position));
	}

	public List<GameRecord> records() {
		return dataset.records();
	}

	public BuildInfo build() {
		return dataset.build();
	}

	public SearchIndex index() {
		return index;
	}

	public int size() {
		return dataset.size();
	}
}
