package org.entitybrowser.indexing.service;

import org.entitybrowser.core.model.GameRecord;
import org.entitybrowser.core.progress.ProgressListener;
import org.entitybrowser.indexing.config.IndexingConfig;
import org.entitybrowser.indexing.indexer.SearchIndex;
import org.entitybrowser.indexing.indexer.SearchIndexWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Builds a {@link SearchIndex} as a chain of chunk tasks on a shared executor.
 *
 * <p>Each task indexes at most {@code yieldInterval} records and then submits the next chunk instead of looping on,
 * so work already queued on the executor (input handling, rendering, queries against the previous catalog) runs
 * between chunks. The result is identical to {@link SearchIndexBuilder#build(List, ProgressListener)}.</p>
 */
public class IncrementalIndexBuilder {
	private static final Logger logger = LoggerFactory.getLogger(IncrementalIndexBuilder.class);

	private final int progressInterval;
	private final int yieldInterval;

	public IncrementalIndexBuilder() {
		this(IndexingConfig.defaults());
	}

	public IncrementalIndexBuilder(IndexingConfig config) {
		this.progressInterval = config.progressInterval();
		this.yieldInterval = config.yieldInterval();
	}

	/**
	 * Starts the build. Cancelling the returned future stops scheduling further chunks.
	 */
	public CompletableFuture<SearchIndex> buildAsync(List<GameRecord> records, Executor executor, ProgressListener listener) {
		CompletableFuture<SearchIndex> result = new CompletableFuture<>();
		BuildState state = new BuildState(records, new SearchIndexWriter(), listener, executor, result,
				System.currentTimeMillis());
		schedule(state, 0);
		return result;
	}

	private void schedule(BuildState state, int start) {
		try {
			state.executor().execute(() -> runChunk(state, start));
		} catch (RejectedExecutionException e) {
			logger.warn("Index build stopped: executor rejected chunk starting at record {}", start);
			state.result().completeExceptionally(e);
		}
	}

	private void runChunk(BuildState state, int start) {
		if (state.result().isDone()) {
			logger.debug("Index build abandoned at record {}", start);
			return;
		}

		try {
			List<GameRecord> records = state.records();
			int total = records.size();
			int end = Math.min(start + yieldInterval, total);

			for (int i = start; i < end; i++) {
				state.writer().addRecord(i, records.get(i));

				if (SearchIndexBuilder.isProgressPoint(i, total, progressInterval)) {
					state.listener().onProgress(i + 1, total);
				}
			}

			if (end < total) {
				schedule(state, end);
				return;
			}

			SearchIndex index = state.writer().toIndex();
			SearchIndexBuilder.logBuilt(index, total, System.currentTimeMillis() - state.startMillis());
			state.result().complete(index);
		} catch (RuntimeException e) {
			logger.error("Index build failed at chunk starting with record {}", start, e);
			state.result().completeExceptionally(e);
		}
	}

	private record BuildState(
			List<GameRecord> records,
			SearchIndexWriter writer,
			ProgressListener listener,
			Executor executor,
			CompletableFuture<SearchIndex> result,
			long startMillis
	) {}
}
