package org.entitybrowser.search.service;

import org.entitybrowser.core.loader.DatasetLoader;
import org.entitybrowser.core.model.Dataset;
import org.entitybrowser.core.progress.ProgressListener;
import org.entitybrowser.indexing.service.IncrementalIndexBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Loads a dataset and indexes it on an executor, producing a complete {@link RecordCatalog}. Overall progress is
 * logged in ten percent steps: record conversion covers the first 40%, indexing the rest.
 */
public class CatalogLoader {
	private static final Logger logger = LoggerFactory.getLogger(CatalogLoader.class);

	private final DatasetLoader datasetLoader;
	private final IncrementalIndexBuilder indexBuilder;
	private final Executor executor;

	public CatalogLoader(DatasetLoader datasetLoader, IncrementalIndexBuilder indexBuilder, Executor executor) {
		this.datasetLoader = datasetLoader;
		this.indexBuilder = indexBuilder;
		this.executor = executor;
	}

	public CompletableFuture<RecordCatalog> load() {
		ProgressLog progress = new ProgressLog();
		double recordsWeight = ProgressListener.RECORDS_STAGE_WEIGHT;

		return CompletableFuture
				.supplyAsync(() -> readDataset(ProgressListener.fractional(progress::report, 0.0, recordsWeight)), executor)
				.thenCompose(dataset -> RecordCatalog.buildAsync(dataset, indexBuilder, executor,
						ProgressListener.fractional(progress::report, recordsWeight, 1.0 - recordsWeight)));
	}

	private Dataset readDataset(ProgressListener listener) {
		try {
			return datasetLoader.load(listener);
		} catch (IOException e) {
			throw new CompletionException(e);
		}
	}

	private static final class ProgressLog {
		private int lastStep = -1;

		void report(double ratio) {
			int step = (int) Math.floor(ratio * 10);
			if (step > lastStep) {
				lastStep = step;
				logger.info("Loading catalog: {}%", step * 10);
			}
		}
	}
}
