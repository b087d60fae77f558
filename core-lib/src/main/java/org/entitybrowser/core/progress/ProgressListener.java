package org.entitybrowser.core.progress;

import java.util.function.DoubleConsumer;

/**
 * Receives progress of a long-running pass over the record collection.
 */
@FunctionalInterface
public interface ProgressListener {
	/** Weight of the record conversion stage in a full dataset load; indexing takes the rest. */
	double RECORDS_STAGE_WEIGHT = 0.4;

	ProgressListener NONE = (processed, total) -> {};

	/**
	 * Called with the number of records handled so far and the total number of records.
	 */
	void onProgress(int processed, int total);

	/**
	 * Adapts a ratio consumer: reports {@code offset + weight * processed / total}, or {@code offset + weight}
	 * when there is nothing to process.
	 */
	static ProgressListener fractional(DoubleConsumer ratioConsumer, double offset, double weight) {
		return (processed, total) -> {
			double stage = total > 0 ? (double) processed / total : 1.0;
			ratioConsumer.accept(offset + weight * stage);
		};
	}
}
