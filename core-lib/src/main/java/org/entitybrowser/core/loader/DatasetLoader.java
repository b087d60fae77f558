package org.entitybrowser.core.loader;

import org.entitybrowser.core.model.Dataset;
import org.entitybrowser.core.progress.ProgressListener;

import java.io.IOException;

public interface DatasetLoader {
	/**
	 * Load the full record collection, reporting record conversion progress to {@code listener}
	 */
	Dataset load(ProgressListener listener) throws IOException;

	default Dataset load() throws IOException {
		return load(ProgressListener.NONE);
	}
}
