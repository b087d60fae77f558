package org.entitybrowser.core.loader;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.entitybrowser.core.json.JsonValues;
import org.entitybrowser.core.model.BuildInfo;
import org.entitybrowser.core.model.Dataset;
import org.entitybrowser.core.model.GameRecord;
import org.entitybrowser.core.progress.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a dataset dump of the form {@code {"build_number": "...", "release": {...}, "data": [ ... ]}} from disk.
 */
public class JsonDatasetLoader implements DatasetLoader {
	private static final Logger logger = LoggerFactory.getLogger(JsonDatasetLoader.class);
	private static final int PROGRESS_INTERVAL = 500;

	private final Path datasetPath;

	public JsonDatasetLoader(Path datasetPath) {
		this.datasetPath = datasetPath;
	}

	@Override
	public Dataset load(ProgressListener listener) throws IOException {
		if (!Files.exists(datasetPath)) {
			throw new IOException("Dataset file not found: " + datasetPath);
		}

		long start = System.currentTimeMillis();
		JsonObject root = readRoot();
		BuildInfo build = parseBuildInfo(root);
		List<GameRecord> records = toRecords(dataArray(root), listener);
		records.sort(GameRecord.BY_TYPE_THEN_ID);

		logger.info("Loaded {} records from {} (build {}) in {} ms",
				records.size(), datasetPath, build.tagName(), System.currentTimeMillis() - start);
		return new Dataset(build, records);
	}

	private JsonObject readRoot() throws IOException {
		try (Reader reader = Files.newBufferedReader(datasetPath, StandardCharsets.UTF_8)) {
			JsonElement root = JsonParser.parseReader(reader);
			if (!root.isJsonObject()) {
				throw new DatasetFormatException("Dataset root must be a JSON object: " + datasetPath);
			}
			return root.getAsJsonObject();
		} catch (JsonParseException e) {
			throw new DatasetFormatException("Malformed dataset JSON in " + datasetPath, e);
		}
	}

	/**
	 * Build metadata; values nested under {@code release} take precedence over the flat ones
	 */
	static BuildInfo parseBuildInfo(JsonObject root) throws DatasetFormatException {
		String buildNumber = JsonValues.stringField(root, "build_number")
				.orElseThrow(() -> new DatasetFormatException("Dataset is missing 'build_number'"));

		String tagName = buildNumber;
		boolean prerelease = JsonValues.booleanField(root, "prerelease").orElse(false);
		String createdAt = JsonValues.stringField(root, "created_at").orElse("");

		JsonElement release = root.get("release");
		if (release != null && release.isJsonObject()) {
			JsonObject releaseObject = release.getAsJsonObject();
			tagName = JsonValues.stringField(releaseObject, "tag_name").orElse(tagName);
			prerelease = JsonValues.booleanField(releaseObject, "prerelease").orElse(prerelease);
			createdAt = JsonValues.stringField(releaseObject, "created_at").orElse(createdAt);
		}

		return new BuildInfo(buildNumber, tagName, prerelease, createdAt);
	}

	private static JsonArray dataArray(JsonObject root) throws DatasetFormatException {
		JsonElement data = root.get("data");
		if (data == null || !data.isJsonArray()) {
			throw new DatasetFormatException("Dataset is missing the 'data' array");
		}
		return data.getAsJsonArray();
	}

	private static List<GameRecord> toRecords(JsonArray data, ProgressListener listener) {
		int total = data.size();
		List<GameRecord> records = new ArrayList<>(total);
		int nonObjects = 0;

		for (int i = 0; i < total; i++) {
			JsonElement value = data.get(i);
			if (!value.isJsonObject()) {
				nonObjects++;
			}
			records.add(GameRecord.fromValue(value));

			if (i % PROGRESS_INTERVAL == 0 || i + 1 == total) {
				listener.onProgress(i + 1, total);
			}
		}

		if (nonObjects > 0) {
			logger.warn("{} dataset entries are not JSON objects and have no id or type", nonObjects);
		}
		return records;
	}
}
