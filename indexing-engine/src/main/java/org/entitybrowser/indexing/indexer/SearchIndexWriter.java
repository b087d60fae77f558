package org.entitybrowser.indexing.indexer;

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import org.entitybrowser.core.json.JsonValues;
import org.entitybrowser.core.model.GameRecord;
import org.entitybrowser.indexing.service.WordTokenizer;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Accumulates records into the four mappings of a {@link SearchIndex}. Records must be added with their position in
 * the collection; {@link #toIndex()} hands the mappings over and closes the writer.
 */
public class SearchIndexWriter {
	private FieldIndex byId = new FieldIndex();
	private FieldIndex byType = new FieldIndex();
	private FieldIndex byCategory = new FieldIndex();
	private FieldIndex words = new FieldIndex();

	public void addRecord(int recordIndex, GameRecord record) {
		ensureOpen();
		Set<String> recordWords = new HashSet<>();

		String id = record.id();
		if (!id.isEmpty()) {
			byId.add(id, recordIndex);
			WordTokenizer.tokenize(id, recordWords);
		}

		String itemType = record.itemType();
		if (!itemType.isEmpty()) {
			byType.add(itemType, recordIndex);
			WordTokenizer.tokenize(itemType, recordWords);
		}

		Optional<String> category = JsonValues.stringField(record.value(), "category");
		if (category.isPresent()) {
			byCategory.add(category.get(), recordIndex);
			WordTokenizer.tokenize(category.get(), recordWords);
		}

		collectWords(record.value(), recordWords);

		for (String word : recordWords) {
			words.add(word, recordIndex);
		}
	}

	/**
	 * Only string content is word indexed; numbers, booleans and null are skipped.
	 */
	private static void collectWords(JsonElement value, Set<String> sink) {
		if (value.isJsonPrimitive()) {
			JsonPrimitive primitive = value.getAsJsonPrimitive();
			if (primitive.isString()) {
				WordTokenizer.tokenize(primitive.getAsString(), sink);
			}
		} else if (value.isJsonArray()) {
			for (JsonElement element : value.getAsJsonArray()) {
				collectWords(element, sink);
			}
		} else if (value.isJsonObject()) {
			for (Map.Entry<String, JsonElement> entry : value.getAsJsonObject().entrySet()) {
				collectWords(entry.getValue(), sink);
			}
		}
	}

	public SearchIndex toIndex() {
		ensureOpen();
		SearchIndex index = new SearchIndex(byId, byType, byCategory, words);
		byId = null;
		byType = null;
		byCategory = null;
		words = null;
		return index;
	}

	private void ensureOpen() {
		if (words == null) {
			throw new IllegalStateException("Index writer already handed over its index");
		}
	}
}
