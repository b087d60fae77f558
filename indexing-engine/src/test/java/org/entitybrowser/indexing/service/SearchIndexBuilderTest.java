package org.entitybrowser.indexing.service;

import com.google.gson.JsonParser;
import org.entitybrowser.core.model.GameRecord;
import org.entitybrowser.indexing.config.IndexingConfig;
import org.entitybrowser.indexing.indexer.IndexedField;
import org.entitybrowser.indexing.indexer.SearchIndex;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class SearchIndexBuilderTest {

	private static GameRecord record(String json) {
		return GameRecord.fromValue(JsonParser.parseString(json));
	}

	@Test
	public void testIndexBuilding() {
		List<GameRecord> records = List.of(
				record("{\"id\": \"test_item\", \"type\": \"TOOL\", \"category\": \"weapons\"}"),
				record("{\"abstract\": \"abstract_base\", \"type\": \"MONSTER\"}")
		);

		SearchIndex index = new SearchIndexBuilder().build(records);

		assertEquals(Set.of(0), index.byId().get("test_item"));
		assertEquals(Set.of(1), index.byId().get("abstract_base"));
		assertTrue(index.byType().keys().containsAll(Set.of("tool", "monster")));
		assertEquals(Set.of(0), index.byCategory().get("weapons"));
		assertTrue(index.words().keys().contains("weapons"));
		assertTrue(index.words().keys().contains("abstract_base"));
	}

	@Test
	public void testWordsFromNestedValues() {
		List<GameRecord> records = List.of(record("""
				{
				  "id": "f_alien_gasper",
				  "type": "furniture",
				  "flags": ["TRANSPARENT", "EMITTER"],
				  "bash": { "sound": "splorch!", "items": [ { "item": "fetid_goop", "count": [15, 25] } ] }
				}
				"""));

		SearchIndex index = new SearchIndexBuilder().build(records);
		Set<String> words = index.words().keys();

		assertTrue(words.containsAll(Set.of("f_alien_gasper", "furniture", "transparent", "emitter", "splorch", "fetid_goop")));
		assertFalse(words.contains("15"), "numbers are not word indexed");
		assertFalse(words.contains("bash"), "field names are not word indexed");
	}

	@Test
	public void testLookupExactAndPattern() {
		List<GameRecord> records = List.of(
				record("{\"id\": \"test_item\", \"type\": \"TOOL\"}"),
				record("{\"id\": \"test_weapon\", \"type\": \"TOOL\"}")
		);
		SearchIndex index = new SearchIndexBuilder().build(records);

		assertEquals(Set.of(0), index.lookupField(IndexedField.ID, "TEST_ITEM", true));
		assertEquals(Set.of(0, 1), index.lookupField(IndexedField.ID, "test", false));
		assertEquals(Set.of(0, 1), index.lookupField(IndexedField.TYPE, "oo", false));
		assertTrue(index.lookupField(IndexedField.ID, "test", true).isEmpty());
	}

	@Test
	public void testWordSearchIsSubstring() {
		List<GameRecord> records = List.of(
				record("{\"id\": \"zombie_soldier\", \"type\": \"MONSTER\", \"name\": \"Zombie Soldier\"}"));
		SearchIndex index = new SearchIndexBuilder().build(records);

		assertEquals(Set.of(0), index.searchWords("zombie"));
		assertEquals(Set.of(0), index.searchWords("SOLDIER"));
		assertEquals(Set.of(0), index.searchWords("oldi"));
		assertTrue(index.searchWords("skeleton").isEmpty());
	}

	@Test
	public void testMissingFieldsContributeNothing() {
		List<GameRecord> records = List.of(record("{\"name\": \"nameless\"}"), record("[1, 2, 3]"));
		SearchIndex index = new SearchIndexBuilder().build(records);

		assertEquals(0, index.byId().size());
		assertEquals(0, index.byType().size());
		assertEquals(0, index.byCategory().size());
		assertEquals(Set.of(0), index.searchWords("nameless"));
	}

	@Test
	public void testEmptyCollection() {
		SearchIndex index = new SearchIndexBuilder().build(List.of());

		assertEquals(SearchIndex.empty(), index);
		assertEquals(0, index.getStats().uniqueWords());
	}

	@Test
	public void testRebuildIsIdempotent() {
		List<GameRecord> records = List.of(
				record("{\"id\": \"a\", \"type\": \"TOOL\", \"description\": \"a sturdy hammer\"}"),
				record("{\"id\": \"b\", \"type\": \"GUN\", \"category\": \"guns\", \"ammo\": [\"9mm\", \"45\"]}"),
				record("{\"abstract\": \"c\", \"type\": \"TOOL\"}")
		);

		SearchIndex first = new SearchIndexBuilder().build(records);
		SearchIndex second = new SearchIndexBuilder().build(records);

		assertEquals(first, second);
		assertEquals(first.words().asMap(), second.words().asMap());
		assertEquals(first.getStats(), second.getStats());
	}

	@Test
	public void testProgressCadence() {
		List<GameRecord> records = new ArrayList<>();
		for (int i = 0; i < 10; i++) {
			records.add(record("{\"id\": \"item_" + i + "\"}"));
		}

		List<Integer> reported = new ArrayList<>();
		new SearchIndexBuilder(new IndexingConfig(4, 1000)).build(records, (processed, total) -> {
			assertEquals(10, total);
			reported.add(processed);
		});

		assertEquals(List.of(1, 5, 9, 10), reported);
	}
}
