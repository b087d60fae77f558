package org.entitybrowser.core.model;

import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GameRecordTest {

	@Test
	public void testIdAndTypeResolution() {
		GameRecord record = GameRecord.fromValue(JsonParser.parseString(
				"{\"id\": \"f_alien_gasper\", \"type\": \"furniture\", \"category\": \"alien\"}"));

		assertEquals("f_alien_gasper", record.id());
		assertEquals("furniture", record.itemType());
		assertEquals("alien", record.category());
	}

	@Test
	public void testAbstractFallback() {
		GameRecord record = GameRecord.fromValue(JsonParser.parseString(
				"{\"abstract\": \"base_gun\", \"type\": \"GUN\"}"));
		assertEquals("base_gun", record.id());

		GameRecord emptyId = GameRecord.fromValue(JsonParser.parseString(
				"{\"id\": \"\", \"abstract\": \"base_armor\"}"));
		assertEquals("base_armor", emptyId.id());
		assertEquals("", emptyId.itemType());
	}

	@Test
	public void testNonStringFieldsResolveToEmpty() {
		GameRecord record = GameRecord.fromValue(JsonParser.parseString(
				"{\"id\": 42, \"type\": [\"a\"], \"category\": null}"));

		assertEquals("", record.id());
		assertEquals("", record.itemType());
		assertEquals("", record.category());
	}

	@Test
	public void testNonObjectValue() {
		GameRecord record = GameRecord.fromValue(JsonParser.parseString("\"just a string\""));

		assertEquals("", record.id());
		assertEquals("", record.itemType());
		assertTrue(record.value().isJsonPrimitive());
	}

	@Test
	public void testDatasetOrdering() {
		GameRecord b = GameRecord.fromValue(JsonParser.parseString("{\"id\": \"b\", \"type\": \"TOOL\"}"));
		GameRecord a = GameRecord.fromValue(JsonParser.parseString("{\"id\": \"a\", \"type\": \"TOOL\"}"));
		GameRecord z = GameRecord.fromValue(JsonParser.parseString("{\"id\": \"z\", \"type\": \"ARMOR\"}"));

		assertTrue(GameRecord.BY_TYPE_THEN_ID.compare(z, a) < 0);
		assertTrue(GameRecord.BY_TYPE_THEN_ID.compare(a, b) < 0);
	}
}
