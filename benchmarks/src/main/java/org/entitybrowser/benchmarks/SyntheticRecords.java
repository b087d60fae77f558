package org.entitybrowser.benchmarks;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.entitybrowser.core.model.GameRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic game-entity records shaped like a real data dump: typed, categorised, with nested names and flag
 * arrays.
 */
final class SyntheticRecords {
	private static final String[] TYPES = {"MONSTER", "TOOL", "GENERIC", "ARMOR", "furniture", "terrain", "MUTATION"};
	private static final String[] CATEGORIES = {"weapons", "tools", "food", "spare_parts", "clothing"};
	private static final String[] WORDS = {"zombie", "rock", "hammer", "alien", "acid", "steel", "wooden", "glowing",
			"mutant", "broken", "heavy", "crystal", "fungal", "ancient"};
	private static final String[] FLAGS = {"EMITTER", "FLIES", "NOITEM", "TRANSPARENT", "FLAMMABLE", "SEES"};

	private SyntheticRecords() {}

	static List<GameRecord> generate(int count, long seed) {
		Random random = new Random(seed);
		List<GameRecord> records = new ArrayList<>(count);

		for (int i = 0; i < count; i++) {
			String first = WORDS[random.nextInt(WORDS.length)];
			String second = WORDS[random.nextInt(WORDS.length)];

			JsonObject record = new JsonObject();
			record.addProperty("id", first + "_" + second + "_" + i);
			record.addProperty("type", TYPES[random.nextInt(TYPES.length)]);
			if (random.nextInt(3) > 0) {
				record.addProperty("category", CATEGORIES[random.nextInt(CATEGORIES.length)]);
			}

			JsonObject name = new JsonObject();
			name.addProperty("str", first + " " + second);
			record.add("name", name);
			record.addProperty("description", "A " + first + " thing made of " + second + " pieces.");
			record.addProperty("weight", random.nextInt(5000));

			JsonArray flags = new JsonArray();
			for (int f = random.nextInt(3); f > 0; f--) {
				flags.add(FLAGS[random.nextInt(FLAGS.length)]);
			}
			record.add("flags", flags);

			records.add(GameRecord.fromValue(record));
		}

		records.sort(GameRecord.BY_TYPE_THEN_ID);
		return records;
	}
}
