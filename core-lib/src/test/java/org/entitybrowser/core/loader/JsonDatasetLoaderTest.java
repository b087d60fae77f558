package org.entitybrowser.core.loader;

import org.entitybrowser.core.model.Dataset;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JsonDatasetLoaderTest {

	@Test
	public void testLoadSortsRecordsAndReadsBuildInfo() throws Exception {
		Path tempDir = Files.createTempDirectory("test-dataset");
		Path dataFile = tempDir.resolve("all.json");

		String dataset = """
            {
              "build_number": "2024-05-01",
              "release": { "tag_name": "cbn-2024-05-01", "prerelease": true, "created_at": "2024-05-01T00:00:00Z" },
              "data": [
                { "id": "zombie", "type": "MONSTER" },
                { "id": "hammer", "type": "TOOL" },
                { "abstract": "base_monster", "type": "MONSTER" }
              ]
            }
        """;
		Files.writeString(dataFile, dataset);

		List<int[]> progress = new ArrayList<>();
		Dataset loaded = new JsonDatasetLoader(dataFile).load((processed, total) -> progress.add(new int[]{processed, total}));

		assertEquals(3, loaded.size());
		assertEquals("base_monster", loaded.records().get(0).id());
		assertEquals("zombie", loaded.records().get(1).id());
		assertEquals("hammer", loaded.records().get(2).id());

		assertEquals("2024-05-01", loaded.build().buildNumber());
		assertEquals("cbn-2024-05-01", loaded.build().tagName());
		assertTrue(loaded.build().prerelease());

		int[] last = progress.get(progress.size() - 1);
		assertEquals(3, last[0]);
		assertEquals(3, last[1]);

		Files.delete(dataFile);
		Files.delete(tempDir);
	}

	@Test
	public void testTagDefaultsToBuildNumber() throws Exception {
		Path tempDir = Files.createTempDirectory("test-dataset");
		Path dataFile = tempDir.resolve("all.json");
		Files.writeString(dataFile, "{\"build_number\": \"stable\", \"data\": []}");

		Dataset loaded = new JsonDatasetLoader(dataFile).load();

		assertEquals(0, loaded.size());
		assertEquals("stable", loaded.build().tagName());
		assertFalse(loaded.build().prerelease());

		Files.delete(dataFile);
		Files.delete(tempDir);
	}

	@Test
	public void testMissingFile() {
		Path missing = Path.of("does-not-exist", "all.json");
		IOException e = assertThrows(IOException.class, () -> new JsonDatasetLoader(missing).load());
		assertFalse(e instanceof DatasetFormatException);
	}

	@Test
	public void testFormatErrors() throws Exception {
		Path tempDir = Files.createTempDirectory("test-dataset");
		Path dataFile = tempDir.resolve("all.json");

		Files.writeString(dataFile, "{\"data\": []}");
		assertThrows(DatasetFormatException.class, () -> new JsonDatasetLoader(dataFile).load());

		Files.writeString(dataFile, "{\"build_number\": \"1\"}");
		assertThrows(DatasetFormatException.class, () -> new JsonDatasetLoader(dataFile).load());

		Files.writeString(dataFile, "{\"build_number\": \"1\", \"data\": [ {");
		assertThrows(DatasetFormatException.class, () -> new JsonDatasetLoader(dataFile).load());

		Files.writeString(dataFile, "[]");
		assertThrows(DatasetFormatException.class, () -> new JsonDatasetLoader(dataFile).load());

		Files.delete(dataFile);
		Files.delete(tempDir);
	}
}
