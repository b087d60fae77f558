package org.entitybrowser.indexing.config;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class IndexingConfigTest {

	@Test
	public void testDefaultsWhenKeysMissing() {
		IndexingConfig config = IndexingConfig.from(new Properties());

		assertEquals(IndexingConfig.defaults(), config);
	}

	@Test
	public void testReadsProperties() {
		Properties properties = new Properties();
		properties.setProperty("index.progress.interval", " 500 ");
		properties.setProperty("index.yield.interval", "2000");

		IndexingConfig config = IndexingConfig.from(properties);

		assertEquals(500, config.progressInterval());
		assertEquals(2000, config.yieldInterval());
	}

	@Test
	public void testInvalidValuesFailFast() {
		Properties notANumber = new Properties();
		notANumber.setProperty("index.progress.interval", "often");
		assertThrows(IllegalStateException.class, () -> IndexingConfig.from(notANumber));

		assertThrows(IllegalStateException.class, () -> new IndexingConfig(0, 1000));
		assertThrows(IllegalStateException.class, () -> new IndexingConfig(250, -1));
	}

	@Test
	public void testLoadFromClasspath() {
		IndexingConfig config = IndexingConfig.load();

		assertTrue(config.progressInterval() > 0);
		assertTrue(config.yieldInterval() > 0);
	}
}
