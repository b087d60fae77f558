package org.entitybrowser.search.config;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class SearchConfigTest {

	@Test
	public void testReadsRequiredKeys() {
		Properties properties = new Properties();
		properties.setProperty("server.port", "7003");
		properties.setProperty("search.max.results", "500");
		properties.setProperty("search.default.limit", "50");
		properties.setProperty("dataset.path", " /data/all.json ");

		SearchConfig config = SearchConfig.from(properties);

		assertEquals(7003, config.serverPort());
		assertEquals(500, config.maxResults());
		assertEquals(50, config.defaultLimit());
		assertEquals("/data/all.json", config.datasetPath());
	}

	@Test
	public void testMissingKeyFailsFast() {
		Properties properties = new Properties();
		properties.setProperty("server.port", "7003");

		IllegalStateException e = assertThrows(IllegalStateException.class, () -> SearchConfig.from(properties));
		assertTrue(e.getMessage().contains("search.max.results"));
	}

	@Test
	public void testInvalidInteger() {
		Properties properties = new Properties();
		properties.setProperty("server.port", "http");

		assertThrows(IllegalStateException.class, () -> SearchConfig.from(properties));
	}
}
