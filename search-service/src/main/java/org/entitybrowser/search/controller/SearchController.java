package org.entitybrowser.search.controller;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.entitybrowser.core.model.GameRecord;
import org.entitybrowser.search.model.SearchResponse;
import org.entitybrowser.search.service.CatalogLoader;
import org.entitybrowser.search.service.SearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class SearchController {
	private static final Logger logger = LoggerFactory.getLogger(SearchController.class);
	private static final Gson gson = new Gson();
	private final SearchService searchService;
	private final CatalogLoader catalogLoader;
	private final int defaultLimit;

	public SearchController(SearchService searchService, CatalogLoader catalogLoader, int defaultLimit) {
		this.searchService = searchService;
		this.catalogLoader = catalogLoader;
		this.defaultLimit = defaultLimit;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/health", this::handleHealth);

		app.get("/search", this::handleSearch);

		app.get("/records/{index}", this::handleRecord);

		app.get("/stats", this::handleStats);

		app.post("/reload", this::handleReload);

		logger.info("Search routes registered");
	}

	/**
	 * GET /health
	 * Health check endpoint
	 */
	private void handleHealth(Context ctx) {
		Map<String, Object> health = new HashMap<>();
		health.put("service", "search-service");
		health.put("status", "running");
		health.put("timestamp", System.currentTimeMillis());

		SearchService.SearchStats stats = searchService.getStats();
		health.put("total_records", stats.totalRecords());
		health.put("build", stats.buildTag());

		ctx.result(gson.toJson(health));
	}

	/**
	 * GET /search?q={query}&limit={limit}
	 * An absent or blank query lists every record
	 */
	private void handleSearch(Context ctx) {
		try {
			String query = ctx.queryParam("q");
			String limitStr = ctx.queryParam("limit");

			int limit = defaultLimit;
			if (limitStr != null && !limitStr.isEmpty()) {
				try {
					limit = Integer.parseInt(limitStr);
				} catch (NumberFormatException e) {
					error(ctx, 400, "Invalid limit format. Must be an integer.");
					return;
				}
			}

			logger.debug("Search request: q='{}', limit={}", query, limit);

			SearchResponse response = searchService.search(query, limit);
			ctx.status(200).result(gson.toJson(response));

		} catch (Exception e) {
			error(ctx, 500, "Search failed: " + e.getMessage());
			logger.error("Search failed", e);
		}
	}

	/**
	 * GET /records/{index}
	 * Raw JSON of one record of the current catalog
	 */
	private void handleRecord(Context ctx) {
		int index;
		try {
			index = Integer.parseInt(ctx.pathParam("index"));
		} catch (NumberFormatException e) {
			error(ctx, 400, "Invalid record index. Must be an integer.");
			return;
		}

		Optional<GameRecord> record = searchService.getRecord(index);
		if (record.isEmpty()) {
			error(ctx, 404, "No record at index " + index);
			return;
		}
		ctx.status(200).result(gson.toJson(record.get().value()));
	}

	/**
	 * GET /stats
	 * Catalog and index statistics
	 */
	private void handleStats(Context ctx) {
		SearchService.SearchStats stats = searchService.getStats();

		Map<String, Object> response = new HashMap<>();
		response.put("total_records", stats.totalRecords());
		response.put("build", stats.buildTag());
		response.put("id_keys", stats.index().idKeys());
		response.put("type_keys", stats.index().typeKeys());
		response.put("category_keys", stats.index().categoryKeys());
		response.put("unique_words", stats.index().uniqueWords());
		response.put("total_word_mappings", stats.index().totalWordMappings());

		ctx.status(200).result(gson.toJson(response));
	}

	/**
	 * POST /reload
	 * Re-read the dataset and swap in the new catalog once it is fully indexed
	 */
	private void handleReload(Context ctx) {
		catalogLoader.load()
				.thenAccept(searchService::replaceCatalog)
				.exceptionally(e -> {
					logger.error("Catalog reload failed", e);
					return null;
				});

		Map<String, Object> response = new HashMap<>();
		response.put("status", "reloading");
		ctx.status(202).result(gson.toJson(response));
	}

	private static void error(Context ctx, int status, String message) {
		Map<String, String> error = new HashMap<>();
		error.put("error", message);
		ctx.status(status).result(gson.toJson(error));
	}
}
