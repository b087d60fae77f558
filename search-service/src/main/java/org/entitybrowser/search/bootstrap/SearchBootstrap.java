package org.entitybrowser.search.bootstrap;

import org.entitybrowser.core.loader.JsonDatasetLoader;
import org.entitybrowser.indexing.config.IndexingConfig;
import org.entitybrowser.indexing.service.IncrementalIndexBuilder;
import org.entitybrowser.search.config.SearchConfig;
import org.entitybrowser.search.controller.SearchController;
import org.entitybrowser.search.service.CatalogLoader;
import org.entitybrowser.search.service.RecordCatalog;
import org.entitybrowser.search.service.SearchService;
import org.entitybrowser.search.web.SearchHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.Javalin;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Application bootstrapper for the Search Service.
 *
 * <p>Loads configuration, loads and indexes the dataset, starts the HTTP API, and registers a JVM shutdown hook.</p>
 */
public final class SearchBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(SearchBootstrap.class);

    private SearchBootstrap() {}

    /**
     * Starts the Search Service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
     */
    public static void run() {
        try {
            start();
        } catch (Exception e) {
            logger.error("Failed to start Search Service", e);
            System.exit(1);
        }
    }

    private static void start() {
        SearchConfig cfg = SearchConfig.load();
        ExecutorService indexingExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "catalog-loader");
            thread.setDaemon(true);
            return thread;
        });

        CatalogLoader loader = buildLoader(cfg, indexingExecutor);
        RecordCatalog catalog = loader.load().join();

        SearchService service = new SearchService(catalog, cfg.maxResults());
        Javalin app = startHttp(cfg, service, loader);
        addShutdownHook(indexingExecutor, app);
        logger.info("Search Service started successfully with {} records.", catalog.size());
    }

    private static CatalogLoader buildLoader(SearchConfig cfg, ExecutorService executor) {
        return new CatalogLoader(
            new JsonDatasetLoader(Path.of(cfg.datasetPath())),
            new IncrementalIndexBuilder(IndexingConfig.load()),
            executor
        );
    }

    private static Javalin startHttp(SearchConfig cfg, SearchService service, CatalogLoader loader) {
        SearchController controller = new SearchController(service, loader, cfg.defaultLimit());
        return SearchHttpServer.start(cfg.serverPort(), controller);
    }

    private static void addShutdownHook(ExecutorService executor, Javalin app) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(executor, app)));
    }

    private static void shutdown(ExecutorService executor, Javalin app) {
        logger.info("Shutting down Search Service...");
        app.stop();
        executor.shutdownNow();
        logger.info("Search Service stopped.");
    }
}
