package org.entitybrowser.search.web;

import org.entitybrowser.search.controller.SearchController;

import io.javalin.Javalin;

/** HTTP server wiring for the Search Service. */
public final class SearchHttpServer {
    private SearchHttpServer() {}

    /**
     * Creates the Javalin app and registers routes without starting it.
     *
     * @param controller controller that registers routes
     * @return configured {@link Javalin} instance
     */
    public static Javalin create(SearchController controller) {
        Javalin app = Javalin.create(cfg -> cfg.showJavalinBanner = false);
        controller.registerRoutes(app);
        return app;
    }

    /**
     * Starts the Javalin HTTP server and registers routes.
     *
     * @param port port to bind
     * @param controller controller that registers routes
     * @return started {@link Javalin} instance
     */
    public static Javalin start(int port, SearchController controller) {
        return create(controller).start(port);
    }
}
