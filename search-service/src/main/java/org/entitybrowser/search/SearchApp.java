package org.entitybrowser.search;

import org.entitybrowser.search.bootstrap.SearchBootstrap;

public class SearchApp {
    public static void main(String[] args) {
        SearchBootstrap.run();
    }
}
