package org.entitybrowser.search.service;

import java.util.List;

/**
 * Result of one asynchronous query evaluation, tagged with the generation it was submitted under. {@code matches}
 * are positions in {@code catalog}, the catalog that was current when the query was submitted.
 */
public record QueryOutcome(long generation, String query, RecordCatalog catalog, List<Integer> matches) {}
