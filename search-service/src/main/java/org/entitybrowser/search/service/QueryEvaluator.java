package org.entitybrowser.search.service;

import org.entitybrowser.core.model.GameRecord;
import org.entitybrowser.indexing.indexer.IndexedField;
import org.entitybrowser.indexing.indexer.SearchIndex;
import org.entitybrowser.search.query.QueryParser;
import org.entitybrowser.search.query.SearchTerm;
import org.entitybrowser.search.query.ValueMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Resolves a query to the positions of the matching records.
 *
 * <p>Every term is resolved on its own, through one of the index mappings when it can be and by walking each
 * record's tree otherwise, and the per-term sets are intersected. Evaluation stops at the first term that leaves
 * nothing to intersect. The result is sorted ascending.</p>
 */
public final class QueryEvaluator {
	private static final Logger logger = LoggerFactory.getLogger(QueryEvaluator.class);

	private QueryEvaluator() {}

	/**
	 * @param index   index built from exactly {@code records}
	 * @param records the record collection the index positions refer to
	 * @param query   free-text query; null or blank matches every record
	 */
	public static List<Integer> evaluate(SearchIndex index, List<GameRecord> records, String query) {
		List<SearchTerm> terms = QueryParser.parse(query);
		if (terms.isEmpty()) {
			return allIndices(records.size());
		}

		Set<Integer> results = null;
		for (SearchTerm term : terms) {
			Set<Integer> matches = resolveTerm(term, index, records);
			results = results == null ? matches : intersect(results, matches);

			if (results.isEmpty()) {
				logger.debug("Query '{}' short-circuited at term {}", query, term);
				return Collections.emptyList();
			}
		}

		List<Integer> sorted = new ArrayList<>(results);
		Collections.sort(sorted);
		return sorted;
	}

	/**
	 * Records matching a single term
	 */
	static Set<Integer> resolveTerm(SearchTerm term, SearchIndex index, List<GameRecord> records) {
		if (term.hasClassifier()) {
			Optional<IndexedField> field = IndexedField.forClassifier(term.classifier());
			if (field.isPresent()) {
				logger.debug("Term {} served by the {} index", term, field.get());
				return index.lookupField(field.get(), term.pattern(), term.exact());
			}
			logger.debug("Term {} needs a tree walk over {} records", term, records.size());
			return scanField(records, term.classifier(), term.pattern(), term.exact());
		}

		if (term.exact()) {
			return scanValues(records, term.pattern());
		}
		return index.searchWords(term.pattern());
	}

	private static Set<Integer> scanField(List<GameRecord> records, String path, String pattern, boolean exact) {
		String[] parts = ValueMatcher.splitPath(path);
		String normalized = ValueMatcher.normalize(pattern, exact);

		return IntStream.range(0, records.size())
				.filter(i -> ValueMatcher.matchesFieldParts(records.get(i).value(), parts, 0, normalized, exact))
				.boxed()
				.collect(Collectors.toCollection(HashSet::new));
	}

	private static Set<Integer> scanValues(List<GameRecord> records, String pattern) {
		return IntStream.range(0, records.size())
				.filter(i -> ValueMatcher.matchesValue(records.get(i).value(), pattern, true))
				.boxed()
				.collect(Collectors.toCollection(HashSet::new));
	}

	private static Set<Integer> intersect(Set<Integer> a, Set<Integer> b) {
		Set<Integer> smaller = a.size() <= b.size() ? a : b;
		Set<Integer> larger = smaller == a ? b : a;
		smaller.retainAll(larger);
		return smaller;
	}

	private static List<Integer> allIndices(int size) {
		return IntStream.range(0, size).boxed().collect(Collectors.toList());
	}
}
