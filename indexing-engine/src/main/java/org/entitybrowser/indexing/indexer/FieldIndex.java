package org.entitybrowser.indexing.indexer;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * One inverted mapping from lower-cased keys to the positions of the records carrying that key.
 */
public final class FieldIndex {
	private final Map<String, Set<Integer>> index = new HashMap<>();

	FieldIndex() {}

	void add(String key, int recordIndex) {
		index.computeIfAbsent(key.toLowerCase(Locale.ROOT), k -> new HashSet<>()).add(recordIndex);
	}

	/**
	 * Records stored under exactly {@code key} (compared lower-cased)
	 */
	public Set<Integer> get(String key) {
		Set<Integer> indices = index.get(key.toLowerCase(Locale.ROOT));
		return indices == null ? Collections.emptySet() : Collections.unmodifiableSet(indices);
	}

	/**
	 * Exact lookups compare the lower-cased pattern with each key. Inexact lookups scan every key and union the
	 * records of the keys that contain the lower-cased pattern, so their cost grows with the number of distinct
	 * keys rather than with the number of records.
	 *
	 * @return a fresh, caller-owned set
	 */
	public Set<Integer> lookup(String pattern, boolean exact) {
		String patternLower = pattern.toLowerCase(Locale.ROOT);

		if (exact) {
			Set<Integer> indices = index.get(patternLower);
			return indices == null ? new HashSet<>() : new HashSet<>(indices);
		}

		Set<Integer> matches = new HashSet<>();
		for (Map.Entry<String, Set<Integer>> entry : index.entrySet()) {
			if (entry.getKey().contains(patternLower)) {
				matches.addAll(entry.getValue());
			}
		}
		return matches;
	}

	public Set<String> keys() {
		return Collections.unmodifiableSet(index.keySet());
	}

	public Map<String, Set<Integer>> asMap() {
		return Collections.unmodifiableMap(index);
	}

	public int size() {
		return index.size();
	}

	public int totalMappings() {
		return index.values().stream()
				.mapToInt(Set::size)
				.sum();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof FieldIndex other)) return false;
		return index.equals(other.index);
	}

	@Override
	public int hashCode() {
		return index.hashCode();
	}
}
