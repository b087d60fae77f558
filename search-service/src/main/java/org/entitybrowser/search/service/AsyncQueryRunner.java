package org.entitybrowser.search.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Evaluates queries off the caller's thread, coalescing rapid successive submissions.
 *
 * <p>Each {@link #submit(String)} starts a new generation and schedules the evaluation after the debounce delay,
 * cancelling the one still waiting. The scheduled task receives its generation by value and posts a
 * {@link QueryOutcome} to a result queue; the caller only ever sees the outcome of the latest generation and
 * discards the rest. Intended for a single owning thread, typically the one holding the current query text.</p>
 */
public class AsyncQueryRunner {
	private static final Logger logger = LoggerFactory.getLogger(AsyncQueryRunner.class);

	private final Supplier<RecordCatalog> catalogSource;
	private final ScheduledExecutorService scheduler;
	private final Duration debounce;
	private final BlockingQueue<QueryOutcome> outcomes = new LinkedBlockingQueue<>();

	private long generation;
	private ScheduledFuture<?> pending;
	private QueryOutcome latest;

	public AsyncQueryRunner(Supplier<RecordCatalog> catalogSource, ScheduledExecutorService scheduler, Duration debounce) {
		this.catalogSource = catalogSource;
		this.scheduler = scheduler;
		this.debounce = debounce;
	}

	/**
	 * @return the generation assigned to this query
	 */
	public long submit(String query) {
		long submitted = ++generation;
		if (pending != null) {
			pending.cancel(false);
		}

		RecordCatalog catalog = catalogSource.get();
		pending = scheduler.schedule(() -> evaluate(submitted, query, catalog), debounce.toMillis(), TimeUnit.MILLISECONDS);
		return submitted;
	}

	private void evaluate(long submitted, String query, RecordCatalog catalog) {
		try {
			outcomes.add(new QueryOutcome(submitted, query, catalog, catalog.search(query)));
		} catch (RuntimeException e) {
			logger.error("Query '{}' (generation {}) failed", query, submitted, e);
			throw e;
		}
	}

	/**
	 * Drains posted outcomes without blocking.
	 *
	 * @return the outcome of the latest submitted query, once it is available
	 */
	public Optional<QueryOutcome> poll() {
		QueryOutcome outcome;
		while ((outcome = outcomes.poll()) != null) {
			accept(outcome);
		}
		return current();
	}

	/**
	 * Waits up to {@code timeout} for the outcome of the latest submitted query.
	 */
	public Optional<QueryOutcome> await(Duration timeout) throws InterruptedException {
		long deadline = System.nanoTime() + timeout.toNanos();

		while (current().isEmpty()) {
			long remaining = deadline - System.nanoTime();
			if (remaining <= 0) {
				break;
			}
			QueryOutcome outcome = outcomes.poll(remaining, TimeUnit.NANOSECONDS);
			if (outcome == null) {
				break;
			}
			accept(outcome);
		}
		return current();
	}

	public long currentGeneration() {
		return generation;
	}

	private void accept(QueryOutcome outcome) {
		if (outcome.generation() == generation) {
			latest = outcome;
		} else {
			logger.debug("Discarding stale result for '{}' (generation {} < {})", outcome.query(), outcome.generation(), generation);
		}
	}

	private Optional<QueryOutcome> current() {
		if (latest != null && latest.generation() == generation) {
			return Optional.of(latest);
		}
		return Optional.empty();
	}
}
