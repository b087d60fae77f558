package org.entitybrowser.indexing.service;

import com.google.gson.JsonParser;
import org.entitybrowser.core.model.GameRecord;
import org.entitybrowser.core.progress.ProgressListener;
import org.entitybrowser.indexing.config.IndexingConfig;
import org.entitybrowser.indexing.indexer.SearchIndex;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class IncrementalIndexBuilderTest {

	private static List<GameRecord> sampleRecords(int count) {
		List<GameRecord> records = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			records.add(GameRecord.fromValue(JsonParser.parseString(
					"{\"id\": \"item_" + i + "\", \"type\": \"TYPE_" + (i % 7) + "\", \"tags\": [\"tag" + (i % 13) + "\"]}")));
		}
		return records;
	}

	/** Runs queued tasks one at a time on the test thread. */
	private static final class ManualExecutor implements Executor {
		private final Queue<Runnable> queue = new ArrayDeque<>();
		private int executed;

		@Override
		public void execute(Runnable command) {
			queue.add(command);
		}

		void runAll() {
			Runnable next;
			while ((next = queue.poll()) != null) {
				executed++;
				next.run();
			}
		}
	}

	@Test
	public void testSameResultAsSinglePass() throws Exception {
		List<GameRecord> records = sampleRecords(2500);
		ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			SearchIndex incremental = new IncrementalIndexBuilder()
					.buildAsync(records, executor, ProgressListener.NONE)
					.get(30, TimeUnit.SECONDS);

			assertEquals(new SearchIndexBuilder().build(records), incremental);
		} finally {
			executor.shutdownNow();
		}
	}

	@Test
	public void testYieldsBetweenChunks() {
		ManualExecutor executor = new ManualExecutor();
		List<String> trace = new ArrayList<>();
		IncrementalIndexBuilder builder = new IncrementalIndexBuilder(new IndexingConfig(100, 100));

		CompletableFuture<SearchIndex> future = builder.buildAsync(sampleRecords(350), executor,
				(processed, total) -> trace.add(String.valueOf(processed)));
		executor.execute(() -> trace.add("other work"));

		assertFalse(future.isDone());
		executor.runAll();

		assertTrue(future.isDone());
		assertEquals(List.of("1", "other work", "101", "201", "301", "350"), trace);
		assertEquals(5, executor.executed);
	}

	@Test
	public void testProgressReachesTotal() throws Exception {
		ManualExecutor executor = new ManualExecutor();
		List<Integer> reported = new ArrayList<>();

		CompletableFuture<SearchIndex> future = new IncrementalIndexBuilder(new IndexingConfig(100, 30))
				.buildAsync(sampleRecords(250), executor, (processed, total) -> reported.add(processed));
		executor.runAll();

		assertEquals(List.of(1, 101, 201, 250), reported);
		assertEquals(250, future.get().byId().size());
	}

	@Test
	public void testEmptyCollection() throws Exception {
		ManualExecutor executor = new ManualExecutor();
		CompletableFuture<SearchIndex> future = new IncrementalIndexBuilder()
				.buildAsync(List.of(), executor, ProgressListener.NONE);
		executor.runAll();

		assertEquals(SearchIndex.empty(), future.get());
	}

	@Test
	public void testCancelStopsFurtherChunks() {
		ManualExecutor executor = new ManualExecutor();
		CompletableFuture<SearchIndex> future = new IncrementalIndexBuilder(new IndexingConfig(250, 10))
				.buildAsync(sampleRecords(100), executor, ProgressListener.NONE);

		executor.queue.poll().run();
		future.cancel(false);
		executor.runAll();

		assertTrue(future.isCancelled());
		assertEquals(1, executor.executed);
		assertTrue(executor.queue.isEmpty());
	}

	@Test
	public void testFailingListenerFailsTheBuild() {
		ManualExecutor executor = new ManualExecutor();
		CompletableFuture<SearchIndex> future = new IncrementalIndexBuilder()
				.buildAsync(sampleRecords(5), executor, (processed, total) -> {
					throw new IllegalStateException("renderer gone");
				});
		executor.runAll();

		ExecutionException e = assertThrows(ExecutionException.class, future::get);
		assertInstanceOf(IllegalStateException.class, e.getCause());
	}
}
