package org.entitybrowser.benchmarks;

import org.entitybrowser.core.model.GameRecord;
import org.entitybrowser.core.progress.ProgressListener;
import org.entitybrowser.indexing.indexer.SearchIndex;
import org.entitybrowser.indexing.service.IncrementalIndexBuilder;
import org.entitybrowser.indexing.service.SearchIndexBuilder;
import org.entitybrowser.indexing.service.WordTokenizer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for building the search index
 * Tests: synchronous build, chunked build on an executor, tokenization
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class IndexBuildBenchmark {

	private List<GameRecord> records;
	private SearchIndexBuilder builder;
	private IncrementalIndexBuilder incrementalBuilder;
	private ExecutorService executor;

	@Param({"1000", "10000", "30000"})
	private int recordCount;

	@Setup(Level.Trial)
	public void setup() {
		System.out.println("=== Index Build Benchmark Setup (recordCount=" + recordCount + ") ===");

		records = SyntheticRecords.generate(recordCount, 42L);
		builder = new SearchIndexBuilder();
		incrementalBuilder = new IncrementalIndexBuilder();
		executor = Executors.newSingleThreadExecutor();

		SearchIndex index = builder.build(records);
		System.out.println("Index ready: " + index.getStats().uniqueWords() + " unique words");
	}

	@TearDown(Level.Trial)
	public void tearDown() {
		executor.shutdownNow();
	}

	/**
	 * Benchmark: Build the full index in one pass
	 */
	@Benchmark
	public void buildIndex(Blackhole blackhole) {
		blackhole.consume(builder.build(records));
	}

	/**
	 * Benchmark: Build the index as a chain of chunks on an executor
	 * The difference to buildIndex is the scheduling overhead
	 */
	@Benchmark
	public void buildIndexIncrementally(Blackhole blackhole) throws InterruptedException, ExecutionException {
		blackhole.consume(incrementalBuilder.buildAsync(records, executor, ProgressListener.NONE).get());
	}

	/**
	 * Benchmark: Tokenize every record's name
	 */
	@Benchmark
	public void tokenizeNames(Blackhole blackhole) {
		for (GameRecord record : records) {
			blackhole.consume(WordTokenizer.tokenize(record.value().getAsJsonObject()
					.getAsJsonObject("name").get("str").getAsString()));
		}
	}
}
