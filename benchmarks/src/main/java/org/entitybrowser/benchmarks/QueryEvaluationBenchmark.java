package org.entitybrowser.benchmarks;

import org.entitybrowser.core.model.GameRecord;
import org.entitybrowser.indexing.indexer.SearchIndex;
import org.entitybrowser.indexing.service.SearchIndexBuilder;
import org.entitybrowser.search.query.QueryParser;
import org.entitybrowser.search.service.QueryEvaluator;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for query evaluation
 * Tests: word search, indexed classifiers, tree-walk classifiers, exact value scans, multi-term intersection
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class QueryEvaluationBenchmark {

	private List<GameRecord> records;
	private SearchIndex index;

	@Param({"1000", "10000", "30000"})
	private int recordCount;

	@Setup(Level.Trial)
	public void setup() {
		System.out.println("=== Query Evaluation Benchmark Setup (recordCount=" + recordCount + ") ===");

		records = SyntheticRecords.generate(recordCount, 42L);
		index = new SearchIndexBuilder().build(records);

		System.out.println("Index ready: " + index.getStats().uniqueWords() + " unique words");
	}

	/**
	 * Benchmark: Single bare word, substring match over the word index
	 */
	@Benchmark
	public void searchSingleWord(Blackhole blackhole) {
		blackhole.consume(QueryEvaluator.evaluate(index, records, "zomb"));
	}

	/**
	 * Benchmark: Classifier answered from the type index
	 */
	@Benchmark
	public void searchIndexedClassifier(Blackhole blackhole) {
		blackhole.consume(QueryEvaluator.evaluate(index, records, "t:monster"));
	}

	/**
	 * Benchmark: Classifier that needs a walk over every record
	 */
	@Benchmark
	public void searchNestedPath(Blackhole blackhole) {
		blackhole.consume(QueryEvaluator.evaluate(index, records, "name.str:crystal"));
	}

	/**
	 * Benchmark: Exact value without classifier, scans every value of every record
	 */
	@Benchmark
	public void searchExactValue(Blackhole blackhole) {
		blackhole.consume(QueryEvaluator.evaluate(index, records, "'EMITTER'"));
	}

	/**
	 * Benchmark: Several terms intersected
	 */
	@Benchmark
	public void searchMultipleTerms(Blackhole blackhole) {
		blackhole.consume(QueryEvaluator.evaluate(index, records, "t:tool c:tools steel flags:flam"));
	}

	/**
	 * Benchmark: Empty query lists every record
	 */
	@Benchmark
	public void listAll(Blackhole blackhole) {
		blackhole.consume(QueryEvaluator.evaluate(index, records, ""));
	}

	/**
	 * Benchmark: Parsing alone
	 */
	@Benchmark
	public void parseQuery(Blackhole blackhole) {
		blackhole.consume(QueryParser.parse("t:tool 'steel hammer' name.str:'glowing rock' c:weapons"));
	}
}
