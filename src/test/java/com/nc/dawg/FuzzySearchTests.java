package com.nc.dawg;

import static com.nc.dawg.DawgTestSupport.randomWord;
import static com.nc.dawg.DawgTestSupport.randomWords;
import static com.nc.dawg.DawgTestSupport.sorted;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.Assert;
import org.junit.Test;

public class FuzzySearchTests extends BaseDawgTests {

	static final String ALPHABET = "abcde";

	@Test
	public void test_cap_is_respected() {
		var dawg = Dawg.build(randomWords(3, 300, ALPHABET, 2, 6));
		var rng = new Random(5);

		for (var q = 0; q < 20; q++) {
			var query = randomWord(rng, ALPHABET, 1, 7);
			for (var d = 0; d <= 2; d++) {
				for (var k = 1; k <= 5; k++) {
					for (var flags = 0; flags < 4; flags++) {
						var found = dawg.search(query, d, k, (flags & 1) != 0, (flags & 2) != 0);
						assertTrue(found.size() + " > " + k, found.size() <= k);
					}
				}
			}
		}
	}

	@Test
	public void test_concurrent_queries() throws InterruptedException, ExecutionException {
		var dawg = Dawg.build(randomWords(13, 2000, ALPHABET, 3, 8));
		var queries = randomWords(17, 64, ALPHABET, 3, 8);

		var expected = new ArrayList<List<String>>();
		for (var q : queries) {
			expected.add(dawg.search(q, 2, 0, true, true));
		}

		var pool = Executors.newFixedThreadPool(4);
		try {
			var tasks = new ArrayList<Callable<List<String>>>();
			for (var q : queries) {
				tasks.add(() -> dawg.search(q, 2, 0, true, true));
			}
			var i = 0;
			for (Future<List<String>> f : pool.invokeAll(tasks)) {
				assertEquals(expected.get(i++), f.get());
			}
		} finally {
			pool.shutdownNow();
		}
	}

	@Test
	public void test_distance_budget_is_monotonic() {
		var dawg = Dawg.build(randomWords(21, 400, ALPHABET, 2, 6));
		var rng = new Random(23);

		for (var q = 0; q < 20; q++) {
			var query = randomWord(rng, ALPHABET, 2, 6);
			for (var flags = 0; flags < 4; flags++) {
				var insert = (flags & 1) != 0;
				var delete = (flags & 2) != 0;
				Set<String> prev = Set.of();
				for (var d = 0; d <= 3; d++) {
					var curr = sorted(dawg.search(query, d, 0, insert, delete));
					assertTrue(query + "@" + d, curr.containsAll(prev));
					prev = curr;
				}
			}
		}
	}

	@Test
	public void test_earliest_results_are_dropped() {
		var dawg = sample();

		var all = dawg.search("test", 1, 0, true, true);
		assertEquals(List.of("test", "test2", "tese", "tes", "nest"), all);

		for (var k = 1; k < all.size(); k++) {
			assertEquals(all.subList(1, k + 1), dawg.search("test", 1, k, true, true));
		}
		assertEquals(all, dawg.search("test", 1, all.size(), true, true));
	}

	@Test
	public void test_exact() {
		var dawg = sample();

		assertEquals(List.of("test"), dawg.search("test", 0, 1, false, false));
		assertEquals(List.of("test"), dawg.search("test", 0, 0, true, true));
		assertEquals(List.of(), dawg.search("tost", 0, 10, true, true));
		assertEquals(List.of(), dawg.search("te", 0, 10, false, false));
	}

	@Test
	public void test_insert_and_delete() {
		var found = sample().search("test", 1, 10, true, true);

		assertEquals(5, found.size());
		assertEquals(sorted(List.of("test", "tese", "nest", "test2", "tes")), sorted(found));
	}

	@Test
	public void test_insert_only() {
		var found = sample().search("tes", 1, 10, true, false);

		assertEquals(3, found.size());
		assertEquals(sorted(List.of("tes", "test", "tese")), sorted(found));
	}

	@Test
	public void test_long_query() {
		var n = 100_000;
		var word = "a".repeat(n);

		var dawg = Dawg.build(word, word + "b");
		assertEquals(List.of(word, word + "b"), dawg.search(word, 1, 0, true, false));
		assertEquals(List.of(word), dawg.search(word.substring(1) + "x", 1, 0, false, false));

		// every match needs n - 1 edits, most of them deletions
		var abc = Dawg.build("abc");
		assertEquals(List.of("abc"), abc.search(word, n, 1, false, true));
	}

	@Test
	public void test_malformed_query() {
		try {
			sample().search("te\uDC00t", 1, 10, true, true);
			Assert.fail();
		} catch (MalformedWordException e) {
			assertEquals(2, e.index());
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void test_negative_distance_is_rejected() {
		sample().search("test", -1, 10, true, true);
	}

	@Test
	public void test_substitution_only() {
		var found = sample().search("test", 1, 10, false, false);

		assertEquals(3, found.size());
		assertEquals(sorted(List.of("test", "tese", "nest")), sorted(found));
	}

	@Test
	public void test_unicode() {
		var dawg = Dawg.build("日本", "日本語", "本日");

		assertEquals(List.of("日本"), dawg.search("日本", 0, 1, false, false));
		assertEquals(sorted(List.of("日本", "日本語")), sorted(dawg.search("日本", 1, 0, true, false)));
		assertEquals(List.of("日本"), dawg.search("日木", 1, 0, false, false));

		var emoji = Dawg.build("a😀b", "acb");
		assertEquals(sorted(List.of("a😀b", "acb")), sorted(emoji.search("axb", 1, 0, false, false)));
	}
}
