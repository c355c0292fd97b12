package com.nc.dawg;

import static com.nc.dawg.DawgTestSupport.randomWords;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.Test;

public class MinimizerTests extends BaseDawgTests {

	static TrieBuilder trie(List<String> words) {
		var builder = new TrieBuilder();
		words.forEach(builder::insert);
		return builder;
	}

	static List<Integer> reachable(States states) {
		var seen = new HashSet<Integer>();
		var stack = new ArrayList<Integer>();
		stack.add(States.ROOT);
		while (!stack.isEmpty()) {
			var s = stack.remove(stack.size() - 1);
			if (seen.add(s)) {
				var letters = states.letters(s);
				for (var i = 0; i < letters.size(); i++) {
					stack.add(letters.target(i));
				}
			}
		}
		return new ArrayList<>(seen);
	}

	@Test
	public void test_live_states_match_reachable_states() {
		var words = randomWords(31, 3000, "abcdef", 1, 9);
		var builder = trie(words);
		var merged = new Minimizer(builder.states, 4).minimize(builder.maxLength());

		assertEquals(builder.count() - merged, reachable(builder.states).size());
	}

	@Test
	public void test_long_chains() {
		var n = 100_000;
		var builder = trie(List.of("a".repeat(n), "b".repeat(n - 1) + "a", "c"));
		var minimizer = new Minimizer(builder.states, 2);

		// the three leaves collapse, then the two states right above them
		assertEquals(3, minimizer.minimize(builder.maxLength()));
		assertEquals(0, minimizer.minimize(builder.maxLength()));
	}

	@Test
	public void test_minimize_is_a_fixed_point() {
		for (var threads : new int[]{ 1, 2, 8 }) {
			var builder = trie(randomWords(37, 2000, "abcd", 1, 8));
			var minimizer = new Minimizer(builder.states, threads);

			var merged = minimizer.minimize(builder.maxLength());
			assertNotEquals(0, merged);
			assertEquals(0, minimizer.minimize(builder.maxLength()));
			assertEquals(0, new Minimizer(builder.states, threads).minimize(builder.maxLength()));
		}
	}

	@Test
	public void test_no_equivalent_states_survive() {
		var builder = trie(randomWords(41, 2000, "xyz", 1, 7));
		new Minimizer(builder.states).minimize(builder.maxLength());

		var states = builder.states;
		var live = reachable(states);
		for (var i = 0; i < live.size(); i++) {
			for (var j = i + 1; j < live.size(); j++) {
				var a = live.get(i);
				var b = live.get(j);
				assertTrue(a + " ~ " + b, !states.same(a, b));
			}
		}
	}

	@Test
	public void test_shared_suffixes() {
		var builder = trie(List.of("test", "rest", "nest", "note"));

		assertEquals(16, builder.count());
		assertEquals(8, new Minimizer(builder.states).minimize(builder.maxLength()));

		var states = builder.states;
		var root = states.letters(States.ROOT);
		var t = root.targetOf('t');
		assertEquals(t, root.targetOf('r'));
		assertNotEquals(t, root.targetOf('n'));
		assertEquals(states.letters(t).targetOf('e'), states.letters(root.targetOf('n')).targetOf('e'));
	}

	@Test
	public void test_thread_count_does_not_change_result() {
		var words = randomWords(43, 5000, "abcdefg", 1, 10);
		var expected = Dawg.build(words);

		for (var threads : new int[]{ 1, 3, 16 }) {
			var builder = trie(words);
			var merged = new Minimizer(builder.states, threads).minimize(builder.maxLength());
			var dawg = new Dawg(builder.states, builder.count() - merged, builder.maxLength());

			assertEquals(expected.size(), dawg.size());
			assertEquals(expected.words().collect(Collectors.toList()), dawg.words().collect(Collectors.toList()));
		}
	}
}
