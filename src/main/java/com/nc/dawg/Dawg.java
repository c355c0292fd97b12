package com.nc.dawg;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Directed Acyclic Word Graph: a trie whose identical suffixes are stored once.
 *
 * <pre>
 * <code>
 *   var dawg = Dawg.build("test", "tese", "nest", "test2", "tes", "note");
 *
 *   dawg.search("test", 1, 10, false, false); // [test, tese, nest]
 *   dawg.search("test", 1, 10, true, true); // [test, test2, tese, tes, nest]
 * </code>
 * </pre>
 *
 * Instances are immutable once built and can be queried from any number of threads without
 * synchronization. All lengths are in code points.
 */
public final class Dawg {

	final class WordItr implements Iterator<String> {

		final StringBuilder path = new StringBuilder();
		int[] stack = new int[16];
		int[] cursor = new int[16];
		int[] labels = new int[16];
		int depth;
		String curr;

		WordItr() {
			stack[0] = States.ROOT;
			cursor[0] = -1;
		}

		void advance() {
			while (depth >= 0) {
				var s = stack[depth];
				var c = cursor[depth];

				if (c < 0) {
					cursor[depth] = 0;
					if (states.accepting(s)) {
						curr = path.toString();
						return;
					}
					continue;
				}

				var letters = states.letters(s);
				if (c < letters.size()) {
					cursor[depth] = c + 1;
					push(letters.label(c), letters.target(c));
				} else {
					if (depth > 0) {
						Chars.pop(path, labels[depth]);
					}
					depth--;
				}
			}
		}

		@Override
		public boolean hasNext() {
			if (curr == null) {
				advance();
			}
			return curr != null;
		}

		@Override
		public String next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			var rv = curr;
			curr = null;
			return rv;
		}

		void push(int label, int target) {
			if (++depth == stack.length) {
				var cap = depth << 1;
				stack = Arrays.copyOf(stack, cap);
				cursor = Arrays.copyOf(cursor, cap);
				labels = Arrays.copyOf(labels, cap);
			}
			stack[depth] = target;
			cursor[depth] = -1;
			labels[depth] = label;
			path.appendCodePoint(label);
		}
	}

	static final Logger LOG = LoggerFactory.getLogger(Dawg.class);

	/**
	 * Builds a graph with every word of the iterable.
	 *
	 * @throws MalformedWordException
	 *             if some word carries an unpaired surrogate
	 */
	public static Dawg build(Iterable<String> words) {
		var builder = new TrieBuilder();
		for (var word : words) {
			builder.insert(word);
		}
		return compile(builder);
	}

	/**
	 * @see Dawg#build(Iterable)
	 */
	public static Dawg build(Stream<String> words) {
		var builder = new TrieBuilder();
		words.forEachOrdered(builder::insert);
		return compile(builder);
	}

	/**
	 * @see Dawg#build(Iterable)
	 */
	public static Dawg build(String... words) {
		return build(Arrays.asList(words));
	}

	static Dawg compile(TrieBuilder builder) {
		var start = System.nanoTime();
		var states = builder.states;
		var merged = new Minimizer(states).minimize(builder.maxLength());
		var dawg = new Dawg(states, builder.count() - merged, builder.maxLength());

		if (LOG.isDebugEnabled()) {
			LOG.debug("Built graph of {} words: {} states ({} merged), max length {} in {} ms", dawg.wordCount(), dawg.size(), merged, dawg.maxLength(),
					(System.nanoTime() - start) / 1_000_000);
		}

		return dawg;
	}

	/**
	 * Builds a graph reading one word per line. Each line is a word, including empty ones.
	 *
	 * @param reader
	 *            - line source. Not closed by this method.
	 * @throws UncheckedIOException
	 *             if the reader fails. No graph is built.
	 */
	public static Dawg load(BufferedReader reader) {
		var builder = new TrieBuilder();
		try {
			String line;
			while ((line = reader.readLine()) != null) {
				builder.insert(line);
			}
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		return compile(builder);
	}

	/**
	 * Builds a graph from an utf8 file with one word per line.
	 *
	 * @see Dawg#load(BufferedReader)
	 */
	public static Dawg load(Path src) {
		try (var reader = Files.newBufferedReader(src, StandardCharsets.UTF_8)) {
			return load(reader);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	final States states;

	final int size;

	final int maxLength;

	final long wordCount;

	final ConcurrentMap<Integer, PathCounts> pathCounts = new ConcurrentHashMap<>();

	Dawg(States states, int size, int maxLength) {
		this.states = states;
		this.size = size;
		this.maxLength = maxLength;
		this.wordCount = countWords();
	}

	/**
	 * Exact lookup.
	 *
	 * @return true if word was inserted
	 */
	public boolean contains(String word) {
		var s = States.ROOT;
		for (var cp : Chars.codePoints(word)) {
			s = states.letters(s).targetOf(cp);
			if (s == Letters.ABSENT) {
				return false;
			}
		}
		return states.accepting(s);
	}

	long countWords() {
		var memo = new long[states.size()];
		Arrays.fill(memo, -1);
		states.postOrder(States.ROOT, s -> memo[s] >= 0, s -> {
			var rv = states.accepting(s) ? 1L : 0L;
			var letters = states.letters(s);
			for (var i = 0; i < letters.size(); i++) {
				rv += memo[letters.target(i)];
			}
			memo[s] = rv;
		});
		return memo[States.ROOT];
	}

	/**
	 * @return length, in code points, of the longest word
	 */
	public int maxLength() {
		return maxLength;
	}

	/**
	 * Path counts for words of the given length. Computed on first use and kept, at most one per
	 * length in [0, maxLength].
	 */
	PathCounts pathCounts(int length) {
		return pathCounts.computeIfAbsent(length, len -> new PathCounts(states, len));
	}

	/**
	 * @see Dawg#randomWord(int, Random)
	 */
	public String randomWord(int length) {
		return randomWord(length, ThreadLocalRandom.current());
	}

	/**
	 * Picks one of the words with exactly length code points, every such word being equally
	 * likely.
	 *
	 * @return a word or null if there's no word with the given length
	 */
	public String randomWord(int length, Random rnd) {
		if (length < 0 || length > maxLength) {
			return null;
		}

		var counts = pathCounts(length);
		var total = counts.total();
		if (total == 0) {
			return null;
		}

		var sb = new StringBuilder(length + 2);
		var s = States.ROOT;
		var pick = rnd.nextLong(total);

		for (var depth = 0; depth < length; depth++) {
			var letters = states.letters(s);
			var next = Letters.ABSENT;
			for (var i = 0; i < letters.size(); i++) {
				var t = letters.target(i);
				var c = counts.count(depth + 1, t);
				if (pick < c) {
					sb.appendCodePoint(letters.label(i));
					next = t;
					break;
				}
				pick -= c;
			}
			if (next == Letters.ABSENT) {
				throw new IllegalStateException("Path count mismatch at state " + s);
			}
			s = next;
		}

		assert states.accepting(s);

		return sb.toString();
	}

	/**
	 * Approximate lookup.
	 *
	 * @param query
	 *            - word to look for
	 * @param maxEditDistance
	 *            - max number of edits (substitutions and, if allowed, insertions and deletions)
	 *            between query and the returned words. 0 means exact match.
	 * @param maxResults
	 *            - cap on the number of returned words. Zero or negative means unbounded.
	 * @param allowInsert
	 *            - whether returned words may have letters that are not in the query
	 * @param allowDelete
	 *            - whether query letters may be skipped
	 * @return words in discovery order. Words reachable through distinct edit paths may be
	 *         reported more than once. When more than maxResults words are found, the earliest
	 *         ones are dropped, so results are not ranked by distance.
	 * @throws MalformedWordException
	 *             if query carries an unpaired surrogate
	 */
	public List<String> search(String query, int maxEditDistance, int maxResults, boolean allowInsert, boolean allowDelete) {
		if (maxEditDistance < 0) {
			throw new IllegalArgumentException("Negative edit distance: " + maxEditDistance);
		}
		return new FuzzySearch(states, query, maxResults, allowInsert, allowDelete).run(States.ROOT, maxEditDistance);
	}

	/**
	 * @return number of live states, the root included
	 */
	public int size() {
		return size;
	}

	/**
	 * @return number of distinct words
	 */
	public long wordCount() {
		return wordCount;
	}

	/**
	 * @return every word in ascending code point order
	 */
	public Stream<String> words() {
		return StreamSupport.stream(Spliterators.spliteratorUnknownSize(new WordItr(), Spliterator.NONNULL | Spliterator.ORDERED | Spliterator.DISTINCT), false);
	}
}
