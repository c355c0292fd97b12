package com.nc.dawg;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the trie into a DAG by merging states with the same right language.
 * <p>
 * Every state but the root is first classified by its level, the length of the longest path to a
 * leaf (leaves are at level 0). The subtrees under each edge of the root are classified
 * concurrently and each level has its own lock. Levels are then merged bottom-up: when two states
 * of the same level have the same acceptance and the same edges, the incoming edge of the later
 * one is redirected to the earlier one. Since children are canonical by the time their parents'
 * level is visited, edges can be compared by handle.
 */
final class Minimizer {

	static final Logger LOG = LoggerFactory.getLogger(Minimizer.class);

	static final int THREADS = Integer.getInteger("Dawg.MINIMIZE_THREADS", Runtime.getRuntime().availableProcessors());

	static final AtomicInteger SEQ = new AtomicInteger();

	final States states;

	final int threads;

	int[] heads;

	ReentrantLock[] locks;

	AtomicIntegerArray levelOf;

	Minimizer(States states) {
		this(states, THREADS);
	}

	Minimizer(States states, int threads) {
		this.states = states;
		this.threads = Math.max(1, threads);
	}

	/**
	 * Classifies every unclassified state under sub.
	 */
	void classify(int sub) {
		states.postOrder(sub, s -> levelOf.get(s) >= 0, this::finish);
	}

	void classifyAll() {
		var root = states.letters(States.ROOT);
		if (root.isEmpty()) {
			return;
		}

		var tasks = new ArrayList<Callable<Void>>(root.size());
		for (var i = 0; i < root.size(); i++) {
			var sub = root.target(i);
			tasks.add(() -> {
				classify(sub);
				return null;
			});
		}

		var pool = newPool(Math.min(threads, tasks.size()));
		try {
			for (Future<Void> f : pool.invokeAll(tasks)) {
				f.get();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while classifying states", e);
		} catch (ExecutionException e) {
			var cause = e.getCause();
			if (cause instanceof RuntimeException re) {
				throw re;
			}
			if (cause instanceof Error err) {
				throw err;
			}
			throw new IllegalStateException(cause);
		} finally {
			pool.shutdownNow();
		}
	}

	/**
	 * Called once all children of s are classified: s sits one level above its highest child.
	 */
	void finish(int s) {
		var level = 0;
		var letters = states.letters(s);
		for (var i = 0; i < letters.size(); i++) {
			var sub = levelOf.get(letters.target(i)) + 1;
			if (sub > level) {
				level = sub;
			}
		}

		// a shared state (minimized graph) may be reached by two workers at once
		if (levelOf.compareAndSet(s, -1, level)) {
			var lock = locks[level];
			lock.lock();
			try {
				states.next[s] = heads[level];
				heads[level] = s;
			} finally {
				lock.unlock();
			}
		}
	}

	int merge(int level) {
		var states = this.states;
		var next = states.next;
		var merged = 0;

		for (var curr = heads[level]; curr != States.NIL && next[curr] != States.NIL; curr = next[curr]) {
			var prev = curr;
			for (var same = next[curr]; same != States.NIL; same = next[same]) {
				if (states.same(curr, same)) {
					next[prev] = next[same];
					redirect(same, curr);
					merged++;
				} else {
					prev = same;
				}
			}
		}

		return merged;
	}

	/**
	 * @param maxLength
	 *            - length, in code points, of the longest word in the trie
	 * @return number of states merged away
	 */
	int minimize(int maxLength) {
		var start = System.nanoTime();

		heads = new int[maxLength];
		Arrays.fill(heads, States.NIL);
		locks = new ReentrantLock[maxLength];
		for (var i = 0; i < maxLength; i++) {
			locks[i] = new ReentrantLock();
		}
		levelOf = new AtomicIntegerArray(states.size());
		for (var i = 0; i < states.size(); i++) {
			levelOf.set(i, -1);
		}

		classifyAll();

		var merged = 0;
		for (var level = 0; level < maxLength; level++) {
			merged += merge(level);
		}

		if (LOG.isDebugEnabled()) {
			LOG.debug("Merged {} of {} states over {} levels in {} ms", merged, states.size(), maxLength, (System.nanoTime() - start) / 1_000_000);
		}

		heads = null;
		locks = null;
		levelOf = null;

		return merged;
	}

	ExecutorService newPool(int n) {
		return Executors.newFixedThreadPool(n, r -> {
			var t = new Thread(r, "dawg-minimize-" + SEQ.incrementAndGet());
			t.setDaemon(true);
			return t;
		});
	}

	void redirect(int from, int to) {
		var parent = states.parent[from];
		assert from != to : "Self merge: " + from;
		if (parent == States.NIL) {
			throw new IllegalStateException("State " + from + " has no incoming edge");
		}
		states.letters(parent).retarget(states.parentLabel[from], to);
	}
}
