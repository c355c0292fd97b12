package com.nc.dawg;

import java.util.Arrays;

/**
 * Number of accepted paths of a fixed length, for every state reachable from the root at each
 * depth. Built breadth first and summed back from the deepest frontier, so no recursion is
 * involved. Immutable once built.
 */
final class PathCounts {

	static final int[] EMPTY = new int[0];

	final int length;

	/**
	 * frontier[d]: sorted handles reachable from the root in exactly d edges.
	 */
	final int[][] frontier;

	/**
	 * counts[d][i]: accepted paths with length - d edges leaving frontier[d][i].
	 */
	final long[][] counts;

	PathCounts(States states, int length) {
		this.length = length;
		this.frontier = new int[length + 1][];
		this.counts = new long[length + 1][];

		frontier[0] = new int[]{ States.ROOT };

		// stamp d + 1 marks a handle already in frontier[d + 1]
		var mark = new int[states.size()];
		var buf = new int[16];

		for (var d = 0; d < length; d++) {
			var n = 0;
			for (var s : frontier[d]) {
				var letters = states.letters(s);
				for (var i = 0; i < letters.size(); i++) {
					var t = letters.target(i);
					if (mark[t] != d + 1) {
						mark[t] = d + 1;
						if (n == buf.length) {
							buf = Arrays.copyOf(buf, n << 1);
						}
						buf[n++] = t;
					}
				}
			}
			var next = n == 0 ? EMPTY : Arrays.copyOf(buf, n);
			Arrays.sort(next);
			frontier[d + 1] = next;
		}

		var last = frontier[length];
		counts[length] = new long[last.length];
		for (var i = 0; i < last.length; i++) {
			counts[length][i] = states.accepting(last[i]) ? 1 : 0;
		}

		for (var d = length - 1; d >= 0; d--) {
			var front = frontier[d];
			var rv = new long[front.length];
			for (var i = 0; i < front.length; i++) {
				var letters = states.letters(front[i]);
				var sum = 0L;
				for (var j = 0; j < letters.size(); j++) {
					sum += count(d + 1, letters.target(j));
				}
				rv[i] = sum;
			}
			counts[d] = rv;
		}
	}

	/**
	 * @param depth
	 *            - distance of s from the root
	 * @return accepted paths with length - depth edges leaving s
	 */
	long count(int depth, int s) {
		var ix = Arrays.binarySearch(frontier[depth], s);
		if (ix < 0) {
			throw new IllegalStateException("State " + s + " is not reachable at depth " + depth);
		}
		return counts[depth][ix];
	}

	/**
	 * @return words with exactly length code points
	 */
	long total() {
		return counts[0][0];
	}
}
