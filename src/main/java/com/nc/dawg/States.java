package com.nc.dawg;

import java.util.Arrays;
import java.util.function.IntConsumer;
import java.util.function.IntPredicate;

/**
 * Arena holding every state created while building the graph. States are addressed by their
 * handle (index), {@link States#ROOT} being the initial state. Merged states are never reclaimed:
 * they simply become unreachable.
 * <p>
 * {@link States#next} and the incoming edge ({@link States#parent}, {@link States#parentLabel})
 * are only meaningful while minimizing.
 */
final class States {

	static final int ROOT = 0;

	static final int NIL = -1;

	static final int INITIAL_CAP = 64;

	boolean[] accepting;

	Letters[] letters;

	int[] next;

	int[] parent;

	int[] parentLabel;

	int pos;

	States() {
		this(INITIAL_CAP);
	}

	States(int cap) {
		cap = Math.max(cap, 1);
		accepting = new boolean[cap];
		letters = new Letters[cap];
		next = new int[cap];
		parent = new int[cap];
		parentLabel = new int[cap];

		push(NIL, NIL);
	}

	void accept(int s) {
		accepting[s] = true;
	}

	boolean accepting(int s) {
		return accepting[s];
	}

	/**
	 * Creates a new state reached from parent through label. The edge itself is not created.
	 *
	 * @return the new handle
	 */
	int push(int parent, int label) {
		require(1);
		var s = pos++;
		letters[s] = new Letters();
		next[s] = NIL;
		this.parent[s] = parent;
		parentLabel[s] = label;
		return s;
	}

	Letters letters(int s) {
		return letters[s];
	}

	/**
	 * Walks the states reachable from {@code from}, children first, without descending into states
	 * for which seen holds. finish is called once a state's children are all done and must make
	 * seen hold for it. The walk keeps its own stack, so depth is bounded by the heap, not by the
	 * thread stack.
	 */
	void postOrder(int from, IntPredicate seen, IntConsumer finish) {
		if (seen.test(from)) {
			return;
		}

		var stack = new int[16];
		var cursor = new int[16];
		var top = 0;
		stack[0] = from;

		while (top >= 0) {
			var s = stack[top];
			var letters = letters(s);
			var c = cursor[top];

			if (c < letters.size()) {
				cursor[top] = c + 1;
				var t = letters.target(c);
				if (!seen.test(t)) {
					if (++top == stack.length) {
						stack = Arrays.copyOf(stack, top << 1);
						cursor = Arrays.copyOf(cursor, top << 1);
					}
					stack[top] = t;
					cursor[top] = 0;
				}
			} else {
				finish.accept(s);
				top--;
			}
		}
	}

	void require(int n) {
		var cap = accepting.length;
		if (pos + n > cap) {
			var nc = Math.max(pos + n, cap + (cap >> 1));
			accepting = Arrays.copyOf(accepting, nc);
			letters = Arrays.copyOf(letters, nc);
			next = Arrays.copyOf(next, nc);
			parent = Arrays.copyOf(parent, nc);
			parentLabel = Arrays.copyOf(parentLabel, nc);
		}
	}

	/**
	 * Structural equality of two states whose children are already canonical.
	 */
	boolean same(int a, int b) {
		return a != b && accepting[a] == accepting[b] && letters[a].sameAs(letters[b]);
	}

	/**
	 * @return number of allocated handles, including merged ones
	 */
	int size() {
		return pos;
	}
}
