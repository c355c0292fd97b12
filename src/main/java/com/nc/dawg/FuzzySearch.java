package com.nc.dawg;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A single approximate lookup. Walks the graph with three cursors: the current state, the
 * position in the query and the remaining edit budget. Instances hold the path buffer and the
 * results, so they are not shareable, but any number of them can run over the same graph.
 * <p>
 * For every visited (state, position, budget), with c the next query code point:
 * <ol>
 * <li>exact: follow c for free, unless c is the code point the caller just replaced;</li>
 * <li>substitution: follow every other edge, consuming c and one unit of budget;</li>
 * <li>deletion: skip c without moving in the graph;</li>
 * <li>acceptance: if the query is exhausted and the state is accepting, record the path;</li>
 * <li>insertion: follow every other edge without consuming c.</li>
 * </ol>
 * The replaced code point is carried as ignore to the next frame so a substitution is not
 * undone by another one.
 */
final class FuzzySearch {

	static final byte EXACT = 0;
	static final byte SUBSTITUTE = 1;
	static final byte DELETE = 2;
	static final byte ACCEPT = 3;
	static final byte INSERT = 4;

	final States states;
	final int[] query;
	final int maxResults;
	final boolean allowInsert;
	final boolean allowDelete;
	final StringBuilder path;
	final List<String> found;

	// frames, one slot per pending call
	int[] label = new int[16];
	int[] state = new int[16];
	int[] pos = new int[16];
	int[] budget = new int[16];
	int[] ignore = new int[16];
	int[] cp = new int[16];
	byte[] step = new byte[16];
	int[] cursor = new int[16];
	int top = -1;

	FuzzySearch(States states, String query, int maxResults, boolean allowInsert, boolean allowDelete) {
		this.states = states;
		this.query = Chars.codePoints(query);
		this.maxResults = maxResults;
		this.allowInsert = allowInsert;
		this.allowDelete = allowDelete;
		this.path = new StringBuilder(query.length() + 4);
		this.found = new ArrayList<>();
	}

	boolean exhausted() {
		return maxResults > 0 && found.size() > maxResults;
	}

	/**
	 * @return the words in discovery order, minus the earliest ones if more than maxResults were
	 *         found
	 */
	List<String> run(int root, int maxEditDistance) {
		walk(root, maxEditDistance);

		var n = found.size();
		if (maxResults > 0 && n > maxResults) {
			return new ArrayList<>(found.subList(n - maxResults, n));
		}
		return found;
	}

	/**
	 * Runs the walk on an explicit stack of frames. A frame goes through the steps in order and
	 * resumes where it left off once the frame it pushed is popped.
	 */
	void walk(int root, int budget) {
		push(Chars.NONE, root, 0, budget, Chars.NONE);

		while (top >= 0 && !exhausted()) {
			var f = top;
			var s = state[f];
			var letters = states.letters(s);
			var c = cp[f];

			switch (step[f]) {
			case EXACT -> {
				c = pos[f] < query.length ? query[pos[f]] : Chars.NONE;
				cp[f] = c;
				step[f] = SUBSTITUTE;
				if (c != Chars.NONE && c != ignore[f]) {
					var t = letters.targetOf(c);
					if (t != Letters.ABSENT) {
						push(c, t, pos[f] + 1, this.budget[f], Chars.NONE);
					}
				}
			}
			case SUBSTITUTE -> {
				var i = c != Chars.NONE && this.budget[f] > 0 ? nextOther(letters, f) : letters.size();
				if (i < letters.size()) {
					push(letters.label(i), letters.target(i), pos[f] + 1, this.budget[f] - 1, c);
				} else {
					step[f] = DELETE;
				}
			}
			case DELETE -> {
				step[f] = ACCEPT;
				if (c != Chars.NONE && this.budget[f] > 0 && allowDelete) {
					push(Chars.NONE, s, pos[f] + 1, this.budget[f] - 1, c);
				}
			}
			case ACCEPT -> {
				step[f] = INSERT;
				cursor[f] = 0;
				if (c == Chars.NONE && states.accepting(s)) {
					found.add(path.toString());
				}
			}
			default -> {
				var i = this.budget[f] > 0 && allowInsert ? nextOther(letters, f) : letters.size();
				if (i < letters.size()) {
					push(letters.label(i), letters.target(i), pos[f], this.budget[f] - 1, Chars.NONE);
				} else {
					pop();
				}
			}
			}
		}
	}

	/**
	 * Advances the frame's cursor past the next edge whose label is neither the query code point
	 * nor the ignored one.
	 *
	 * @return the index of that edge or letters.size() if there's none left
	 */
	int nextOther(Letters letters, int f) {
		var i = cursor[f];
		while (i < letters.size()) {
			var l = letters.label(i);
			if (l != cp[f] && l != ignore[f]) {
				break;
			}
			i++;
		}
		cursor[f] = i + 1;
		return i;
	}

	void pop() {
		var l = label[top--];
		if (l != Chars.NONE) {
			Chars.pop(path, l);
		}
	}

	/**
	 * @param label
	 *            - code point appended to the path when entering s or {@link Chars#NONE} for a
	 *            deletion
	 */
	void push(int label, int s, int pos, int budget, int ignore) {
		if (++top == state.length) {
			var cap = top << 1;
			this.label = Arrays.copyOf(this.label, cap);
			this.state = Arrays.copyOf(this.state, cap);
			this.pos = Arrays.copyOf(this.pos, cap);
			this.budget = Arrays.copyOf(this.budget, cap);
			this.ignore = Arrays.copyOf(this.ignore, cap);
			this.cp = Arrays.copyOf(this.cp, cap);
			this.step = Arrays.copyOf(this.step, cap);
			this.cursor = Arrays.copyOf(this.cursor, cap);
		}
		this.label[top] = label;
		this.state[top] = s;
		this.pos[top] = pos;
		this.budget[top] = budget;
		this.ignore[top] = ignore;
		this.step[top] = EXACT;
		this.cursor[top] = 0;
		if (label != Chars.NONE) {
			path.appendCodePoint(label);
		}
	}
}
