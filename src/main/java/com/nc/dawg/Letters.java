package com.nc.dawg;

import java.util.Arrays;

/**
 * Outgoing edges of a single state. Labels (code points) are kept sorted so lookups are a binary
 * search and iteration follows ascending code-point order. Targets are state handles into
 * {@link States}.
 */
final class Letters {

	static final int ABSENT = -1;

	static final int[] NONE = new int[0];

	int[] labels = NONE;

	int[] targets = NONE;

	int size;

	/**
	 * Inserts a new edge. The label must not be present.
	 *
	 * @param label
	 *            - code point
	 * @param target
	 *            - state handle
	 */
	void add(int label, int target) {
		var ix = Arrays.binarySearch(labels, 0, size, label);
		if (ix >= 0) {
			throw new IllegalStateException("Duplicate label: " + Character.toString(label));
		}
		ix = -ix - 1;

		if (size == labels.length) {
			var cap = size == 0 ? 2 : size + (size >> 1) + 1;
			labels = Arrays.copyOf(labels, cap);
			targets = Arrays.copyOf(targets, cap);
		}

		System.arraycopy(labels, ix, labels, ix + 1, size - ix);
		System.arraycopy(targets, ix, targets, ix + 1, size - ix);
		labels[ix] = label;
		targets[ix] = target;
		size++;
	}

	boolean isEmpty() {
		return size == 0;
	}

	int label(int i) {
		return labels[i];
	}

	/**
	 * Redirects the edge labeled with label to target.
	 */
	void retarget(int label, int target) {
		var ix = Arrays.binarySearch(labels, 0, size, label);
		if (ix < 0) {
			throw new IllegalStateException("Dangling edge: " + Character.toString(label));
		}
		targets[ix] = target;
	}

	/**
	 * Two indexes are the same if they have the same labels pointing to the same handles. Handles
	 * are compared by value, which is only meaningful once the targets have been canonicalized.
	 */
	boolean sameAs(Letters other) {
		var n = size;
		if (n != other.size) {
			return false;
		}
		return Arrays.equals(labels, 0, n, other.labels, 0, n) && Arrays.equals(targets, 0, n, other.targets, 0, n);
	}

	int size() {
		return size;
	}

	int target(int i) {
		return targets[i];
	}

	/**
	 * @param label
	 *            - code point
	 * @return the handle reached by consuming label or {@link Letters#ABSENT}
	 */
	int targetOf(int label) {
		var ix = Arrays.binarySearch(labels, 0, size, label);
		return ix >= 0 ? targets[ix] : ABSENT;
	}

	@Override
	public String toString() {
		var sb = new StringBuilder("{");
		for (var i = 0; i < size; i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.appendCodePoint(labels[i]).append("->").append(targets[i]);
		}
		return sb.append('}').toString();
	}
}
