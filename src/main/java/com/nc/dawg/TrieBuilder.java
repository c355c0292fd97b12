package com.nc.dawg;

/**
 * Inserts words into a trie rooted at {@link States#ROOT}. Not thread safe: every insertion must
 * complete before {@link Minimizer} runs.
 */
final class TrieBuilder {

	/**
	 * @param length
	 *            - word length in code points
	 * @param created
	 *            - number of states created by the insertion
	 */
	record Insertion(int length, int created) {
	}

	final States states;

	int maxLength;

	int count = 1;

	TrieBuilder() {
		this(new States());
	}

	TrieBuilder(States states) {
		this.states = states;
	}

	/**
	 * Walks word from the root, creating states only where its prefix diverges from what is
	 * already in the trie, and marks the last state as accepting.
	 *
	 * @throws MalformedWordException
	 *             if word is not well-formed
	 */
	Insertion insert(String word) {
		var cps = Chars.codePoints(word);
		var states = this.states;
		var curr = States.ROOT;
		var created = 0;

		for (var cp : cps) {
			var letters = states.letters(curr);
			var next = letters.targetOf(cp);

			if (next == Letters.ABSENT) {
				next = states.push(curr, cp);
				letters.add(cp, next);
				created++;
			}
			curr = next;
		}

		states.accept(curr);

		if (cps.length > maxLength) {
			maxLength = cps.length;
		}
		count += created;

		return new Insertion(cps.length, created);
	}

	int count() {
		return count;
	}

	int maxLength() {
		return maxLength;
	}
}
