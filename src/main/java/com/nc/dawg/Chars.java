package com.nc.dawg;

import java.util.Arrays;

/**
 * Code point helpers. Every length in this library is a number of code points, never chars or
 * utf8 bytes.
 */
final class Chars {

	static final int NONE = -1;

	/**
	 * Decodes word into code points.
	 *
	 * @throws MalformedWordException
	 *             if word has an unpaired surrogate
	 */
	static int[] codePoints(CharSequence word) {
		var len = word.length();
		var rv = new int[len];
		var n = 0;

		for (var i = 0; i < len; i++) {
			var c = word.charAt(i);
			if (Character.isHighSurrogate(c)) {
				if (i + 1 < len && Character.isLowSurrogate(word.charAt(i + 1))) {
					rv[n++] = Character.toCodePoint(c, word.charAt(++i));
					continue;
				}
				throw new MalformedWordException(word, i);
			}
			if (Character.isLowSurrogate(c)) {
				throw new MalformedWordException(word, i);
			}
			rv[n++] = c;
		}

		return n == len ? rv : Arrays.copyOf(rv, n);
	}

	/**
	 * Pops the last code point appended to sb.
	 */
	static void pop(StringBuilder sb, int cp) {
		sb.setLength(sb.length() - Character.charCount(cp));
	}

	private Chars() {
	}
}
