package com.nc.dawg;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

public interface DawgTestSupport {

	static String randomWord(Random rng, String alphabet, int minLen, int maxLen) {
		var len = minLen + rng.nextInt(maxLen - minLen + 1);
		var sb = new StringBuilder(len);

		for (var i = 0; i < len; i++) {
			sb.append(alphabet.charAt(rng.nextInt(alphabet.length())));
		}

		return sb.toString();
	}

	static List<String> randomWords(long seed, int n, String alphabet, int minLen, int maxLen) {
		var rng = new Random(seed);
		var rv = new ArrayList<String>(n);
		for (var i = 0; i < n; i++) {
			rv.add(randomWord(rng, alphabet, minLen, maxLen));
		}
		return rv;
	}

	static Set<String> sorted(Collection<String> c) {
		return new TreeSet<>(c);
	}

	static String[] vec(String... keys) {
		return keys;
	}

}
