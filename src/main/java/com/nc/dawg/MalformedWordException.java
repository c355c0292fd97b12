package com.nc.dawg;

/**
 * Raised when a word or a query is not well-formed UTF-16, i.e., it carries an unpaired surrogate.
 */
public final class MalformedWordException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	final int index;

	MalformedWordException(CharSequence word, int index) {
		super(String.format("Unpaired surrogate at index %d of a word with %d chars", index, word.length()));
		this.index = index;
	}

	/**
	 * @return the char index of the offending surrogate
	 */
	public int index() {
		return index;
	}
}
