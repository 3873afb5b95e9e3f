package org.javai.kicad.sexpr;

/**
 * A read-only window onto the text arena of a {@link SexprBuffer}.
 * <p>
 * Views never copy: comparing a view against a {@code String} is done in place, and a
 * {@code String} is only allocated by {@link #toString()}. The arena is immutable, so a
 * view remains valid for as long as it is reachable.
 */
public final class TextView implements CharSequence {

	private final String arena;
	private final int start;
	private final int end;

	TextView(String arena, int start, int end) {
		this.arena = arena;
		this.start = start;
		this.end = end;
	}

	@Override
	public int length() {
		return end - start;
	}

	@Override
	public char charAt(int index) {
		if (index < 0 || index >= length()) {
			throw new IndexOutOfBoundsException("index " + index + " out of bounds for length " + length());
		}
		return arena.charAt(start + index);
	}

	@Override
	public TextView subSequence(int from, int to) {
		if (from < 0 || to > length() || from > to) {
			throw new IndexOutOfBoundsException("range [" + from + ", " + to + ") out of bounds for length " + length());
		}
		return new TextView(arena, start + from, start + to);
	}

	/**
	 * Compares the viewed characters with {@code text} without allocating.
	 */
	public boolean contentEquals(String text) {
		return text.length() == length() && arena.regionMatches(start, text, 0, length());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof TextView other) || other.length() != length()) {
			return false;
		}
		return arena.regionMatches(start, other.arena, other.start, length());
	}

	/**
	 * Same value as {@link String#hashCode()} of the viewed characters.
	 */
	@Override
	public int hashCode() {
		int h = 0;
		for (int i = start; i < end; i++) {
			h = 31 * h + arena.charAt(i);
		}
		return h;
	}

	@Override
	public String toString() {
		return arena.substring(start, end);
	}
}
