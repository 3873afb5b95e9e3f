package org.javai.kicad.intern;

import java.util.List;

/**
 * Fixed open-addressing table of canonical strings, looked up with any {@link CharSequence}.
 * Immutable after construction, so concurrent readers need no synchronisation.
 */
final class InternTable {

	private final String[] slots;
	private final int mask;
	private final int size;

	private InternTable(String[] slots, int size) {
		this.slots = slots;
		this.mask = slots.length - 1;
		this.size = size;
	}

	static InternTable of(List<String> keys) {
		int capacity = Integer.highestOneBit(Math.max(4, keys.size() * 2) - 1) << 1;
		String[] slots = new String[capacity];
		int size = 0;
		for (String key : keys) {
			int slot = hash(key) & (capacity - 1);
			while (slots[slot] != null && !slots[slot].equals(key)) {
				slot = (slot + 1) & (capacity - 1);
			}
			if (slots[slot] == null) {
				slots[slot] = key;
				size++;
			}
		}
		return new InternTable(slots, size);
	}

	/**
	 * The canonical instance equal to {@code text}, or {@code null} if there is none.
	 */
	String find(CharSequence text) {
		int slot = hash(text) & mask;
		String candidate;
		while ((candidate = slots[slot]) != null) {
			if (candidate.contentEquals(text)) {
				return candidate;
			}
			slot = (slot + 1) & mask;
		}
		return null;
	}

	int size() {
		return size;
	}

	// Same value as String.hashCode, computed without materialising a String.
	private static int hash(CharSequence text) {
		int h = 0;
		for (int i = 0; i < text.length(); i++) {
			h = 31 * h + text.charAt(i);
		}
		return h ^ (h >>> 16);
	}
}
