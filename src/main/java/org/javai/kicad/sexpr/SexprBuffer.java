package org.javai.kicad.sexpr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An immutable, flattened s-expression tree used by the borrowing parse path.
 * <p>
 * Nodes are stored in pre-order in parallel arrays. Every node {@code i} records the
 * index just past its subtree ({@link #end(int)}), so the next sibling of {@code i} is
 * {@code end(i)} and the children of a list {@code i} occupy {@code [i + 1, end(i))}.
 * Symbol and string text lives in a single arena string; atoms reference it by offset
 * and are handed out as {@link TextView}s. Nothing here is ever mutated after
 * construction, so views and cursors may outlive the code that built the buffer.
 */
public final class SexprBuffer {

	private final String arena;
	private final SexprKind[] kinds;
	private final int[] textStarts;
	private final int[] textEnds;
	private final double[] numbers;
	private final int[] ends;
	private final int size;

	private SexprBuffer(Builder builder) {
		this.arena = builder.arena.toString();
		this.size = builder.size;
		this.kinds = Arrays.copyOf(builder.kinds, size);
		this.textStarts = Arrays.copyOf(builder.textStarts, size);
		this.textEnds = Arrays.copyOf(builder.textEnds, size);
		this.numbers = Arrays.copyOf(builder.numbers, size);
		this.ends = Arrays.copyOf(builder.ends, size);
	}

	/**
	 * Flattens an existing tree.
	 */
	public static SexprBuffer of(Sexpr root) {
		Builder builder = new Builder(64);
		root.accept(new Flattener(builder));
		return builder.build();
	}

	/**
	 * Number of nodes, including the root.
	 */
	public int size() {
		return size;
	}

	public SexprKind kind(int index) {
		return kinds[index];
	}

	/**
	 * Index just past the subtree rooted at {@code index}.
	 */
	public int end(int index) {
		return ends[index];
	}

	/**
	 * Text of a symbol or string node.
	 */
	public TextView text(int index) {
		return new TextView(arena, textStarts[index], textEnds[index]);
	}

	public double number(int index) {
		return numbers[index];
	}

	/**
	 * Checks whether a symbol or string node holds exactly {@code value}.
	 */
	public boolean textEquals(int index, String value) {
		int length = textEnds[index] - textStarts[index];
		return length == value.length() && arena.regionMatches(textStarts[index], value, 0, length);
	}

	/**
	 * Checks whether node {@code index} is a list whose first child is the symbol {@code keyword}.
	 * Inspects the arrays directly and never consumes or allocates.
	 */
	public boolean listHeadIs(int index, String keyword) {
		if (index < 0 || index >= size || kinds[index] != SexprKind.LIST) {
			return false;
		}
		int first = index + 1;
		return first < ends[index] && kinds[first] == SexprKind.SYMBOL && textEquals(first, keyword);
	}

	/**
	 * Materializes the subtree at {@code index} as an owning {@link Sexpr}.
	 */
	public Sexpr toSexpr(int index) {
		return switch (kinds[index]) {
			case SYMBOL -> Sexpr.symbol(text(index).toString());
			case STRING -> Sexpr.string(text(index).toString());
			case NUMBER -> Sexpr.number(numbers[index]);
			case LIST -> {
				List<Sexpr> children = new ArrayList<>();
				for (int child = index + 1; child < ends[index]; child = ends[child]) {
					children.add(toSexpr(child));
				}
				yield Sexpr.list(children);
			}
		};
	}

	public Sexpr toSexpr() {
		return toSexpr(0);
	}

	/**
	 * Accumulates nodes in pre-order. Used by {@link SexprReader} and {@link #of(Sexpr)}.
	 */
	static final class Builder {

		private final StringBuilder arena;
		private SexprKind[] kinds;
		private int[] textStarts;
		private int[] textEnds;
		private double[] numbers;
		private int[] ends;
		private int size;
		private int[] openLists = new int[16];
		private int depth;

		Builder(int expectedNodes) {
			int capacity = Math.max(16, expectedNodes);
			this.arena = new StringBuilder(capacity * 4);
			this.kinds = new SexprKind[capacity];
			this.textStarts = new int[capacity];
			this.textEnds = new int[capacity];
			this.numbers = new double[capacity];
			this.ends = new int[capacity];
		}

		/**
		 * Arena into which atom text is appended before calling {@link #addText}.
		 */
		StringBuilder arena() {
			return arena;
		}

		/**
		 * Records a symbol or string whose text occupies the arena from {@code start} to its current end.
		 */
		void addText(SexprKind kind, int start) {
			int index = allocate(kind);
			textStarts[index] = start;
			textEnds[index] = arena.length();
			ends[index] = index + 1;
		}

		void addText(SexprKind kind, String text) {
			int start = arena.length();
			arena.append(text);
			addText(kind, start);
		}

		void addNumber(double value) {
			int index = allocate(SexprKind.NUMBER);
			numbers[index] = value;
			ends[index] = index + 1;
		}

		void openList() {
			int index = allocate(SexprKind.LIST);
			if (depth == openLists.length) {
				openLists = Arrays.copyOf(openLists, depth * 2);
			}
			openLists[depth++] = index;
		}

		void closeList() {
			if (depth == 0) {
				throw new IllegalStateException("No open list to close");
			}
			int index = openLists[--depth];
			ends[index] = size;
		}

		int depth() {
			return depth;
		}

		int size() {
			return size;
		}

		SexprBuffer build() {
			if (depth != 0) {
				throw new IllegalStateException(depth + " list(s) left open");
			}
			return new SexprBuffer(this);
		}

		private int allocate(SexprKind kind) {
			if (size == kinds.length) {
				int capacity = size * 2;
				kinds = Arrays.copyOf(kinds, capacity);
				textStarts = Arrays.copyOf(textStarts, capacity);
				textEnds = Arrays.copyOf(textEnds, capacity);
				numbers = Arrays.copyOf(numbers, capacity);
				ends = Arrays.copyOf(ends, capacity);
			}
			kinds[size] = kind;
			return size++;
		}
	}

	private record Flattener(Builder builder) implements SexprVisitor<Void> {

		@Override
		public Void visitSymbol(String value) {
			builder.addText(SexprKind.SYMBOL, value);
			return null;
		}

		@Override
		public Void visitString(String value) {
			builder.addText(SexprKind.STRING, value);
			return null;
		}

		@Override
		public Void visitNumber(double value) {
			builder.addNumber(value);
			return null;
		}

		@Override
		public Void visitList(List<Sexpr> children) {
			builder.openList();
			for (Sexpr child : children) {
				child.accept(this);
			}
			builder.closeList();
			return null;
		}
	}
}
