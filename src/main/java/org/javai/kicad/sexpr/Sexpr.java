package org.javai.kicad.sexpr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A node of a parsed s-expression tree.
 * <p>
 * A node is one of:
 * <ul>
 *   <li>{@link SymbolAtom} - a bare word such as {@code hide} or {@code kicad_symbol_lib}</li>
 *   <li>{@link StringAtom} - a double-quoted string</li>
 *   <li>{@link NumberAtom} - a numeric literal</li>
 *   <li>{@link ListNode} - a parenthesized sequence of nodes</li>
 * </ul>
 * Trees are immutable and compare structurally.
 */
public sealed interface Sexpr {

	SexprKind kind();

	/**
	 * Accepts a visitor and dispatches to the matching visitor method.
	 *
	 * @param <R> the return type of the visitor
	 * @param visitor the visitor to accept
	 * @return the result of the visitor operation
	 */
	<R> R accept(SexprVisitor<R> visitor);

	record SymbolAtom(String value) implements Sexpr {

		@Override
		public SexprKind kind() {
			return SexprKind.SYMBOL;
		}

		@Override
		public <R> R accept(SexprVisitor<R> visitor) {
			return visitor.visitSymbol(value);
		}

		@Override
		public String toString() {
			return value;
		}
	}

	record StringAtom(String value) implements Sexpr {

		@Override
		public SexprKind kind() {
			return SexprKind.STRING;
		}

		@Override
		public <R> R accept(SexprVisitor<R> visitor) {
			return visitor.visitString(value);
		}

		@Override
		public String toString() {
			return SexprWriter.quote(value);
		}
	}

	record NumberAtom(double value) implements Sexpr {

		@Override
		public SexprKind kind() {
			return SexprKind.NUMBER;
		}

		@Override
		public <R> R accept(SexprVisitor<R> visitor) {
			return visitor.visitNumber(value);
		}

		@Override
		public String toString() {
			return SexprWriter.formatNumber(value);
		}
	}

	record ListNode(List<Sexpr> children) implements Sexpr {

		public ListNode {
			children = List.copyOf(children);
		}

		@Override
		public SexprKind kind() {
			return SexprKind.LIST;
		}

		@Override
		public <R> R accept(SexprVisitor<R> visitor) {
			return visitor.visitList(children);
		}

		/**
		 * The first child when it is a symbol, which by convention names the list.
		 */
		public Optional<String> firstSymbol() {
			if (!children.isEmpty() && children.get(0) instanceof SymbolAtom symbol) {
				return Optional.of(symbol.value());
			}
			return Optional.empty();
		}

		/**
		 * Checks whether this list is headed by the given keyword, without allocating.
		 */
		public boolean isNamed(String keyword) {
			return !children.isEmpty()
					&& children.get(0) instanceof SymbolAtom symbol
					&& symbol.value().equals(keyword);
		}

		@Override
		public String toString() {
			return SexprWriter.compact().write(this);
		}
	}

	static SymbolAtom symbol(String value) {
		return new SymbolAtom(value);
	}

	static StringAtom string(String value) {
		return new StringAtom(value);
	}

	static NumberAtom number(double value) {
		return new NumberAtom(value);
	}

	static ListNode list(List<Sexpr> children) {
		return new ListNode(children);
	}

	/**
	 * Creates {@code (name child...)}.
	 */
	static ListNode listWithName(String name, Sexpr... children) {
		List<Sexpr> all = new ArrayList<>(children.length + 1);
		all.add(symbol(name));
		all.addAll(Arrays.asList(children));
		return new ListNode(all);
	}

	static ListNode symbolWithName(String name, String value) {
		return listWithName(name, symbol(value));
	}

	static ListNode stringWithName(String name, String value) {
		return listWithName(name, string(value));
	}

	static ListNode numberWithName(String name, double value) {
		return listWithName(name, number(value));
	}
}
