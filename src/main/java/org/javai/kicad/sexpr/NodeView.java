package org.javai.kicad.sexpr;

/**
 * A borrowed reference to one node of a {@link SexprBuffer}.
 *
 * @param buffer the buffer holding the node
 * @param index the node's index in pre-order
 */
public record NodeView(SexprBuffer buffer, int index) {

	public SexprKind kind() {
		return buffer.kind(index);
	}

	/**
	 * Text of a symbol or string node.
	 */
	public TextView text() {
		return buffer.text(index);
	}

	public double number() {
		return buffer.number(index);
	}

	public boolean isSymbol(String value) {
		return kind() == SexprKind.SYMBOL && buffer.textEquals(index, value);
	}

	public boolean isListNamed(String keyword) {
		return buffer.listHeadIs(index, keyword);
	}

	public Sexpr toSexpr() {
		return buffer.toSexpr(index);
	}
}
