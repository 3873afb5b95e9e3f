package org.javai.kicad.sexpr;

/**
 * Exception thrown when s-expression text cannot be tokenized or is not well nested.
 */
public class SexprSyntaxException extends RuntimeException {

	private final int position;

	public SexprSyntaxException(String message, int position) {
		super(message);
		this.position = position;
	}

	/**
	 * Character offset in the input at which the problem was detected.
	 */
	public int position() {
		return position;
	}
}
