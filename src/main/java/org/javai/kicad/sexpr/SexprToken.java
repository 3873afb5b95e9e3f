package org.javai.kicad.sexpr;

/**
 * Represents a token of s-expression text.
 *
 * @param type the token type
 * @param value the token value; for strings the unescaped content
 * @param position the character position in the input string
 */
public record SexprToken(TokenType type, String value, int position) {

	public enum TokenType {
		SYMBOL,        // bare words: keywords, enum values
		STRING,        // "quoted strings"
		NUMBER,        // integers and decimals
		LPAREN,        // (
		RPAREN,        // )
		EOF            // end of input
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + value + "\")";
			case NUMBER, SYMBOL -> type + "(" + value + ")";
			default -> type.toString();
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}
}
