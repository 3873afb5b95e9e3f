package org.javai.kicad.sexpr;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for KiCad-style s-expression text.
 * Converts input string into a stream of tokens.
 * <p>
 * A bare word is a NUMBER when the whole word is a decimal literal
 * ({@code -7.62}, {@code 20211014}), otherwise a SYMBOL.
 */
public class SexprTokenizer {

	private final String input;
	private int pos = 0;

	public SexprTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws SexprSyntaxException if invalid syntax is encountered
	 */
	public List<SexprToken> tokenize() {
		List<SexprToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new SexprToken(SexprToken.TokenType.EOF, "", pos));
		return tokens;
	}

	private SexprToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '(' -> {
				advance();
				yield new SexprToken(SexprToken.TokenType.LPAREN, "(", start);
			}
			case ')' -> {
				advance();
				yield new SexprToken(SexprToken.TokenType.RPAREN, ")", start);
			}
			case '"' -> scanString();
			default -> scanWord();
		};
	}

	private SexprToken scanString() {
		int start = pos;
		advance(); // opening quote

		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != '"') {
			char c = advance();
			if (c == '\\' && !isAtEnd()) {
				char next = advance();
				sb.append(switch (next) {
					case 'n' -> '\n';
					case 't' -> '\t';
					case 'r' -> '\r';
					default -> next;
				});
			} else {
				sb.append(c);
			}
		}

		if (isAtEnd()) {
			throw new SexprSyntaxException("Unterminated string at position " + start, start);
		}

		advance(); // closing quote
		return new SexprToken(SexprToken.TokenType.STRING, sb.toString(), start);
	}

	private SexprToken scanWord() {
		int start = pos;

		while (!isAtEnd() && isWordChar(peek())) {
			advance();
		}

		String value = input.substring(start, pos);
		SexprToken.TokenType type = isNumeric(value) ? SexprToken.TokenType.NUMBER : SexprToken.TokenType.SYMBOL;
		return new SexprToken(type, value, start);
	}

	static boolean isNumeric(CharSequence word) {
		int i = 0;
		int length = word.length();
		if (i < length && (word.charAt(i) == '-' || word.charAt(i) == '+')) {
			i++;
		}
		int digits = 0;
		while (i < length && isDigit(word.charAt(i))) {
			i++;
			digits++;
		}
		if (i < length && word.charAt(i) == '.') {
			i++;
			while (i < length && isDigit(word.charAt(i))) {
				i++;
				digits++;
			}
		}
		return digits > 0 && i == length;
	}

	private void skipWhitespace() {
		while (!isAtEnd() && Character.isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isWordChar(char c) {
		return c != '(' && c != ')' && c != '"' && !Character.isWhitespace(c);
	}
}
