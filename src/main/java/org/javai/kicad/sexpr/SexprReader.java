package org.javai.kicad.sexpr;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads s-expression text into either an owning {@link Sexpr} tree or a flattened
 * {@link SexprBuffer}.
 * <p>
 * The reader enforces only syntax (balanced parentheses, terminated strings); it knows
 * nothing about the grammar of any file format.
 *
 * <pre>
 * Sexpr tree = SexprReader.read(text);          // owning path
 * SexprBuffer buffer = SexprReader.readBuffer(text); // borrowing path
 * </pre>
 */
public final class SexprReader {

	private SexprReader() {
	}

	/**
	 * Reads a document consisting of exactly one top-level expression.
	 *
	 * @throws SexprSyntaxException if the text is malformed or holds zero or several top-level expressions
	 */
	public static Sexpr read(String text) {
		List<Sexpr> nodes = readAll(text);
		if (nodes.size() != 1) {
			throw new SexprSyntaxException("Expected exactly one top-level expression, found " + nodes.size(), 0);
		}
		return nodes.get(0);
	}

	/**
	 * Reads every top-level expression in the text.
	 *
	 * @return list of parsed nodes (may be empty)
	 * @throws SexprSyntaxException if syntax errors are encountered
	 */
	public static List<Sexpr> readAll(String text) {
		ParserState state = new ParserState(new SexprTokenizer(text).tokenize());
		List<Sexpr> nodes = new ArrayList<>();
		while (!state.isAtEnd()) {
			nodes.add(parseExpression(state));
		}
		return nodes;
	}

	/**
	 * Reads a single-expression document straight into a {@link SexprBuffer}, without
	 * building intermediate tree nodes or token objects.
	 *
	 * @throws SexprSyntaxException if the text is malformed or holds zero or several top-level expressions
	 */
	public static SexprBuffer readBuffer(String text) {
		String input = text != null ? text : "";
		SexprBuffer.Builder builder = new SexprBuffer.Builder(input.length() / 4);
		StringBuilder arena = builder.arena();
		int topLevel = 0;
		int lastOpen = -1;
		int pos = 0;
		int length = input.length();

		while (pos < length) {
			char c = input.charAt(pos);
			if (Character.isWhitespace(c)) {
				pos++;
				continue;
			}
			if (builder.depth() == 0) {
				if (c == ')') {
					throw new SexprSyntaxException(
						"Unexpected ')' at position " + pos + ": no matching opening parenthesis", pos);
				}
				if (++topLevel > 1) {
					throw new SexprSyntaxException("Expected exactly one top-level expression, found more at position " + pos, pos);
				}
			}
			switch (c) {
				case '(' -> {
					lastOpen = pos;
					builder.openList();
					pos++;
				}
				case ')' -> {
					builder.closeList();
					pos++;
				}
				case '"' -> {
					int start = pos++;
					int textStart = arena.length();
					while (pos < length && input.charAt(pos) != '"') {
						char ch = input.charAt(pos++);
						if (ch == '\\' && pos < length) {
							char next = input.charAt(pos++);
							arena.append(switch (next) {
								case 'n' -> '\n';
								case 't' -> '\t';
								case 'r' -> '\r';
								default -> next;
							});
						} else {
							arena.append(ch);
						}
					}
					if (pos >= length) {
						throw new SexprSyntaxException("Unterminated string at position " + start, start);
					}
					pos++;
					builder.addText(SexprKind.STRING, textStart);
				}
				default -> {
					int start = pos;
					while (pos < length && isWordChar(input.charAt(pos))) {
						pos++;
					}
					CharSequence word = input.subSequence(start, pos);
					if (SexprTokenizer.isNumeric(word)) {
						builder.addNumber(Double.parseDouble(word.toString()));
					} else {
						int textStart = arena.length();
						arena.append(input, start, pos);
						builder.addText(SexprKind.SYMBOL, textStart);
					}
				}
			}
		}

		if (builder.depth() != 0) {
			throw new SexprSyntaxException("Unmatched '(' at position " + lastOpen + ": reached end of input", lastOpen);
		}
		if (topLevel == 0) {
			throw new SexprSyntaxException("Expected exactly one top-level expression, found 0", 0);
		}
		return builder.build();
	}

	private static Sexpr parseExpression(ParserState state) {
		SexprToken token = state.peek();

		return switch (token.type()) {
			case LPAREN -> parseList(state);
			case SYMBOL -> {
				state.advance();
				yield Sexpr.symbol(token.value());
			}
			case STRING -> {
				state.advance();
				yield Sexpr.string(token.value());
			}
			case NUMBER -> {
				state.advance();
				yield Sexpr.number(Double.parseDouble(token.value()));
			}
			case RPAREN -> throw new SexprSyntaxException(
				"Unexpected ')' at position " + token.position() + ": no matching opening parenthesis", token.position());
			case EOF -> throw new SexprSyntaxException(
				"Unexpected end of input at position " + token.position(), token.position());
		};
	}

	private static Sexpr parseList(ParserState state) {
		int startPos = state.peek().position();
		state.advance(); // '('

		List<Sexpr> children = new ArrayList<>();
		while (!state.check(SexprToken.TokenType.RPAREN)) {
			if (state.isAtEnd()) {
				throw new SexprSyntaxException(
					"Unmatched '(' at position " + startPos + ": reached end of input", startPos);
			}
			children.add(parseExpression(state));
		}

		state.advance(); // ')'
		return Sexpr.list(children);
	}

	private static boolean isWordChar(char c) {
		return c != '(' && c != ')' && c != '"' && !Character.isWhitespace(c);
	}

	private static final class ParserState {
		private final List<SexprToken> tokens;
		private int current = 0;

		ParserState(List<SexprToken> tokens) {
			this.tokens = tokens;
		}

		SexprToken peek() {
			return tokens.get(current);
		}

		void advance() {
			if (!isAtEnd()) {
				current++;
			}
		}

		boolean check(SexprToken.TokenType type) {
			return peek().type() == type;
		}

		boolean isAtEnd() {
			return peek().type() == SexprToken.TokenType.EOF;
		}
	}
}
