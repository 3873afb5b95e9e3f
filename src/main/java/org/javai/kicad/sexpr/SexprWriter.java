package org.javai.kicad.sexpr;

import java.math.BigDecimal;
import java.util.List;

/**
 * Renders {@link Sexpr} trees back to text.
 * <p>
 * In pretty mode a list keeps its leading atoms on the opening line and places every
 * nested list (and anything following one) on its own indented line, the way KiCad
 * lays out its files. Compact mode writes the whole tree on one line.
 */
public class SexprWriter {

	private final String indent;
	private final boolean pretty;

	public SexprWriter() {
		this("  ", true);
	}

	public SexprWriter(String indent, boolean pretty) {
		this.indent = indent != null ? indent : "";
		this.pretty = pretty;
	}

	public static SexprWriter compact() {
		return new SexprWriter("", false);
	}

	public String write(Sexpr node) {
		StringBuilder output = new StringBuilder();
		write(node, 0, output);
		if (pretty) {
			output.append('\n');
		}
		return output.toString();
	}

	private void write(Sexpr node, int depth, StringBuilder output) {
		if (node instanceof Sexpr.ListNode list) {
			writeList(list.children(), depth, output);
		} else {
			output.append(node);
		}
	}

	private void writeList(List<Sexpr> children, int depth, StringBuilder output) {
		output.append('(');
		boolean broken = false;
		for (int i = 0; i < children.size(); i++) {
			Sexpr child = children.get(i);
			if (pretty && (broken || child instanceof Sexpr.ListNode)) {
				broken = true;
				output.append('\n');
				indent(depth + 1, output);
			} else if (i > 0) {
				output.append(' ');
			}
			write(child, depth + 1, output);
		}
		if (broken) {
			output.append('\n');
			indent(depth, output);
		}
		output.append(')');
	}

	private void indent(int depth, StringBuilder output) {
		for (int i = 0; i < depth; i++) {
			output.append(indent);
		}
	}

	/**
	 * Integral values are written without a fractional part, others in plain decimal notation.
	 */
	public static String formatNumber(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			throw new IllegalArgumentException("Cannot write non-finite number " + value);
		}
		if (value == 0.0) {
			return Double.doubleToRawLongBits(value) < 0 ? "-0" : "0";
		}
		if (value == Math.rint(value) && Math.abs(value) < 1e15) {
			return Long.toString((long) value);
		}
		return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
	}

	public static String quote(String value) {
		StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				case '\n' -> sb.append("\\n");
				case '\t' -> sb.append("\\t");
				case '\r' -> sb.append("\\r");
				default -> sb.append(c);
			}
		}
		return sb.append('"').toString();
	}
}
