package org.javai.kicad.sexpr;

import java.util.Locale;

/**
 * The four kinds of s-expression node.
 */
public enum SexprKind {
	SYMBOL,
	STRING,
	NUMBER,
	LIST;

	/**
	 * Lower-case name used in error messages.
	 */
	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}
}
