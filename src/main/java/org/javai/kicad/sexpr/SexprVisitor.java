package org.javai.kicad.sexpr;

import java.util.List;

/**
 * Visitor interface for traversing {@link Sexpr} trees.
 *
 * @param <R> the return type of the visitor operations
 */
public interface SexprVisitor<R> {

	R visitSymbol(String value);

	R visitString(String value);

	R visitNumber(double value);

	/**
	 * Visits a list node.
	 *
	 * @param children the child nodes, including the leading keyword symbol if any
	 * @return the result of visiting this node
	 */
	R visitList(List<Sexpr> children);
}
