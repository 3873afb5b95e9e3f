package org.javai.kicad.convert;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.javai.kicad.sexpr.Sexpr;

/**
 * Assembles a named list node in schema order.
 * <p>
 * Every {@code add} method skips {@code null}, so a field in its absent representation
 * contributes no node; collections add one node per element and nothing when empty.
 */
public final class SexprBuilder {

	private final List<Sexpr> children = new ArrayList<>();

	private SexprBuilder(String name) {
		children.add(Sexpr.symbol(name));
	}

	public static SexprBuilder list(String name) {
		return new SexprBuilder(name);
	}

	public SexprBuilder add(Sexpr node) {
		if (node != null) {
			children.add(node);
		}
		return this;
	}

	public SexprBuilder add(ToSexpr entity) {
		if (entity != null) {
			children.add(entity.toSexpr());
		}
		return this;
	}

	public SexprBuilder addAll(Collection<? extends ToSexpr> entities) {
		for (ToSexpr entity : entities) {
			add(entity);
		}
		return this;
	}

	public SexprBuilder flag(String keyword, Flag flag) {
		return add(flag.toSexpr(keyword));
	}

	/**
	 * Adds {@code (keyword yes|no)}, in the words {@code value} was read with, unless
	 * {@code value} is {@code null}.
	 */
	public SexprBuilder optionalBool(String keyword, NamedBool value) {
		return value != null ? add(value.toSexpr(keyword)) : this;
	}

	public SexprBuilder optionalString(String keyword, String value) {
		return value != null ? add(Sexpr.stringWithName(keyword, value)) : this;
	}

	public SexprBuilder optionalNumber(String keyword, Double value) {
		return value != null ? add(Sexpr.numberWithName(keyword, value)) : this;
	}

	public Sexpr.ListNode build() {
		return Sexpr.list(children);
	}
}
